package in.staysync.engine.registry;

import in.staysync.domain.common.Channel;
import in.staysync.domain.common.ChannelCursor;
import in.staysync.domain.stream.StreamMessage;
import in.staysync.metrics.StreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out pool: every live connection grouped by tenant, plus a reference count per
 * (tenant, channel) so producers can tell whether anyone is listening.
 *
 * Delivery respects each connection's outstanding budget. A connection at its maximum has the
 * message dropped for it alone; after enough consecutive drops it is quarantined and reported to
 * the {@link DeliveryListener}, which tears it down. Send failures are reported the same way.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentHashMap<Long, Set<Connection>> byTenant = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ChannelCursor, Integer> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong droppedTotal = new AtomicLong();
    private final AtomicLong quarantinedTotal = new AtomicLong();

    private final StreamMetrics metrics;
    private final int quarantineAfterDrops;
    private volatile DeliveryListener listener;

    public ConnectionRegistry(StreamMetrics metrics, int quarantineAfterDrops) {
        this.metrics = metrics;
        this.quarantineAfterDrops = quarantineAfterDrops;
    }

    public void setDeliveryListener(DeliveryListener listener) {
        this.listener = listener;
    }

    public void register(Connection conn) {
        byTenant.compute(conn.getTenantId(), (k, set) -> {
            Set<Connection> s = set != null ? set : ConcurrentHashMap.newKeySet();
            s.add(conn);
            return s;
        });
        for (Channel channel : conn.getChannels()) {
            subscriptions.merge(ChannelCursor.of(conn.getTenantId(), channel), 1, Integer::sum);
        }
        log.info("[Registry] Registered {} channels={} filter={}",
            conn.getId(), conn.getChannels(), conn.getPropertyFilter());
    }

    /**
     * Remove a connection and release its channel references. Safe to call repeatedly.
     *
     * @return true if this call removed it
     */
    public boolean unregister(Connection conn) {
        boolean[] removed = new boolean[1];
        byTenant.computeIfPresent(conn.getTenantId(), (k, set) -> {
            removed[0] = set.remove(conn);
            return set.isEmpty() ? null : set;
        });
        if (!removed[0]) {
            return false;
        }
        for (Channel channel : conn.getChannels()) {
            subscriptions.computeIfPresent(ChannelCursor.of(conn.getTenantId(), channel),
                (k, count) -> count > 1 ? count - 1 : null);
        }
        log.info("[Registry] Unregistered {}", conn.getId());
        return true;
    }

    public boolean hasSubscribers(ChannelCursor cursor) {
        return subscriptions.containsKey(cursor);
    }

    public List<Connection> connections(long tenantId) {
        Set<Connection> set = byTenant.get(tenantId);
        return set == null ? Collections.emptyList() : new ArrayList<>(set);
    }

    public List<Connection> allConnections() {
        List<Connection> all = new ArrayList<>();
        for (Set<Connection> set : byTenant.values()) {
            all.addAll(set);
        }
        return all;
    }

    /**
     * Deliver to every active connection of the tenant subscribed to the channel.
     *
     * @param seq sequence number of the outbound message, used to discard held traffic already
     *            covered by a replay
     */
    public BroadcastResult broadcast(ChannelCursor cursor, long seq, Outbound outbound) {
        Set<Connection> set = byTenant.get(cursor.tenantId());
        if (set == null || set.isEmpty()) {
            return BroadcastResult.EMPTY;
        }

        int recipients = 0;
        int sent = 0;
        int dropped = 0;
        for (Connection conn : set) {
            if (!conn.isActive() || !conn.subscribesTo(cursor.channel())) {
                continue;
            }
            if (outbound.viewFor(conn.getPropertyFilter()) == null) {
                continue;
            }

            Connection.Deferral deferral = conn.deferIfReplaying(cursor.channel(), seq, outbound);
            if (deferral == Connection.Deferral.DEFERRED) {
                recipients++;
                sent++;
                continue;
            }
            if (deferral == Connection.Deferral.OVERFLOW) {
                recipients++;
                drop(conn, cursor.channel());
                dropped++;
                continue;
            }

            // Replay is over here, so its marks are final.
            OutboundView view = outbound.after(conn.replayedThrough(cursor.channel()))
                .viewFor(conn.getPropertyFilter());
            if (view == null) {
                continue;
            }
            recipients++;
            if (deliver(conn, cursor.channel(), view)) {
                sent++;
            } else {
                dropped++;
            }
        }
        return new BroadcastResult(recipients, sent, dropped);
    }

    /**
     * Release live messages held during replay, minus the events the replay already sent. Each
     * still goes through the outstanding check.
     */
    public void releaseHeld(Connection conn, Map<Channel, Long> highWater) {
        conn.finishReplay(highWater, held -> {
            OutboundView view = held.outbound()
                .after(highWater.getOrDefault(held.channel(), 0L))
                .viewFor(conn.getPropertyFilter());
            if (view != null) {
                deliver(conn, held.channel(), view);
            }
        });
    }

    /**
     * Send bypassing the outstanding limit: replay, ping, ack and error frames.
     */
    public CompletableFuture<Void> sendDirect(Connection conn, StreamMessage message) {
        conn.forceReserve();
        return send(conn, message, null, 0);
    }

    public RegistryStats getStats() {
        Map<Long, Integer> perTenant = new TreeMap<>();
        int total = 0;
        for (Map.Entry<Long, Set<Connection>> e : byTenant.entrySet()) {
            int n = e.getValue().size();
            perTenant.put(e.getKey(), n);
            total += n;
        }
        return new RegistryStats(total, perTenant.size(), subscriptions.size(), perTenant,
                                 droppedTotal.get(), quarantinedTotal.get());
    }

    private boolean deliver(Connection conn, Channel channel, OutboundView view) {
        if (!conn.tryReserve()) {
            drop(conn, channel);
            return false;
        }
        conn.resetDrops();
        send(conn, view.message(), channel, view.eventCount());
        return true;
    }

    private CompletableFuture<Void> send(Connection conn, StreamMessage message, Channel channel, int eventCount) {
        CompletableFuture<Void> future;
        try {
            future = conn.getSink().send(message);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((v, err) -> {
            conn.release();
            if (err != null) {
                metrics.recordSendFailure();
                log.error("[Registry] Send failed for {}: {}", conn.getId(), err.getMessage());
                DeliveryListener l = listener;
                if (l != null) {
                    l.onSendFailure(conn, err);
                }
            } else {
                conn.touch();
                if (channel != null) {
                    metrics.recordEventsDelivered(channel, eventCount);
                }
            }
        });
    }

    private void drop(Connection conn, Channel channel) {
        droppedTotal.incrementAndGet();
        metrics.recordMessageDropped(channel);
        int drops = conn.recordDrop();
        log.warn("[Registry] Dropped {} message for {} (outstanding={}, consecutive drops={})",
            channel, conn.getId(), conn.getOutstanding(), drops);

        if (drops >= quarantineAfterDrops && conn.markQuarantined()) {
            quarantinedTotal.incrementAndGet();
            metrics.recordQuarantine();
            log.warn("[Registry] Quarantining slow consumer {} after {} consecutive drops", conn.getId(), drops);
            DeliveryListener l = listener;
            if (l != null) {
                l.onQuarantine(conn);
            }
        }
    }
}
