package in.staysync.engine.router;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.staysync.config.StreamConfig;
import in.staysync.domain.common.Channel;
import in.staysync.domain.common.ChannelCursor;
import in.staysync.domain.common.ConnectionState;
import in.staysync.domain.common.ErrorCode;
import in.staysync.domain.common.Identity;
import in.staysync.domain.event.DomainEvent;
import in.staysync.domain.event.EventEnvelope;
import in.staysync.domain.stream.Handshake;
import in.staysync.domain.stream.StreamMessage;
import in.staysync.engine.batch.BatchingEngine;
import in.staysync.engine.batch.RolloutPolicy;
import in.staysync.engine.ledger.RecentEventLedger;
import in.staysync.engine.registry.Connection;
import in.staysync.engine.registry.ConnectionRegistry;
import in.staysync.engine.registry.ConnectionSink;
import in.staysync.engine.registry.DeliveryListener;
import in.staysync.engine.registry.Outbound;
import in.staysync.engine.registry.OutboundView;
import in.staysync.engine.sequence.SequenceAllocator;
import in.staysync.metrics.StreamMetrics;
import in.staysync.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the delivery engine.
 *
 * Producers call {@link #publish}: the event is sequenced, recorded in the ledger and queued in its
 * cursor's batch lane. Consumers come in through {@link #open}: the handshake is validated, the
 * connection registered, missed events replayed from the ledger, held live traffic released, and a
 * keep-alive started. Any delivery failure or quarantine ends in {@link #close(Connection, String)}.
 *
 * Usage:
 * <pre>
 * SubscriptionRouter router = new SubscriptionRouter(StreamConfig.fromEnv(), metrics);
 * router.start();
 * router.publish(Channel.FINANCE, event);
 * Connection conn = router.open(handshake, identity, sink);
 * router.close();
 * </pre>
 */
public final class SubscriptionRouter implements DeliveryListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRouter.class);

    private final StreamConfig config;
    private final StreamMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final SequenceAllocator allocator;
    private final RecentEventLedger ledger;
    private final ConnectionRegistry registry;
    private final BatchingEngine engine;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> sweepTask;

    public SubscriptionRouter(StreamConfig config, StreamMetrics metrics) {
        this(config, metrics, Json.MAPPER, Clock.systemUTC(), newScheduler(config.schedulerThreads()));
    }

    public SubscriptionRouter(StreamConfig config, StreamMetrics metrics, ObjectMapper mapper,
                              Clock clock, ScheduledExecutorService scheduler) {
        this.config = config;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.allocator = new SequenceAllocator(clock);
        this.ledger = new RecentEventLedger(config.replayWindow(), config.replayMaxEvents(), clock);
        this.registry = new ConnectionRegistry(metrics, config.quarantineAfterDrops());
        this.registry.setDeliveryListener(this);
        this.engine = new BatchingEngine(config, allocator, ledger, registry,
            RolloutPolicy.percentage(config.conflationRolloutPercent()), mapper, metrics, scheduler, clock);
    }

    /**
     * Named daemon threads shared by batch timers, keep-alives and the sweep.
     */
    public static ScheduledExecutorService newScheduler(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(threads, r -> {
            Thread t = new Thread(r, "realtime-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * Schedule the periodic sweep.
     */
    public synchronized void start() {
        if (sweepTask != null) {
            return;
        }
        long interval = config.sweepInterval().toMillis();
        sweepTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                sweep();
            } catch (Exception e) {
                log.error("[Router] Sweep failed", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[Router] Started (batch window {}ms, replay window {}s, ping every {}s)",
            config.batchWindow().toMillis(), config.replayWindow().toSeconds(), config.pingInterval().toSeconds());
    }

    // ═══════════════════════════════════════════════════════════════
    // Producer side
    // ═══════════════════════════════════════════════════════════════

    /**
     * Sequence, record and queue an event for delivery.
     *
     * @throws IllegalArgumentException if the event does not belong on the channel
     * @throws PublishException if the engine could not accept it
     */
    public EventEnvelope publish(Channel channel, DomainEvent event) {
        if (!event.deliverableOn(channel)) {
            throw new IllegalArgumentException(
                "Event for channel " + event.channel() + " cannot be published on " + channel);
        }
        if (closed.get()) {
            throw new PublishException(channel, event.tenantId(), "Router is closed");
        }

        ChannelCursor cursor = ChannelCursor.of(event.tenantId(), channel);
        try {
            EventEnvelope envelope = engine.append(cursor, event);
            metrics.recordEventPublished(channel);
            return envelope;
        } catch (RuntimeException e) {
            metrics.recordPublishFailure(channel);
            log.error("[Router] Publish failed for {} type={}", cursor, event.eventType(), e);
            throw new PublishException(channel, event.tenantId(), "Failed to publish " + event.eventType(), e);
        }
    }

    /**
     * Tell every subscriber of the cursor to refetch the given keys.
     */
    public void invalidate(long tenantId, Channel channel, List<String> keys) {
        OutboundView view = new OutboundView(StreamMessage.invalidate(channel, keys), 0);
        // Control traffic is never covered by a replay.
        registry.broadcast(ChannelCursor.of(tenantId, channel), Long.MAX_VALUE, Outbound.of(view));
    }

    // ═══════════════════════════════════════════════════════════════
    // Consumer side
    // ═══════════════════════════════════════════════════════════════

    /**
     * Validate a handshake and bring the connection up: register, replay, release held
     * traffic, acknowledge, start the keep-alive.
     *
     * @throws HandshakeException if the handshake is rejected; nothing is registered then
     */
    public Connection open(Handshake handshake, Identity identity, ConnectionSink sink) {
        if (closed.get()) {
            throw new HandshakeException(ErrorCode.INTERNAL, "Server is shutting down");
        }
        if (identity == null) {
            throw new HandshakeException(ErrorCode.UNAUTHENTICATED, "Authentication required");
        }
        Set<Channel> channels = validate(handshake);

        Connection conn = new Connection(identity, channels, handshake.propertyFilter(),
            sink, config.maxOutstanding());
        conn.transition(ConnectionState.CONNECTING, ConnectionState.ACTIVE);
        registry.register(conn);
        metrics.recordConnectionOpened();

        try {
            Map<Channel, Long> highWater = replay(conn, handshake.lastSeqOrZero());
            registry.releaseHeld(conn, highWater);
            registry.sendDirect(conn, StreamMessage.ack());

            KeepAlive keepAlive = new KeepAlive(conn.getId(), config.pingInterval(), scheduler,
                () -> registry.sendDirect(conn, StreamMessage.ping()),
                cause -> close(conn, "ping_failure"));
            conn.attachKeepAlive(keepAlive);
            keepAlive.start();
            if (!conn.isActive()) {
                keepAlive.stop();
            }
        } catch (RuntimeException e) {
            log.error("[Router] Failed to bring up {}", conn.getId(), e);
            close(conn, "handshake_failure");
            throw e;
        }

        log.info("[Router] Opened {} tenant={} actor={} channels={} lastSeq={}",
            conn.getId(), conn.getTenantId(), conn.getActorId(), channels, handshake.lastSeqOrZero());
        return conn;
    }

    /**
     * Tear a connection down. Idempotent: only the first call has any effect.
     */
    public void close(Connection conn, String reason) {
        if (!conn.beginClose()) {
            return;
        }
        conn.stopKeepAlive();
        conn.discardHeld();
        registry.unregister(conn);
        try {
            conn.getSink().close(reason);
        } catch (RuntimeException e) {
            log.warn("[Router] Error closing transport of {}: {}", conn.getId(), e.getMessage());
        }
        conn.transition(ConnectionState.CLOSING, ConnectionState.CLOSED);
        metrics.recordConnectionClosed(reason);
        log.info("[Router] Closed {} ({})", conn.getId(), reason);
    }

    @Override
    public void onSendFailure(Connection connection, Throwable cause) {
        close(connection, "send_failure");
    }

    @Override
    public void onQuarantine(Connection connection) {
        close(connection, "quarantine");
    }

    // ═══════════════════════════════════════════════════════════════
    // Housekeeping
    // ═══════════════════════════════════════════════════════════════

    /**
     * Trim the ledger, retire idle lanes and reclaim idle cursors nobody subscribes to.
     */
    public void sweep() {
        int expired = ledger.sweep();
        int lanes = engine.sweepIdle(config.cursorIdle());
        List<ChannelCursor> reclaimed = allocator.reclaimIdle(config.cursorIdle(), registry::hasSubscribers);
        for (ChannelCursor cursor : reclaimed) {
            ledger.evict(cursor);
        }
        if (expired > 0 || lanes > 0 || !reclaimed.isEmpty()) {
            log.info("[Router] Sweep: {} ledger entries expired, {} lanes retired, {} cursors reclaimed",
                expired, lanes, reclaimed.size());
        }
    }

    /**
     * Flush pending batches, close every connection and stop the scheduler.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("[Router] Shutting down");
        ScheduledFuture<?> task = sweepTask;
        if (task != null) {
            task.cancel(false);
        }

        int flushed = engine.flushAll();
        for (Connection conn : registry.allConnections()) {
            close(conn, "shutdown");
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Router] Shut down ({} batches flushed)", flushed);
    }

    public ConnectionRegistry getRegistry() {
        return registry;
    }

    public BatchingEngine getEngine() {
        return engine;
    }

    public SequenceAllocator getAllocator() {
        return allocator;
    }

    public RecentEventLedger getLedger() {
        return ledger;
    }

    private Set<Channel> validate(Handshake handshake) {
        if (handshake == null) {
            throw new HandshakeException(ErrorCode.INVALID_ARGUMENT, "Handshake is required");
        }
        if (handshake.protocolVersion() == null || handshake.protocolVersion() != config.protocolVersion()) {
            throw new HandshakeException(ErrorCode.INVALID_ARGUMENT,
                "Unsupported protocol version: " + handshake.protocolVersion());
        }
        if (handshake.channels() == null || handshake.channels().isEmpty()) {
            throw new HandshakeException(ErrorCode.INVALID_ARGUMENT, "At least one channel is required");
        }
        if (handshake.lastSeq() != null && handshake.lastSeq() < 0) {
            throw new HandshakeException(ErrorCode.INVALID_ARGUMENT, "lastSeq cannot be negative");
        }
        Set<Channel> channels = EnumSet.noneOf(Channel.class);
        for (String name : handshake.channels()) {
            Channel channel = Channel.lookup(name).orElseThrow(() ->
                new HandshakeException(ErrorCode.INVALID_ARGUMENT, "Unknown channel: " + name));
            channels.add(channel);
        }
        return channels;
    }

    /**
     * Send every ledger entry after {@code lastSeq} on each subscribed channel.
     *
     * @return per channel, the highest sequence number the client has now seen
     */
    private Map<Channel, Long> replay(Connection conn, long lastSeq) {
        Map<Channel, Long> highWater = new EnumMap<>(Channel.class);
        if (lastSeq <= 0) {
            return highWater;
        }
        for (Channel channel : conn.getChannels()) {
            ChannelCursor cursor = ChannelCursor.of(conn.getTenantId(), channel);
            // A reclaimed cursor restarted its numbering; the old lastSeq means nothing there.
            long mark = allocator.current(cursor) >= lastSeq ? lastSeq : 0L;

            List<RecentEventLedger.LedgerEntry> missed = ledger.since(cursor, lastSeq);
            int sent = 0;
            for (RecentEventLedger.LedgerEntry entry : missed) {
                mark = Math.max(mark, entry.seq());
                if (entry.envelope().visibleTo(conn.getPropertyFilter())) {
                    registry.sendDirect(conn, StreamMessage.event(entry.envelope()));
                    sent++;
                }
            }
            highWater.put(channel, mark);
            if (sent > 0) {
                metrics.recordEventsReplayed(channel, sent);
                log.info("[Router] Replayed {} events on {} to {} after seq {}", sent, cursor, conn.getId(), lastSeq);
            }
        }
        return highWater;
    }
}
