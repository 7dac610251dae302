package in.staysync.engine.registry;

import in.staysync.domain.common.Channel;
import in.staysync.domain.common.ConnectionState;
import in.staysync.domain.common.Identity;
import in.staysync.engine.router.KeepAlive;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One live consumer session.
 *
 * Owned by the {@link ConnectionRegistry} from registration until teardown. The outstanding
 * counter is only changed by CAS; live messages arriving while the connection is still replaying
 * are held here and released in order once replay is done.
 */
public final class Connection {

    /** Result of offering a live message to a connection that may still be replaying. */
    public enum Deferral { NOT_DEFERRED, DEFERRED, OVERFLOW }

    /** Live message held back during replay. */
    public record HeldMessage(Channel channel, long seq, Outbound outbound) {}

    private final String id;
    private final long tenantId;
    private final long actorId;
    private final String label;
    private final Set<Channel> channels;
    private final Long propertyFilter;
    private final ConnectionSink sink;
    private final int maxOutstanding;
    private final Instant connectedAt;
    private volatile Instant lastActivity;

    private final AtomicInteger outstanding = new AtomicInteger();
    private final AtomicInteger consecutiveDrops = new AtomicInteger();
    private final AtomicBoolean quarantined = new AtomicBoolean();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private volatile KeepAlive keepAlive;

    private final Object replayLock = new Object();
    private final ArrayDeque<HeldMessage> held = new ArrayDeque<>();
    private boolean replaying = true;   // guarded by replayLock
    private volatile Map<Channel, Long> replayedThrough = Map.of();

    public Connection(Identity identity, Set<Channel> channels, Long propertyFilter,
                      ConnectionSink sink, int maxOutstanding) {
        this(UUID.randomUUID().toString(), identity, channels, propertyFilter, sink, maxOutstanding);
    }

    public Connection(String id, Identity identity, Set<Channel> channels, Long propertyFilter,
                      ConnectionSink sink, int maxOutstanding) {
        if (channels == null || channels.isEmpty()) {
            throw new IllegalArgumentException("Connection needs at least one channel");
        }
        this.id = id;
        this.tenantId = identity.tenantId();
        this.actorId = identity.actorId();
        this.label = identity.label();
        this.channels = Collections.unmodifiableSet(EnumSet.copyOf(channels));
        this.propertyFilter = propertyFilter;
        this.sink = sink;
        this.maxOutstanding = maxOutstanding;
        this.connectedAt = Instant.now();
        this.lastActivity = connectedAt;
    }

    public String getId() {
        return id;
    }

    public long getTenantId() {
        return tenantId;
    }

    public long getActorId() {
        return actorId;
    }

    public String getLabel() {
        return label;
    }

    public Set<Channel> getChannels() {
        return channels;
    }

    public Long getPropertyFilter() {
        return propertyFilter;
    }

    public ConnectionSink getSink() {
        return sink;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void touch() {
        this.lastActivity = Instant.now();
    }

    public boolean subscribesTo(Channel channel) {
        return channels.contains(channel);
    }

    // ═══════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isActive() {
        return state.get() == ConnectionState.ACTIVE;
    }

    /**
     * Atomic state change; false if the connection was not in {@code expected}.
     */
    public boolean transition(ConnectionState expected, ConnectionState next) {
        return state.compareAndSet(expected, next);
    }

    /**
     * Move to CLOSING from any live state. Only the first caller wins.
     */
    public boolean beginClose() {
        while (true) {
            ConnectionState current = state.get();
            if (current == ConnectionState.CLOSING || current == ConnectionState.CLOSED) {
                return false;
            }
            if (state.compareAndSet(current, ConnectionState.CLOSING)) {
                return true;
            }
        }
    }

    public void attachKeepAlive(KeepAlive keepAlive) {
        this.keepAlive = keepAlive;
    }

    public void stopKeepAlive() {
        KeepAlive k = keepAlive;
        if (k != null) {
            k.stop();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Backpressure
    // ═══════════════════════════════════════════════════════════════

    public int getOutstanding() {
        return outstanding.get();
    }

    public int getMaxOutstanding() {
        return maxOutstanding;
    }

    /**
     * Reserve one outstanding slot unless the connection is at its maximum.
     */
    public boolean tryReserve() {
        while (true) {
            int current = outstanding.get();
            if (current >= maxOutstanding) {
                return false;
            }
            if (outstanding.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Reserve a slot regardless of the maximum. Used for replay and control frames.
     */
    public void forceReserve() {
        outstanding.incrementAndGet();
    }

    public void release() {
        outstanding.updateAndGet(n -> n > 0 ? n - 1 : 0);
    }

    /**
     * @return consecutive drops including this one
     */
    public int recordDrop() {
        return consecutiveDrops.incrementAndGet();
    }

    public void resetDrops() {
        consecutiveDrops.set(0);
    }

    public int getConsecutiveDrops() {
        return consecutiveDrops.get();
    }

    /**
     * Flag the connection as quarantined. Only the first caller gets true.
     */
    public boolean markQuarantined() {
        return quarantined.compareAndSet(false, true);
    }

    public boolean isQuarantined() {
        return quarantined.get();
    }

    // ═══════════════════════════════════════════════════════════════
    // Replay gating
    // ═══════════════════════════════════════════════════════════════

    public Deferral deferIfReplaying(Channel channel, long seq, Outbound outbound) {
        synchronized (replayLock) {
            if (!replaying) {
                return Deferral.NOT_DEFERRED;
            }
            if (held.size() >= maxOutstanding) {
                return Deferral.OVERFLOW;
            }
            held.addLast(new HeldMessage(channel, seq, outbound));
            return Deferral.DEFERRED;
        }
    }

    /**
     * End the replay phase: remember the replayed high-water marks, hand every held message
     * newer than the mark of its channel to {@code release} in arrival order, then let live
     * traffic through.
     */
    public void finishReplay(Map<Channel, Long> highWater, Consumer<HeldMessage> release) {
        synchronized (replayLock) {
            replayedThrough = Map.copyOf(highWater);
            HeldMessage m;
            while ((m = held.pollFirst()) != null) {
                long mark = highWater.getOrDefault(m.channel(), 0L);
                if (m.seq() > mark) {
                    release.accept(m);
                }
            }
            replaying = false;
        }
    }

    /**
     * Highest sequence number of the channel the client received by replay, 0 when nothing was
     * replayed. Events at or below it are not sent again.
     */
    public long replayedThrough(Channel channel) {
        return replayedThrough.getOrDefault(channel, 0L);
    }

    public void discardHeld() {
        synchronized (replayLock) {
            held.clear();
        }
    }

    public boolean isReplaying() {
        synchronized (replayLock) {
            return replaying;
        }
    }

    public int heldCount() {
        synchronized (replayLock) {
            return held.size();
        }
    }

    @Override
    public String toString() {
        return "Connection[" + id + " tenant=" + tenantId + " actor=" + actorId + " " + state.get() + "]";
    }
}
