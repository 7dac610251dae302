package in.staysync.engine.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.staysync.config.StreamConfig;
import in.staysync.domain.common.ChannelCursor;
import in.staysync.domain.event.DomainEvent;
import in.staysync.domain.event.EventEnvelope;
import in.staysync.engine.ledger.RecentEventLedger;
import in.staysync.engine.registry.BroadcastResult;
import in.staysync.engine.registry.ConnectionRegistry;
import in.staysync.engine.sequence.SequenceAllocator;
import in.staysync.metrics.StreamMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Groups events per (tenant, channel) into adaptive time windows and flushes each window as one
 * {@code batch} message.
 *
 * Every cursor has a lane with its own lock. Sequencing, ledger recording, appending and flushing
 * all happen under that lock, so a batch's sequence number is always above the sequence numbers of
 * the events it carries and batches of one cursor reach each connection in order.
 *
 * Window adaptation after each flush: a batch at 80% of the max size or more doubles the window
 * (up to the cap), one at 10% or less halves it (down to the floor).
 */
public final class BatchingEngine {
    private static final Logger log = LoggerFactory.getLogger(BatchingEngine.class);

    private final ConcurrentHashMap<ChannelCursor, Lane> lanes = new ConcurrentHashMap<>();

    private final StreamConfig config;
    private final SequenceAllocator allocator;
    private final RecentEventLedger ledger;
    private final ConnectionRegistry registry;
    private final Conflater conflater;
    private final PayloadCompressor compressor;
    private final RolloutPolicy rollout;
    private final ObjectMapper mapper;
    private final StreamMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public BatchingEngine(StreamConfig config, SequenceAllocator allocator, RecentEventLedger ledger,
                          ConnectionRegistry registry, RolloutPolicy rollout, ObjectMapper mapper,
                          StreamMetrics metrics, ScheduledExecutorService scheduler, Clock clock) {
        this.config = config;
        this.allocator = allocator;
        this.ledger = ledger;
        this.registry = registry;
        this.conflater = new Conflater(mapper);
        this.compressor = config.compressionEnabled() ? new PayloadCompressor() : null;
        this.rollout = rollout;
        this.mapper = mapper;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Sequence and record an event, then queue it for delivery if the cursor has subscribers.
     * Without subscribers the event only goes to the ledger for a later replay.
     *
     * @return the sequenced envelope
     */
    public EventEnvelope append(ChannelCursor cursor, DomainEvent event) {
        while (true) {
            Instant now = clock.instant();
            Lane lane = lanes.computeIfAbsent(cursor, k -> new Lane(config.batchWindow().toMillis(), now));
            lane.lock.lock();
            try {
                if (lane.retired) {
                    continue;   // swept between lookup and lock
                }
                lane.lastAccess = now;

                EventEnvelope envelope = EventEnvelope.of(cursor.channel(), allocator.next(cursor), event, now);
                ledger.record(envelope);
                // Decided after recording: a connection registering later finds the event in the ledger.
                if (!registry.hasSubscribers(cursor)) {
                    return envelope;
                }

                PendingBatch batch = lane.pending;
                if (batch == null) {
                    batch = new PendingBatch();
                    lane.pending = batch;
                    PendingBatch armed = batch;
                    batch.timer = scheduler.schedule(() -> onWindowClosed(cursor, lane, armed),
                        lane.windowMs, TimeUnit.MILLISECONDS);
                }
                batch.events.add(envelope);

                if (batch.events.size() >= config.maxBatchSize()) {
                    flushLocked(cursor, lane);
                }
                return envelope;
            } finally {
                lane.lock.unlock();
            }
        }
    }

    /**
     * Flush every pending batch now. Used on shutdown.
     */
    public int flushAll() {
        int flushed = 0;
        for (Map.Entry<ChannelCursor, Lane> e : lanes.entrySet()) {
            Lane lane = e.getValue();
            lane.lock.lock();
            try {
                if (lane.pending != null) {
                    flushLocked(e.getKey(), lane);
                    flushed++;
                }
            } finally {
                lane.lock.unlock();
            }
        }
        return flushed;
    }

    /**
     * Retire lanes with nothing pending and no traffic for the idle window.
     */
    public int sweepIdle(Duration idle) {
        Instant cutoff = clock.instant().minus(idle);
        List<ChannelCursor> retired = new ArrayList<>();
        for (Map.Entry<ChannelCursor, Lane> e : lanes.entrySet()) {
            Lane lane = e.getValue();
            lane.lock.lock();
            try {
                if (lane.pending == null && lane.lastAccess.isBefore(cutoff)) {
                    lane.retired = true;
                    lanes.remove(e.getKey(), lane);
                    retired.add(e.getKey());
                }
            } finally {
                lane.lock.unlock();
            }
        }
        if (!retired.isEmpty()) {
            log.debug("[Batching] Retired {} idle lanes", retired.size());
        }
        return retired.size();
    }

    /**
     * Current window of a cursor, or the configured default when it has no lane.
     */
    public Duration windowOf(ChannelCursor cursor) {
        Lane lane = lanes.get(cursor);
        if (lane == null) {
            return config.batchWindow();
        }
        lane.lock.lock();
        try {
            return Duration.ofMillis(lane.windowMs);
        } finally {
            lane.lock.unlock();
        }
    }

    public int laneCount() {
        return lanes.size();
    }

    public int pendingEvents() {
        int n = 0;
        for (Lane lane : lanes.values()) {
            lane.lock.lock();
            try {
                if (lane.pending != null) {
                    n += lane.pending.events.size();
                }
            } finally {
                lane.lock.unlock();
            }
        }
        return n;
    }

    private void onWindowClosed(ChannelCursor cursor, Lane lane, PendingBatch batch) {
        lane.lock.lock();
        try {
            // A size flush may already have taken this batch.
            if (lane.pending == batch) {
                flushLocked(cursor, lane);
            }
        } catch (RuntimeException e) {
            log.error("[Batching] Timed flush failed for {}", cursor, e);
        } finally {
            lane.lock.unlock();
        }
    }

    private void flushLocked(ChannelCursor cursor, Lane lane) {
        PendingBatch batch = lane.pending;
        lane.pending = null;
        if (batch.timer != null) {
            batch.timer.cancel(false);
        }

        List<EventEnvelope> events = batch.events;
        int size = events.size();
        long seq = allocator.next(cursor);

        List<EventEnvelope> outgoing = events;
        if (config.conflationEnabled() && size > 1 && rollout.includes(cursor.tenantId())) {
            try {
                ConflationResult result = conflater.conflate(events);
                metrics.recordConflation(result.inputCount(), result.outputCount(),
                    result.inputBytes(), result.outputBytes());
                outgoing = result.envelopes();
                if (result.outputCount() < result.inputCount()) {
                    log.debug("[Batching] {} conflated {} -> {} events, saved {} bytes",
                        cursor, result.inputCount(), result.outputCount(), result.bytesSaved());
                }
            } catch (RuntimeException e) {
                log.warn("[Batching] Conflation failed for {} seq={}, sending unconflated: {}",
                    cursor, seq, e.getMessage());
            }
        }

        OutboundBatch outbound = new OutboundBatch(cursor.channel(), seq, outgoing, mapper,
            compressor, config.compressionThresholdBytes());
        try {
            BroadcastResult result = registry.broadcast(cursor, seq, outbound);
            if (result.recipients() > 0) {
                metrics.recordBatchSent(cursor.channel(), outbound.wasCompressed());
            }
            log.debug("[Batching] Flushed {} seq={} events={} recipients={} dropped={}",
                cursor, seq, outgoing.size(), result.recipients(), result.dropped());
        } catch (RuntimeException e) {
            log.error("[Batching] Broadcast failed for {} seq={}", cursor, seq, e);
        }

        adaptWindow(lane, size);
    }

    private void adaptWindow(Lane lane, int batchSize) {
        int max = config.maxBatchSize();
        long previous = lane.windowMs;
        if (batchSize * 10 >= max * 8) {
            lane.windowMs = Math.min(previous * 2, config.batchWindowMax().toMillis());
        } else if (batchSize * 10 <= max) {
            lane.windowMs = Math.max(previous / 2, config.batchWindowMin().toMillis());
        }
    }

    private static final class Lane {
        private final ReentrantLock lock = new ReentrantLock();
        private PendingBatch pending;            // guarded by lock
        private long windowMs;                   // guarded by lock
        private volatile Instant lastAccess;
        private boolean retired;                 // guarded by lock

        Lane(long windowMs, Instant now) {
            this.windowMs = windowMs;
            this.lastAccess = now;
        }
    }

    private static final class PendingBatch {
        private final List<EventEnvelope> events = new ArrayList<>();
        private ScheduledFuture<?> timer;
    }
}
