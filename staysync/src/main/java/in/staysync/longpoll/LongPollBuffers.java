package in.staysync.longpoll;

import in.staysync.config.LongPollConfig;
import in.staysync.domain.common.Channel;
import in.staysync.domain.event.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One {@link LongPollBuffer} per channel, sharing a timer thread and a periodic sweep.
 */
public final class LongPollBuffers implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LongPollBuffers.class);

    private final Map<Channel, LongPollBuffer> buffers = new EnumMap<>(Channel.class);
    private final LongPollConfig config;
    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> sweepTask;

    public LongPollBuffers(LongPollConfig config) {
        this(config, Clock.systemUTC());
    }

    public LongPollBuffers(LongPollConfig config, Clock clock) {
        this.config = config;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "longpoll-timer");
            t.setDaemon(true);
            return t;
        });
        for (Channel channel : Channel.values()) {
            buffers.put(channel, new LongPollBuffer(channel, config, scheduler, clock));
        }
    }

    public synchronized void start() {
        if (sweepTask != null) {
            return;
        }
        long interval = config.eventTtl().toMillis();
        sweepTask = scheduler.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[LongPoll] Started {} channel buffers (cap {}, ttl {}s, timeout {}s)",
            buffers.size(), config.maxBufferSize(), config.eventTtl().toSeconds(), config.pollTimeout().toSeconds());
    }

    public LongPollBuffer forChannel(Channel channel) {
        return buffers.get(channel);
    }

    public void push(Channel channel, DomainEvent event) {
        buffers.get(channel).push(event.tenantId(), event);
    }

    public void sweep() {
        try {
            int evicted = 0;
            for (LongPollBuffer buffer : buffers.values()) {
                evicted += buffer.sweep();
            }
            if (evicted > 0) {
                log.info("[LongPoll] Sweep evicted {} idle tenant buffers", evicted);
            }
        } catch (Exception e) {
            log.error("[LongPoll] Sweep failed", e);
        }
    }

    public Map<String, LongPollStats> getStats() {
        Map<String, LongPollStats> stats = new LinkedHashMap<>();
        for (Map.Entry<Channel, LongPollBuffer> e : buffers.entrySet()) {
            stats.put(e.getKey().wireName(), e.getValue().getStats());
        }
        return stats;
    }

    @Override
    public void close() {
        ScheduledFuture<?> task = sweepTask;
        if (task != null) {
            task.cancel(false);
        }
        for (LongPollBuffer buffer : buffers.values()) {
            buffer.releaseAll();
        }
        scheduler.shutdownNow();
        log.info("[LongPoll] Closed");
    }
}
