package in.staysync.config;

import in.staysync.util.Env;

import java.time.Duration;

/**
 * Delivery engine configuration, fixed at construction time.
 *
 * Usage:
 * <pre>
 * StreamConfig config = StreamConfig.builder()
 *     .batchWindow(Duration.ofMillis(50))
 *     .maxBatchSize(100)
 *     .conflationRolloutPercent(25)
 *     .build();
 * </pre>
 */
public record StreamConfig(
    int protocolVersion,
    Duration pingInterval,

    // Replay ledger
    Duration replayWindow,
    int replayMaxEvents,

    // Batching
    Duration batchWindow,
    Duration batchWindowMin,
    Duration batchWindowMax,
    int maxBatchSize,

    // Backpressure
    int maxOutstanding,
    int quarantineAfterDrops,

    // Housekeeping
    Duration cursorIdle,
    Duration sweepInterval,
    int schedulerThreads,

    // Payload shaping
    boolean conflationEnabled,
    int conflationRolloutPercent,
    boolean compressionEnabled,
    int compressionThresholdBytes
) {

    public static StreamConfig defaults() {
        return builder().build();
    }

    /**
     * Read configuration from environment variables (or system properties).
     */
    public static StreamConfig fromEnv() {
        StreamConfig d = defaults();
        return builder()
            .protocolVersion(Env.getInt("STREAM_PROTOCOL_VERSION", d.protocolVersion()))
            .pingInterval(Env.getMillis("STREAM_PING_INTERVAL_MS", d.pingInterval()))
            .replayWindow(Env.getMillis("STREAM_REPLAY_WINDOW_MS", d.replayWindow()))
            .replayMaxEvents(Env.getInt("STREAM_REPLAY_MAX_EVENTS", d.replayMaxEvents()))
            .batchWindow(Env.getMillis("STREAM_BATCH_WINDOW_MS", d.batchWindow()))
            .batchWindowMin(Env.getMillis("STREAM_BATCH_WINDOW_MIN_MS", d.batchWindowMin()))
            .batchWindowMax(Env.getMillis("STREAM_BATCH_WINDOW_MAX_MS", d.batchWindowMax()))
            .maxBatchSize(Env.getInt("STREAM_MAX_BATCH_SIZE", d.maxBatchSize()))
            .maxOutstanding(Env.getInt("STREAM_MAX_OUTSTANDING", d.maxOutstanding()))
            .quarantineAfterDrops(Env.getInt("STREAM_QUARANTINE_AFTER_DROPS", d.quarantineAfterDrops()))
            .cursorIdle(Env.getMillis("STREAM_CURSOR_IDLE_MS", d.cursorIdle()))
            .sweepInterval(Env.getMillis("STREAM_SWEEP_INTERVAL_MS", d.sweepInterval()))
            .schedulerThreads(Env.getInt("STREAM_SCHEDULER_THREADS", d.schedulerThreads()))
            .conflationEnabled(Env.getBool("STREAM_CONFLATION_ENABLED", d.conflationEnabled()))
            .conflationRolloutPercent(Env.getInt("STREAM_CONFLATION_ROLLOUT_PERCENT", d.conflationRolloutPercent()))
            .compressionEnabled(Env.getBool("STREAM_COMPRESSION_ENABLED", d.compressionEnabled()))
            .compressionThresholdBytes(Env.getInt("STREAM_COMPRESSION_THRESHOLD_BYTES", d.compressionThresholdBytes()))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for StreamConfig.
     */
    public static class Builder {
        private int protocolVersion = 1;
        private Duration pingInterval = Duration.ofSeconds(30);
        private Duration replayWindow = Duration.ofMinutes(5);
        private int replayMaxEvents = 1000;
        private Duration batchWindow = Duration.ofMillis(50);
        private Duration batchWindowMin = Duration.ofMillis(10);
        private Duration batchWindowMax = Duration.ofMillis(500);
        private int maxBatchSize = 100;
        private int maxOutstanding = 500;
        private int quarantineAfterDrops = 10;
        private Duration cursorIdle = Duration.ofMinutes(10);
        private Duration sweepInterval = Duration.ofMinutes(1);
        private int schedulerThreads = 2;
        private boolean conflationEnabled = true;
        private int conflationRolloutPercent = 100;
        private boolean compressionEnabled = true;
        private int compressionThresholdBytes = 1024;

        public Builder protocolVersion(int protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder pingInterval(Duration pingInterval) {
            this.pingInterval = positive(pingInterval, "Ping interval");
            return this;
        }

        public Builder replayWindow(Duration replayWindow) {
            this.replayWindow = positive(replayWindow, "Replay window");
            return this;
        }

        public Builder replayMaxEvents(int replayMaxEvents) {
            this.replayMaxEvents = atLeastOne(replayMaxEvents, "Replay max events");
            return this;
        }

        public Builder batchWindow(Duration batchWindow) {
            this.batchWindow = positive(batchWindow, "Batch window");
            return this;
        }

        public Builder batchWindowMin(Duration batchWindowMin) {
            this.batchWindowMin = positive(batchWindowMin, "Batch window floor");
            return this;
        }

        public Builder batchWindowMax(Duration batchWindowMax) {
            this.batchWindowMax = positive(batchWindowMax, "Batch window cap");
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = atLeastOne(maxBatchSize, "Max batch size");
            return this;
        }

        public Builder maxOutstanding(int maxOutstanding) {
            this.maxOutstanding = atLeastOne(maxOutstanding, "Max outstanding");
            return this;
        }

        public Builder quarantineAfterDrops(int quarantineAfterDrops) {
            this.quarantineAfterDrops = atLeastOne(quarantineAfterDrops, "Quarantine threshold");
            return this;
        }

        public Builder cursorIdle(Duration cursorIdle) {
            this.cursorIdle = positive(cursorIdle, "Cursor idle window");
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = positive(sweepInterval, "Sweep interval");
            return this;
        }

        public Builder schedulerThreads(int schedulerThreads) {
            this.schedulerThreads = atLeastOne(schedulerThreads, "Scheduler threads");
            return this;
        }

        public Builder conflationEnabled(boolean conflationEnabled) {
            this.conflationEnabled = conflationEnabled;
            return this;
        }

        public Builder conflationRolloutPercent(int conflationRolloutPercent) {
            if (conflationRolloutPercent < 0 || conflationRolloutPercent > 100) {
                throw new IllegalArgumentException("Conflation rollout must be within 0..100");
            }
            this.conflationRolloutPercent = conflationRolloutPercent;
            return this;
        }

        public Builder compressionEnabled(boolean compressionEnabled) {
            this.compressionEnabled = compressionEnabled;
            return this;
        }

        public Builder compressionThresholdBytes(int compressionThresholdBytes) {
            if (compressionThresholdBytes < 0) {
                throw new IllegalArgumentException("Compression threshold cannot be negative");
            }
            this.compressionThresholdBytes = compressionThresholdBytes;
            return this;
        }

        public StreamConfig build() {
            if (batchWindowMin.compareTo(batchWindowMax) > 0) {
                throw new IllegalArgumentException("Batch window floor cannot exceed its cap");
            }
            if (batchWindow.compareTo(batchWindowMin) < 0 || batchWindow.compareTo(batchWindowMax) > 0) {
                throw new IllegalArgumentException("Batch window must lie between its floor and cap");
            }
            return new StreamConfig(protocolVersion, pingInterval, replayWindow, replayMaxEvents,
                batchWindow, batchWindowMin, batchWindowMax, maxBatchSize, maxOutstanding,
                quarantineAfterDrops, cursorIdle, sweepInterval, schedulerThreads,
                conflationEnabled, conflationRolloutPercent, compressionEnabled, compressionThresholdBytes);
        }

        private static Duration positive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static int atLeastOne(int value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be at least 1");
            }
            return value;
        }
    }
}
