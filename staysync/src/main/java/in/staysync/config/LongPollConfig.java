package in.staysync.config;

import in.staysync.util.Env;

import java.time.Duration;

/**
 * Long-poll fallback buffer tunables.
 */
public record LongPollConfig(
    int maxBufferSize,
    Duration eventTtl,
    Duration pollTimeout,
    int maxWaitersPerTenant,
    Duration tenantIdleEvict
) {

    public LongPollConfig {
        if (maxBufferSize < 1) {
            throw new IllegalArgumentException("Buffer size must be at least 1");
        }
        if (maxWaitersPerTenant < 1) {
            throw new IllegalArgumentException("Waiter cap must be at least 1");
        }
        if (eventTtl.isNegative() || eventTtl.isZero()
                || pollTimeout.isNegative() || pollTimeout.isZero()
                || tenantIdleEvict.isNegative() || tenantIdleEvict.isZero()) {
            throw new IllegalArgumentException("Long-poll durations must be positive");
        }
    }

    public static LongPollConfig defaults() {
        return new LongPollConfig(200, Duration.ofSeconds(25), Duration.ofSeconds(25), 5000, Duration.ofMinutes(2));
    }

    public static LongPollConfig fromEnv() {
        LongPollConfig d = defaults();
        return new LongPollConfig(
            Env.getInt("LONGPOLL_MAX_BUFFER_SIZE", d.maxBufferSize()),
            Env.getMillis("LONGPOLL_EVENT_TTL_MS", d.eventTtl()),
            Env.getMillis("LONGPOLL_TIMEOUT_MS", d.pollTimeout()),
            Env.getInt("LONGPOLL_MAX_WAITERS", d.maxWaitersPerTenant()),
            Env.getMillis("LONGPOLL_IDLE_EVICT_MS", d.tenantIdleEvict())
        );
    }
}
