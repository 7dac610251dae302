package in.staysync.longpoll;

public record LongPollStats(
    int tenants,
    int bufferedEvents,
    int waiters,
    long published,
    long delivered,
    long dropped,
    long timeouts,
    long waiterRejections
) {}
