package in.staysync.metrics;

import in.staysync.domain.common.Channel;

/**
 * Delivery engine metrics for monitoring and alerting.
 *
 * Implementations must be thread-safe; every method is called from producer,
 * scheduler and I/O threads concurrently.
 */
public interface StreamMetrics {

    void recordConnectionOpened();

    /**
     * @param reason short teardown reason, e.g. "client", "send_failure", "quarantine", "shutdown"
     */
    void recordConnectionClosed(String reason);

    void recordEventPublished(Channel channel);

    void recordPublishFailure(Channel channel);

    /**
     * Events handed to a connection sink, counted per recipient.
     */
    void recordEventsDelivered(Channel channel, int count);

    void recordBatchSent(Channel channel, boolean compressed);

    void recordEventsReplayed(Channel channel, int count);

    void recordConflation(int inputEvents, int outputEvents, long inputBytes, long outputBytes);

    void recordMessageDropped(Channel channel);

    void recordQuarantine();

    void recordSendFailure();

    /**
     * Point-in-time view for the JSON metrics endpoint.
     */
    StreamMetricsSnapshot snapshot();
}
