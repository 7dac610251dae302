package in.staysync.metrics;

import java.util.Map;

/**
 * JSON view of the engine counters.
 */
public record StreamMetricsSnapshot(
    long activeConnections,
    long totalConnections,
    Map<String, Long> eventsPublished,
    Map<String, Long> eventsDelivered,
    long batchesSent,
    long batchesCompressed,
    double compressedBatchRatio,
    long conflationInputEvents,
    long conflationOutputEvents,
    long conflationBytesSaved,
    long droppedMessages,
    long quarantinedConnections,
    long replayedEvents,
    long sendFailures,
    long publishFailures
) {}
