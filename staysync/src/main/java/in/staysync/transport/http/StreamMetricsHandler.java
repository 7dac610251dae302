package in.staysync.transport.http;

import in.staysync.engine.registry.ConnectionRegistry;
import in.staysync.engine.registry.RegistryStats;
import in.staysync.longpoll.LongPollBuffers;
import in.staysync.metrics.StreamMetrics;
import in.staysync.metrics.StreamMetricsSnapshot;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON monitoring endpoints: engine metrics and liveness.
 */
public final class StreamMetricsHandler {
    private static final Logger log = LoggerFactory.getLogger(StreamMetricsHandler.class);

    private final StreamMetrics metrics;
    private final ConnectionRegistry registry;
    private final LongPollBuffers longPoll;
    private final Instant startedAt = Instant.now();

    public StreamMetricsHandler(StreamMetrics metrics, ConnectionRegistry registry, LongPollBuffers longPoll) {
        this.metrics = metrics;
        this.registry = registry;
        this.longPoll = longPoll;
    }

    /**
     * GET /v2/realtime/metrics
     */
    public void getMetrics(HttpServerExchange exchange) {
        try {
            StreamMetricsSnapshot snapshot = metrics.snapshot();
            RegistryStats stats = registry.getStats();

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("timestamp", Instant.now());
            body.put("activeConnections", stats.totalConnections());
            body.put("totalConnections", snapshot.totalConnections());
            body.put("tenants", stats.tenants());
            body.put("activeSubscriptions", stats.activeSubscriptions());
            body.put("eventsPublished", snapshot.eventsPublished());
            body.put("eventsDelivered", snapshot.eventsDelivered());
            body.put("batchesSent", snapshot.batchesSent());
            body.put("compressedBatchRatio", snapshot.compressedBatchRatio());

            Map<String, Object> conflation = new LinkedHashMap<>();
            conflation.put("inputEvents", snapshot.conflationInputEvents());
            conflation.put("outputEvents", snapshot.conflationOutputEvents());
            conflation.put("bytesSaved", snapshot.conflationBytesSaved());
            body.put("conflation", conflation);

            body.put("droppedMessages", stats.droppedTotal());
            body.put("quarantinedConnections", stats.quarantinedTotal());
            body.put("replayedEvents", snapshot.replayedEvents());
            body.put("sendFailures", snapshot.sendFailures());
            body.put("publishFailures", snapshot.publishFailures());
            body.put("connectionsPerTenant", stats.connectionsPerTenant());
            body.put("longPoll", longPoll.getStats());

            HttpResponses.sendJson(exchange, StatusCodes.OK, body);
        } catch (RuntimeException e) {
            log.error("Failed to get realtime metrics: {}", e.getMessage(), e);
            HttpResponses.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR,
                "Failed to get realtime metrics: " + e.getMessage());
        }
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("ts", Instant.now());
        body.put("uptimeSeconds", Instant.now().getEpochSecond() - startedAt.getEpochSecond());
        body.put("connections", registry.getStats().totalConnections());
        HttpResponses.sendJson(exchange, StatusCodes.OK, body);
    }
}
