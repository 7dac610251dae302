package in.staysync.metrics;

import in.staysync.domain.common.Channel;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prometheus implementation of StreamMetrics.
 *
 * Key Metrics:
 * - realtime_connections_active - Currently open stream connections
 * - realtime_connections_closed_total{reason} - Teardowns by reason
 * - realtime_events_delivered_total{channel} - Events handed to sinks, per recipient
 * - realtime_batches_total{channel, encoding} - Flushed batches, plain or gzip
 * - realtime_conflation_events_total{stage} - Events before/after conflation
 * - realtime_dropped_messages_total{channel} - Messages dropped by backpressure
 *
 * Usage:
 * <pre>
 * PrometheusStreamMetrics metrics = new PrometheusStreamMetrics();
 * server.addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusStreamMetrics implements StreamMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusStreamMetrics.class);

    private final CollectorRegistry registry;

    // Connection metrics
    private final Counter connectionsOpened;
    private final Counter connectionsClosed;
    private final Gauge activeConnections;
    private final Counter quarantined;
    private final Counter sendFailures;

    // Event flow
    private final Counter eventsPublished;
    private final Counter publishFailures;
    private final Counter eventsDelivered;
    private final Counter eventsReplayed;
    private final Counter droppedMessages;

    // Payload shaping
    private final Counter batches;
    private final Counter conflationEvents;
    private final Counter conflationBytes;

    public PrometheusStreamMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusStreamMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.connectionsOpened = Counter.build()
            .name("realtime_connections_opened_total")
            .help("Total number of stream connections accepted")
            .register(registry);

        this.connectionsClosed = Counter.build()
            .name("realtime_connections_closed_total")
            .help("Total number of stream connections torn down")
            .labelNames("reason")
            .register(registry);

        this.activeConnections = Gauge.build()
            .name("realtime_connections_active")
            .help("Currently open stream connections")
            .register(registry);

        this.quarantined = Counter.build()
            .name("realtime_quarantined_connections_total")
            .help("Connections evicted after repeated backpressure drops")
            .register(registry);

        this.sendFailures = Counter.build()
            .name("realtime_send_failures_total")
            .help("Failed sends that tore down a connection")
            .register(registry);

        this.eventsPublished = Counter.build()
            .name("realtime_events_published_total")
            .help("Events accepted from producers")
            .labelNames("channel")
            .register(registry);

        this.publishFailures = Counter.build()
            .name("realtime_publish_failures_total")
            .help("Producer publishes that failed")
            .labelNames("channel")
            .register(registry);

        this.eventsDelivered = Counter.build()
            .name("realtime_events_delivered_total")
            .help("Events handed to connection sinks, counted per recipient")
            .labelNames("channel")
            .register(registry);

        this.eventsReplayed = Counter.build()
            .name("realtime_events_replayed_total")
            .help("Events replayed to reconnecting clients")
            .labelNames("channel")
            .register(registry);

        this.droppedMessages = Counter.build()
            .name("realtime_dropped_messages_total")
            .help("Messages dropped for a connection at its outstanding limit")
            .labelNames("channel")
            .register(registry);

        this.batches = Counter.build()
            .name("realtime_batches_total")
            .help("Flushed batches by encoding")
            .labelNames("channel", "encoding")
            .register(registry);

        this.conflationEvents = Counter.build()
            .name("realtime_conflation_events_total")
            .help("Events entering and leaving conflation")
            .labelNames("stage")
            .register(registry);

        this.conflationBytes = Counter.build()
            .name("realtime_conflation_bytes_total")
            .help("Serialized event bytes entering and leaving conflation")
            .labelNames("stage")
            .register(registry);

        log.info("[Metrics] Prometheus stream metrics registered");
    }

    @Override
    public void recordConnectionOpened() {
        connectionsOpened.inc();
        activeConnections.inc();
    }

    @Override
    public void recordConnectionClosed(String reason) {
        connectionsClosed.labels(reason).inc();
        activeConnections.dec();
    }

    @Override
    public void recordEventPublished(Channel channel) {
        eventsPublished.labels(channel.wireName()).inc();
    }

    @Override
    public void recordPublishFailure(Channel channel) {
        publishFailures.labels(channel.wireName()).inc();
    }

    @Override
    public void recordEventsDelivered(Channel channel, int count) {
        if (count > 0) {
            eventsDelivered.labels(channel.wireName()).inc(count);
        }
    }

    @Override
    public void recordBatchSent(Channel channel, boolean compressed) {
        batches.labels(channel.wireName(), compressed ? "gzip" : "plain").inc();
    }

    @Override
    public void recordEventsReplayed(Channel channel, int count) {
        if (count > 0) {
            eventsReplayed.labels(channel.wireName()).inc(count);
        }
    }

    @Override
    public void recordConflation(int inputEvents, int outputEvents, long inputBytes, long outputBytes) {
        conflationEvents.labels("input").inc(inputEvents);
        conflationEvents.labels("output").inc(outputEvents);
        conflationBytes.labels("input").inc(inputBytes);
        conflationBytes.labels("output").inc(outputBytes);
    }

    @Override
    public void recordMessageDropped(Channel channel) {
        droppedMessages.labels(channel.wireName()).inc();
    }

    @Override
    public void recordQuarantine() {
        quarantined.inc();
    }

    @Override
    public void recordSendFailure() {
        sendFailures.inc();
    }

    @Override
    public StreamMetricsSnapshot snapshot() {
        Map<String, Long> published = new LinkedHashMap<>();
        Map<String, Long> delivered = new LinkedHashMap<>();
        long dropped = 0;
        long replayed = 0;
        long publishFailed = 0;
        long plain = 0;
        long gzip = 0;
        for (Channel channel : Channel.values()) {
            String c = channel.wireName();
            published.put(c, (long) eventsPublished.labels(c).get());
            delivered.put(c, (long) eventsDelivered.labels(c).get());
            dropped += (long) droppedMessages.labels(c).get();
            replayed += (long) eventsReplayed.labels(c).get();
            publishFailed += (long) publishFailures.labels(c).get();
            plain += (long) batches.labels(c, "plain").get();
            gzip += (long) batches.labels(c, "gzip").get();
        }
        long totalBatches = plain + gzip;
        long inBytes = (long) conflationBytes.labels("input").get();
        long outBytes = (long) conflationBytes.labels("output").get();

        return new StreamMetricsSnapshot(
            (long) activeConnections.get(),
            (long) connectionsOpened.get(),
            published,
            delivered,
            totalBatches,
            gzip,
            totalBatches == 0 ? 0.0 : (double) gzip / totalBatches,
            (long) conflationEvents.labels("input").get(),
            (long) conflationEvents.labels("output").get(),
            Math.max(0, inBytes - outBytes),
            dropped,
            (long) quarantined.get(),
            replayed,
            (long) sendFailures.get(),
            publishFailed
        );
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
