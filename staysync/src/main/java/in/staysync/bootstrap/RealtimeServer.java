package in.staysync.bootstrap;

import in.staysync.auth.TokenVerifier;
import in.staysync.config.LongPollConfig;
import in.staysync.config.StreamConfig;
import in.staysync.engine.router.SubscriptionRouter;
import in.staysync.longpoll.LongPollBuffers;
import in.staysync.metrics.PrometheusStreamMetrics;
import in.staysync.service.core.EventService;
import in.staysync.transport.http.LongPollHandler;
import in.staysync.transport.http.PrometheusMetricsHandler;
import in.staysync.transport.http.PublishHandler;
import in.staysync.transport.http.StreamMetricsHandler;
import in.staysync.transport.ws.StreamEndpoint;
import in.staysync.util.Json;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the delivery engine, long-poll buffers and HTTP/WebSocket transport into one server.
 */
public final class RealtimeServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RealtimeServer.class);

    private final int port;
    private final PrometheusStreamMetrics metrics;
    private final SubscriptionRouter router;
    private final LongPollBuffers longPoll;
    private final EventService eventService;
    private final TokenVerifier verifier;
    private final Undertow server;

    public RealtimeServer(int port, StreamConfig streamConfig, LongPollConfig longPollConfig,
                          TokenVerifier verifier, CollectorRegistry collectorRegistry) {
        this.port = port;
        this.verifier = verifier;
        this.metrics = new PrometheusStreamMetrics(collectorRegistry);
        this.router = new SubscriptionRouter(streamConfig, metrics);
        this.longPoll = new LongPollBuffers(longPollConfig);
        this.eventService = new EventService(router, longPoll);

        StreamEndpoint streamEndpoint = new StreamEndpoint(router, verifier, Json.MAPPER);
        StreamMetricsHandler monitoring = new StreamMetricsHandler(metrics, router.getRegistry(), longPoll);

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(collectorRegistry))
            .get("/api/health", monitoring::health)
            .get("/v2/realtime/metrics", monitoring::getMetrics)
            .get("/v2/realtime/stream", streamEndpoint.websocketHandler())
            .post("/v2/realtime/publish/{channel}", new PublishHandler(eventService, verifier))
            .get("/v1/{channel}/realtime/subscribe", new LongPollHandler(longPoll, verifier))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "StaySync realtime\n\n" +
                    "WS:   ws://localhost:" + port + "/v2/realtime/stream?token=<jwt>\n" +
                    "Poll: GET /v1/{channel}/realtime/subscribe\n" +
                    "Pub:  POST /v2/realtime/publish/{channel}\n" +
                    "Ops:  GET /api/health, /v2/realtime/metrics, /metrics\n"
                );
            });

        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        this.server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(corsHandler)
            .build();
    }

    public void start() {
        router.start();
        longPoll.start();
        server.start();
        log.info("StaySync realtime started on http://localhost:{}/", port);
    }

    @Override
    public void close() {
        log.info("Stopping StaySync realtime");
        server.stop();
        router.close();
        longPoll.close();
    }

    public EventService getEventService() {
        return eventService;
    }

    public SubscriptionRouter getRouter() {
        return router;
    }

    public TokenVerifier getVerifier() {
        return verifier;
    }
}
