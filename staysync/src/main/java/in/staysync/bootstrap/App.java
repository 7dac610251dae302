package in.staysync.bootstrap;

import in.staysync.auth.TokenVerifier;
import in.staysync.config.LongPollConfig;
import in.staysync.config.StreamConfig;
import in.staysync.util.Env;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * StaySync realtime delivery service.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== StaySync Realtime Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 9090);
        String jwtSecret = Env.get("JWT_SECRET", "staysync-secret-key-change-in-production");
        Duration jwtTtl = Duration.ofHours(Env.getInt("JWT_EXPIRATION_HOURS", 24));

        StreamConfig streamConfig = StreamConfig.fromEnv();
        LongPollConfig longPollConfig = LongPollConfig.fromEnv();
        log.info("✓ Config loaded: batch {}ms (max {} events), replay {}s / {} events, max outstanding {}",
            streamConfig.batchWindow().toMillis(), streamConfig.maxBatchSize(),
            streamConfig.replayWindow().toSeconds(), streamConfig.replayMaxEvents(), streamConfig.maxOutstanding());

        RealtimeServer server = new RealtimeServer(port, streamConfig, longPollConfig,
            new TokenVerifier(jwtSecret, jwtTtl), CollectorRegistry.defaultRegistry);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "shutdown"));
        server.start();

        log.info("✓ WebSocket stream: ws://localhost:{}/v2/realtime/stream", port);
    }

    private App() {}
}
