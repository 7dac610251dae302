package in.staysync.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StreamConfig and LongPollConfig.
 *
 * Tests:
 * - Defaults
 * - Builder validation
 * - Overrides from system properties
 * - Long-poll validation
 */
class StreamConfigTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("STREAM_MAX_BATCH_SIZE");
        System.clearProperty("STREAM_BATCH_WINDOW_MS");
        System.clearProperty("STREAM_CONFLATION_ENABLED");
        System.clearProperty("LONGPOLL_TIMEOUT_MS");
    }

    @Test
    void testDefaults() {
        StreamConfig config = StreamConfig.defaults();

        assertEquals(1, config.protocolVersion());
        assertEquals(Duration.ofSeconds(30), config.pingInterval());
        assertEquals(Duration.ofMinutes(5), config.replayWindow());
        assertEquals(Duration.ofMillis(50), config.batchWindow());
        assertEquals(Duration.ofMillis(10), config.batchWindowMin());
        assertEquals(Duration.ofMillis(500), config.batchWindowMax());
        assertEquals(100, config.maxBatchSize());
        assertEquals(1024, config.compressionThresholdBytes());
        assertTrue(config.conflationEnabled());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> StreamConfig.builder().pingInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> StreamConfig.builder().maxBatchSize(0));
        assertThrows(IllegalArgumentException.class, () -> StreamConfig.builder().conflationRolloutPercent(101));
        assertThrows(IllegalArgumentException.class, () -> StreamConfig.builder().compressionThresholdBytes(-1));
        assertThrows(IllegalArgumentException.class,
            () -> StreamConfig.builder().batchWindow(Duration.ofSeconds(2)).build(), "Window above its cap");
        assertThrows(IllegalArgumentException.class,
            () -> StreamConfig.builder().batchWindowMin(Duration.ofSeconds(1)).build(), "Floor above cap");
    }

    @Test
    void testFromEnvOverrides() {
        System.setProperty("STREAM_MAX_BATCH_SIZE", "250");
        System.setProperty("STREAM_BATCH_WINDOW_MS", "20");
        System.setProperty("STREAM_CONFLATION_ENABLED", "false");
        System.setProperty("LONGPOLL_TIMEOUT_MS", "5000");

        StreamConfig stream = StreamConfig.fromEnv();
        LongPollConfig longPoll = LongPollConfig.fromEnv();

        assertEquals(250, stream.maxBatchSize());
        assertEquals(Duration.ofMillis(20), stream.batchWindow());
        assertFalse(stream.conflationEnabled());
        assertEquals(Duration.ofSeconds(5), longPoll.pollTimeout());
        assertEquals(200, longPoll.maxBufferSize());
    }

    @Test
    void testLongPollValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> new LongPollConfig(0, Duration.ofSeconds(1), Duration.ofSeconds(1), 1, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new LongPollConfig(1, Duration.ZERO, Duration.ofSeconds(1), 1, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new LongPollConfig(1, Duration.ofSeconds(1), Duration.ofSeconds(1), 0, Duration.ofSeconds(1)));
    }
}
