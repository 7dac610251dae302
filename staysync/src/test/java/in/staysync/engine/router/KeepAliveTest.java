package in.staysync.engine.router;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeepAlive.
 *
 * Tests:
 * - Pings are sent periodically after start
 * - No pings after stop
 * - A failed ping future stops the task and reports the cause
 * - A ping function that throws is treated the same way
 * - Starting twice does not double the rate
 */
class KeepAliveTest {

    private ScheduledExecutorService scheduler;
    private KeepAlive keepAlive;

    @BeforeEach
    void setUp() {
        scheduler = SubscriptionRouter.newScheduler(1);
    }

    @AfterEach
    void tearDown() {
        if (keepAlive != null) {
            keepAlive.stop();
        }
        scheduler.shutdownNow();
    }

    @Test
    void testPingsPeriodically() throws Exception {
        CountDownLatch latch = new CountDownLatch(3);
        keepAlive = new KeepAlive("conn-1", Duration.ofMillis(20), scheduler, () -> {
            latch.countDown();
            return CompletableFuture.completedFuture(null);
        }, cause -> fail("Unexpected failure: " + cause));

        keepAlive.start();

        assertTrue(keepAlive.isRunning());
        assertTrue(latch.await(2, TimeUnit.SECONDS), "Should ping at least 3 times");
    }

    @Test
    void testNoPingsAfterStop() throws Exception {
        AtomicInteger pings = new AtomicInteger();
        keepAlive = new KeepAlive("conn-1", Duration.ofMillis(20), scheduler, () -> {
            pings.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        }, cause -> { });

        keepAlive.start();
        Thread.sleep(100);
        keepAlive.stop();
        int afterStop = pings.get();
        Thread.sleep(100);

        assertFalse(keepAlive.isRunning());
        assertTrue(afterStop > 0);
        assertTrue(pings.get() <= afterStop + 1, "At most an in-flight tick after stop");
    }

    @Test
    void testFailedPingStopsAndReports() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);
        AtomicReference<Throwable> cause = new AtomicReference<>();
        AtomicInteger pings = new AtomicInteger();
        keepAlive = new KeepAlive("conn-1", Duration.ofMillis(20), scheduler, () -> {
            pings.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalStateException("socket closed"));
        }, err -> {
            cause.set(err);
            failed.countDown();
        });

        keepAlive.start();

        assertTrue(failed.await(2, TimeUnit.SECONDS), "Failure should be reported");
        assertEquals("socket closed", cause.get().getMessage());
        assertFalse(keepAlive.isRunning());
        Thread.sleep(100);
        assertEquals(1, pings.get(), "No pings after a failure");
    }

    @Test
    void testThrowingPingFunction() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);
        keepAlive = new KeepAlive("conn-1", Duration.ofMillis(20), scheduler, () -> {
            throw new IllegalStateException("encoder broke");
        }, err -> failed.countDown());

        keepAlive.start();

        assertTrue(failed.await(2, TimeUnit.SECONDS));
        assertFalse(keepAlive.isRunning());
    }

    @Test
    void testDoubleStartIgnored() throws Exception {
        AtomicInteger pings = new AtomicInteger();
        keepAlive = new KeepAlive("conn-1", Duration.ofMillis(200), scheduler, () -> {
            pings.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        }, cause -> { });

        keepAlive.start();
        keepAlive.start();
        Thread.sleep(300);

        assertEquals(1, pings.get(), "One schedule only");
    }
}
