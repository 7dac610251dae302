package in.staysync.longpoll;

import in.staysync.config.LongPollConfig;
import in.staysync.domain.common.Channel;
import in.staysync.domain.event.EventFixtures;
import in.staysync.domain.event.GuestEvent;
import in.staysync.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LongPollBuffer.
 *
 * Tests:
 * - Buffered events are returned right away, filtered by since
 * - A parked waiter is woken by the first matching push
 * - Property-filtered waiters ignore other properties and tenant-wide events
 * - Timeouts resolve with an empty list, never early
 * - Waiter cap, buffer cap, cancellation, idle eviction and shutdown release
 */
class LongPollBufferTest {

    private static final LongPollConfig CONFIG =
        new LongPollConfig(3, Duration.ofSeconds(25), Duration.ofSeconds(25), 2, Duration.ofMinutes(2));

    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private LongPollBuffer buffer(Clock clock) {
        return new LongPollBuffer(Channel.GUEST, CONFIG, scheduler, clock);
    }

    @Test
    void testReturnsBufferedEventsImmediately() {
        LongPollBuffer buffer = buffer(Clock.systemUTC());
        Instant t1 = Instant.parse("2025-01-15T10:00:00Z");
        Instant t2 = Instant.parse("2025-01-15T10:00:05Z");
        buffer.push(1L, EventFixtures.guestAt(1L, null, "a", t1));
        buffer.push(1L, EventFixtures.guestAt(1L, null, "b", t2));

        CompletableFuture<LongPollResult> all = buffer.subscribe(1L, null, null);
        CompletableFuture<LongPollResult> newer = buffer.subscribe(1L, null, t1);

        assertTrue(all.isDone());
        assertEquals(2, all.join().events().size());
        assertEquals(t2, all.join().lastEventId());
        assertTrue(newer.isDone());
        assertEquals(List.of("b"), newer.join().events().stream().map(e -> e.entityId()).toList());
    }

    @Test
    void testParkedWaiterWokenByPush() throws Exception {
        LongPollBuffer buffer = buffer(Clock.systemUTC());

        CompletableFuture<LongPollResult> poll = buffer.subscribe(1L, null, null);
        assertFalse(poll.isDone());
        assertEquals(1, buffer.getStats().waiters());

        GuestEvent event = EventFixtures.guest(1L, 10L, "a");
        buffer.push(2L, EventFixtures.guest(2L, 10L, "other tenant"));
        assertFalse(poll.isDone(), "Other tenants' events do not wake the waiter");
        buffer.push(1L, event);

        LongPollResult result = poll.get(2, TimeUnit.SECONDS);
        assertEquals(List.of(event), result.events());
        assertEquals(event.timestamp(), result.lastEventId());
        assertEquals(0, buffer.getStats().waiters());
    }

    @Test
    void testPropertyFilteredWaiter() throws Exception {
        LongPollBuffer buffer = buffer(Clock.systemUTC());

        CompletableFuture<LongPollResult> poll = buffer.subscribe(1L, 10L, null);
        buffer.push(1L, EventFixtures.guest(1L, 20L, "other property"));
        buffer.push(1L, EventFixtures.guest(1L, null, "tenant wide"));
        assertFalse(poll.isDone());

        buffer.push(1L, EventFixtures.guest(1L, 10L, "mine"));

        LongPollResult result = poll.get(2, TimeUnit.SECONDS);
        assertEquals(List.of("mine"), result.events().stream().map(e -> e.entityId()).toList());
    }

    @Test
    void testTimeoutIsNotEarly() throws Exception {
        LongPollBuffer buffer = buffer(Clock.systemUTC());
        Instant since = Instant.parse("2025-01-15T10:00:00Z");

        long start = System.nanoTime();
        CompletableFuture<LongPollResult> poll = buffer.subscribe(1L, null, since, Duration.ofMillis(200));
        Thread.sleep(100);
        assertFalse(poll.isDone(), "Must not resolve before the timeout");

        LongPollResult result = poll.get(2, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMs >= 195, "Resolved after " + elapsedMs + "ms");
        assertTrue(result.events().isEmpty());
        assertEquals(since, result.lastEventId(), "Cursor is echoed back when nothing arrived");
        assertEquals(1, buffer.getStats().timeouts());
    }

    @Test
    void testWaiterCap() {
        LongPollBuffer buffer = buffer(Clock.systemUTC());
        buffer.subscribe(1L, null, null);
        buffer.subscribe(1L, null, null);

        CompletableFuture<LongPollResult> third = buffer.subscribe(1L, null, null);

        assertTrue(third.isDone());
        assertTrue(third.join().events().isEmpty());
        assertEquals(1, buffer.getStats().waiterRejections());
        assertEquals(2, buffer.getStats().waiters());
    }

    @Test
    void testBufferCapDropsOldest() {
        LongPollBuffer buffer = buffer(Clock.systemUTC());
        for (int i = 1; i <= 5; i++) {
            buffer.push(1L, EventFixtures.guest(1L, null, "g" + i));
        }

        List<String> ids = buffer.subscribe(1L, null, null).join().events().stream().map(e -> e.entityId()).toList();

        assertEquals(List.of("g3", "g4", "g5"), ids);
        assertEquals(2, buffer.getStats().dropped());
    }

    @Test
    void testCancelWithdrawsWaiter() {
        LongPollBuffer buffer = buffer(Clock.systemUTC());
        CompletableFuture<LongPollResult> poll = buffer.subscribe(1L, null, null);

        poll.cancel(false);

        assertEquals(0, buffer.getStats().waiters());
    }

    @Test
    void testExpiryAndIdleEviction() {
        MutableClock clock = new MutableClock();
        LongPollBuffer buffer = buffer(clock);
        buffer.push(1L, EventFixtures.guest(1L, null, "g"));

        clock.advance(Duration.ofSeconds(30));
        CompletableFuture<LongPollResult> poll = buffer.subscribe(1L, null, null, Duration.ofSeconds(5));
        assertFalse(poll.isDone(), "Events past their ttl are gone");
        poll.cancel(false);

        clock.advance(Duration.ofMinutes(3));
        assertEquals(1, buffer.sweep());
        assertEquals(0, buffer.getStats().tenants());
    }

    @Test
    void testReleaseAll() {
        LongPollBuffer buffer = buffer(Clock.systemUTC());
        CompletableFuture<LongPollResult> a = buffer.subscribe(1L, null, null);
        CompletableFuture<LongPollResult> b = buffer.subscribe(2L, 10L, null);

        buffer.releaseAll();

        assertTrue(a.isDone() && a.join().events().isEmpty());
        assertTrue(b.isDone() && b.join().events().isEmpty());
        assertEquals(0, buffer.getStats().waiters());
    }
}
