package in.staysync.engine.sequence;

import in.staysync.domain.common.Channel;
import in.staysync.domain.common.ChannelCursor;
import in.staysync.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SequenceAllocator.
 *
 * Tests:
 * - Numbering starts at 1 and increases by one
 * - Cursors are numbered independently
 * - Concurrent allocation never issues a number twice
 * - Idle cursors are reclaimed and restart at 1
 * - Retained cursors survive reclamation
 */
class SequenceAllocatorTest {

    private static final ChannelCursor FINANCE_1 = ChannelCursor.of(1L, Channel.FINANCE);
    private static final ChannelCursor GUEST_1 = ChannelCursor.of(1L, Channel.GUEST);
    private static final ChannelCursor FINANCE_2 = ChannelCursor.of(2L, Channel.FINANCE);

    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    void testStartsAtOneAndIncrements() {
        SequenceAllocator allocator = new SequenceAllocator();

        assertEquals(0L, allocator.current(FINANCE_1));
        assertEquals(1L, allocator.next(FINANCE_1));
        assertEquals(2L, allocator.next(FINANCE_1));
        assertEquals(3L, allocator.next(FINANCE_1));
        assertEquals(3L, allocator.current(FINANCE_1));
    }

    @Test
    void testCursorsAreIndependent() {
        SequenceAllocator allocator = new SequenceAllocator();

        allocator.next(FINANCE_1);
        allocator.next(FINANCE_1);

        assertEquals(1L, allocator.next(GUEST_1));
        assertEquals(1L, allocator.next(FINANCE_2));
        assertEquals(3L, allocator.next(FINANCE_1));
        assertEquals(3, allocator.size());
    }

    @Test
    void testConcurrentAllocationIsUnique() throws Exception {
        SequenceAllocator allocator = new SequenceAllocator();
        int threads = 8;
        int perThread = 1000;
        pool = Executors.newFixedThreadPool(threads);
        Set<Long> issued = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        issued.add(allocator.next(FINANCE_1));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();

        assertTrue(done.await(10, TimeUnit.SECONDS), "Allocation should finish");
        assertEquals(threads * perThread, issued.size(), "No sequence number may be issued twice");
        assertEquals(threads * perThread, allocator.current(FINANCE_1));
    }

    @Test
    void testReclaimIdleCursors() {
        MutableClock clock = new MutableClock();
        SequenceAllocator allocator = new SequenceAllocator(clock);

        allocator.next(FINANCE_1);
        allocator.next(FINANCE_1);
        clock.advance(Duration.ofMinutes(6));
        allocator.next(GUEST_1);
        clock.advance(Duration.ofMinutes(6));

        List<ChannelCursor> reclaimed = allocator.reclaimIdle(Duration.ofMinutes(10));

        assertEquals(List.of(FINANCE_1), reclaimed);
        assertEquals(0L, allocator.current(FINANCE_1));
        assertEquals(1L, allocator.current(GUEST_1));
        assertEquals(1L, allocator.next(FINANCE_1), "Reclaimed cursor restarts at 1");
    }

    @Test
    void testReclaimSkipsRetainedCursors() {
        MutableClock clock = new MutableClock();
        SequenceAllocator allocator = new SequenceAllocator(clock);

        allocator.next(FINANCE_1);
        allocator.next(FINANCE_2);
        clock.advance(Duration.ofMinutes(30));

        List<ChannelCursor> reclaimed = allocator.reclaimIdle(Duration.ofMinutes(10), FINANCE_2::equals);

        assertEquals(List.of(FINANCE_1), reclaimed);
        assertEquals(1L, allocator.current(FINANCE_2));
    }
}
