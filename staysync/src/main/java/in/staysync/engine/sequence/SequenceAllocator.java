package in.staysync.engine.sequence;

import in.staysync.domain.common.ChannelCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Issues strictly increasing sequence numbers per (tenant, channel), starting at 1.
 *
 * Each cursor is updated through {@link ConcurrentHashMap#compute}, so concurrent callers on the
 * same cursor are serialized while different cursors never contend.
 */
public final class SequenceAllocator {
    private static final Logger log = LoggerFactory.getLogger(SequenceAllocator.class);

    private final ConcurrentHashMap<ChannelCursor, CursorState> cursors = new ConcurrentHashMap<>();
    private final Clock clock;

    public SequenceAllocator(Clock clock) {
        this.clock = clock;
    }

    public SequenceAllocator() {
        this(Clock.systemUTC());
    }

    /**
     * Allocate the next sequence number for a cursor.
     */
    public long next(ChannelCursor cursor) {
        Instant now = clock.instant();
        long[] issued = new long[1];
        cursors.compute(cursor, (k, state) -> {
            long seq = (state == null ? 0L : state.seq()) + 1;
            issued[0] = seq;
            return new CursorState(seq, now);
        });
        return issued[0];
    }

    /**
     * Last issued sequence number, or 0 when the cursor has none.
     */
    public long current(ChannelCursor cursor) {
        CursorState state = cursors.get(cursor);
        return state == null ? 0L : state.seq();
    }

    /**
     * Drop cursors unused for longer than the idle window.
     *
     * @return the reclaimed cursors, so dependent state can be evicted with them
     */
    public List<ChannelCursor> reclaimIdle(Duration idleWindow) {
        return reclaimIdle(idleWindow, cursor -> false);
    }

    /**
     * Same as {@link #reclaimIdle(Duration)}, skipping cursors for which {@code retain} holds.
     */
    public List<ChannelCursor> reclaimIdle(Duration idleWindow, Predicate<ChannelCursor> retain) {
        Instant cutoff = clock.instant().minus(idleWindow);
        List<ChannelCursor> reclaimed = new ArrayList<>();
        for (ChannelCursor cursor : cursors.keySet()) {
            cursors.computeIfPresent(cursor, (k, state) -> {
                if (state.lastAccess().isBefore(cutoff) && !retain.test(k)) {
                    reclaimed.add(k);
                    return null;
                }
                return state;
            });
        }
        if (!reclaimed.isEmpty()) {
            log.debug("[Sequence] Reclaimed {} idle cursors", reclaimed.size());
        }
        return reclaimed;
    }

    public int size() {
        return cursors.size();
    }

    private record CursorState(long seq, Instant lastAccess) {}
}
