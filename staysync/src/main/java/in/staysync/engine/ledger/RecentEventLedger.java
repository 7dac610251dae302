package in.staysync.engine.ledger;

import in.staysync.domain.common.ChannelCursor;
import in.staysync.domain.event.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-cursor history of recent events, used to replay what a client missed
 * while disconnected.
 *
 * Retention: entries older than the replay window are dropped, and each cursor keeps at most
 * {@code maxEntries}, oldest first. Entries are appended in sequence order.
 */
public final class RecentEventLedger {
    private static final Logger log = LoggerFactory.getLogger(RecentEventLedger.class);

    private final ConcurrentHashMap<ChannelCursor, ArrayDeque<LedgerEntry>> entries = new ConcurrentHashMap<>();
    private final Duration window;
    private final int maxEntries;
    private final Clock clock;

    public RecentEventLedger(Duration window, int maxEntries, Clock clock) {
        this.window = window;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * One recorded event.
     */
    public record LedgerEntry(long seq, Instant recordedAt, EventEnvelope envelope) {}

    public void record(EventEnvelope envelope) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        entries.compute(envelope.cursor(), (k, deque) -> {
            ArrayDeque<LedgerEntry> d = deque != null ? deque : new ArrayDeque<>();
            d.addLast(new LedgerEntry(envelope.seq(), now, envelope));
            trim(d, cutoff);
            return d;
        });
    }

    /**
     * Entries with {@code seq > lastSeq} still inside the window, in sequence order.
     * Never mutates the ledger.
     */
    public List<LedgerEntry> since(ChannelCursor cursor, long lastSeq) {
        Instant cutoff = clock.instant().minus(window);
        List<LedgerEntry> out = new ArrayList<>();
        entries.computeIfPresent(cursor, (k, deque) -> {
            for (LedgerEntry e : deque) {
                if (e.seq() > lastSeq && !e.recordedAt().isBefore(cutoff)) {
                    out.add(e);
                }
            }
            return deque;
        });
        return out.isEmpty() ? Collections.emptyList() : out;
    }

    /**
     * Trim every cursor and drop the ones left empty.
     *
     * @return number of entries removed
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(window);
        int[] removed = new int[1];
        for (ChannelCursor cursor : entries.keySet()) {
            entries.computeIfPresent(cursor, (k, deque) -> {
                removed[0] += trim(deque, cutoff);
                return deque.isEmpty() ? null : deque;
            });
        }
        if (removed[0] > 0) {
            log.debug("[Ledger] Swept {} expired entries, {} cursors remain", removed[0], entries.size());
        }
        return removed[0];
    }

    public void evict(ChannelCursor cursor) {
        entries.remove(cursor);
    }

    public int size(ChannelCursor cursor) {
        int[] n = new int[1];
        entries.computeIfPresent(cursor, (k, d) -> {
            n[0] = d.size();
            return d;
        });
        return n[0];
    }

    public int cursorCount() {
        return entries.size();
    }

    private int trim(ArrayDeque<LedgerEntry> deque, Instant cutoff) {
        int removed = 0;
        Iterator<LedgerEntry> it = deque.iterator();
        while (it.hasNext()) {
            if (it.next().recordedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            } else {
                break;
            }
        }
        while (deque.size() > maxEntries) {
            deque.pollFirst();
            removed++;
        }
        return removed;
    }
}
