package in.staysync.longpoll;

import in.staysync.domain.event.DomainEvent;

import java.time.Instant;
import java.util.List;

/**
 * Response of one long-poll: the events plus the cursor the client sends back next time.
 */
public record LongPollResult(List<DomainEvent> events, Instant lastEventId) {

    /**
     * @param since the request's cursor, used when no event is returned
     */
    public static LongPollResult of(List<DomainEvent> events, Instant since, Instant now) {
        Instant last = null;
        for (DomainEvent e : events) {
            if (last == null || e.timestamp().isAfter(last)) {
                last = e.timestamp();
            }
        }
        if (last == null) {
            last = since != null ? since : now;
        }
        return new LongPollResult(List.copyOf(events), last);
    }
}
