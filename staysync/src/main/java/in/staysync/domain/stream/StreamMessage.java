package in.staysync.domain.stream;

import in.staysync.domain.common.Channel;
import in.staysync.domain.common.ErrorCode;
import in.staysync.domain.common.MessageType;
import in.staysync.domain.event.DomainEvent;
import in.staysync.domain.event.EventEnvelope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Server to client envelope. Absent fields are omitted on the wire.
 */
public record StreamMessage(
    MessageType type,
    Channel channel,
    List<DomainEvent> events,
    List<StreamMessage> messages,   // batch breakdown, one event message per entry
    Instant timestamp,
    long seq,
    Boolean compressed,
    String data,                    // base64 gzip of the full batch JSON
    Invalidation invalidate,
    ErrorBody error
) {

    public record Invalidation(List<String> keys) {}

    public record ErrorBody(String message, ErrorCode code, Channel channel) {}

    /**
     * Single-event message carrying the envelope's own sequence number.
     */
    public static StreamMessage event(EventEnvelope envelope) {
        return new StreamMessage(MessageType.EVENT, envelope.channel(), List.of(envelope.event()), null,
                                 Instant.now(), envelope.seq(), null, null, null, null);
    }

    /**
     * Batch message: one sequence number for the batch, sub-events keep their own in the breakdown.
     */
    public static StreamMessage batch(Channel channel, long seq, List<EventEnvelope> envelopes) {
        List<DomainEvent> events = new ArrayList<>(envelopes.size());
        List<StreamMessage> breakdown = new ArrayList<>(envelopes.size());
        for (EventEnvelope e : envelopes) {
            events.add(e.event());
            breakdown.add(event(e));
        }
        return new StreamMessage(MessageType.BATCH, channel, events, breakdown,
                                 Instant.now(), seq, null, null, null, null);
    }

    public static StreamMessage compressed(Channel channel, long seq, String data) {
        return new StreamMessage(MessageType.BATCH, channel, null, null,
                                 Instant.now(), seq, Boolean.TRUE, data, null, null);
    }

    public static StreamMessage ping() {
        return new StreamMessage(MessageType.PING, null, null, null, Instant.now(), 0L, null, null, null, null);
    }

    public static StreamMessage ack() {
        return new StreamMessage(MessageType.ACK, null, null, null, Instant.now(), 0L, null, null, null, null);
    }

    public static StreamMessage invalidate(Channel channel, List<String> keys) {
        return new StreamMessage(MessageType.INVALIDATE, channel, null, null, Instant.now(), 0L,
                                 null, null, new Invalidation(List.copyOf(keys)), null);
    }

    public static StreamMessage error(String message, ErrorCode code, Channel channel) {
        return new StreamMessage(MessageType.ERROR, channel, null, null, Instant.now(), 0L,
                                 null, null, null, new ErrorBody(message, code, channel));
    }

    /**
     * Whether the message carries events (as opposed to control traffic).
     */
    public boolean carriesEvents() {
        return type == MessageType.EVENT || type == MessageType.BATCH;
    }
}
