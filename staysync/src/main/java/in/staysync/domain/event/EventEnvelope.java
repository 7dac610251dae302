package in.staysync.domain.event;

import in.staysync.domain.common.Channel;
import in.staysync.domain.common.ChannelCursor;

import java.time.Instant;

/**
 * A domain event stamped with its per-cursor sequence number.
 */
public record EventEnvelope(
    long tenantId,
    Channel channel,
    Long propertyId,     // null for tenant-wide events
    long seq,
    Instant arrivedAt,
    DomainEvent event
) {

    public static EventEnvelope of(Channel channel, long seq, DomainEvent event, Instant arrivedAt) {
        return new EventEnvelope(event.tenantId(), channel, event.propertyId(), seq, arrivedAt, event);
    }

    public ChannelCursor cursor() {
        return new ChannelCursor(tenantId, channel);
    }

    /**
     * Property filter match: a null filter sees everything, a tenant-wide event is seen by every filter.
     */
    public boolean visibleTo(Long propertyFilter) {
        return propertyFilter == null || propertyId == null || propertyId.equals(propertyFilter);
    }

    public EventEnvelope withEvent(DomainEvent replacement) {
        return new EventEnvelope(tenantId, channel, replacement.propertyId(), seq, arrivedAt, replacement);
    }
}
