package in.staysync.domain.event;

import in.staysync.domain.common.Channel;

import java.time.Instant;
import java.util.Map;

/**
 * Guest check-in lifecycle event (created, updated, checked in, checked out, documents).
 */
public record GuestEvent(
    String eventId,
    String eventVersion,
    String eventType,
    long tenantId,
    Long propertyId,
    Long actorId,
    Instant timestamp,
    String entityId,
    String entityType,
    Map<String, Object> metadata
) implements DomainEvent {

    public GuestEvent {
        DomainEvent.requireCommon(eventType, tenantId);
        eventId = DomainEvent.idOrRandom(eventId);
        eventVersion = DomainEvent.versionOrDefault(eventVersion);
        timestamp = DomainEvent.timestampOrNow(timestamp);
        metadata = DomainEvent.metadataOf(metadata);
    }

    @Override
    public Channel channel() {
        return Channel.GUEST;
    }
}
