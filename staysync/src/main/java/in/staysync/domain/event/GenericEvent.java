package in.staysync.domain.event;

import in.staysync.domain.common.Channel;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Event for channels without a dedicated domain type (users, dashboard, branding, analytics, reports).
 */
public record GenericEvent(
    Channel channel,
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

    private static final Set<Channel> GENERIC_CHANNELS = EnumSet.of(
        Channel.USERS, Channel.DASHBOARD, Channel.BRANDING, Channel.ANALYTICS, Channel.REPORTS);

    public GenericEvent {
        if (channel == null || !GENERIC_CHANNELS.contains(channel)) {
            throw new IllegalArgumentException("Channel " + channel + " has a dedicated event type");
        }
        DomainEvent.requireCommon(eventType, tenantId);
        eventId = DomainEvent.idOrRandom(eventId);
        eventVersion = DomainEvent.versionOrDefault(eventVersion);
        timestamp = DomainEvent.timestampOrNow(timestamp);
        metadata = DomainEvent.metadataOf(metadata);
    }
}
