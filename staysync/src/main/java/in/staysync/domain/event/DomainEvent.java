package in.staysync.domain.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import in.staysync.domain.common.Channel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Producer-supplied business event, tagged by its domain.
 * Immutable; the sequence number lives on {@link EventEnvelope}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "domain")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FinanceEvent.class, name = "finance"),
    @JsonSubTypes.Type(value = GuestEvent.class, name = "guest"),
    @JsonSubTypes.Type(value = StaffEvent.class, name = "staff"),
    @JsonSubTypes.Type(value = TaskEvent.class, name = "tasks"),
    @JsonSubTypes.Type(value = PropertyEvent.class, name = "properties"),
    @JsonSubTypes.Type(value = GenericEvent.class, name = "generic")
})
public interface DomainEvent {

    String CURRENT_VERSION = "v1";

    String eventId();

    String eventVersion();

    String eventType();

    long tenantId();

    /** Entity scope; null means visible to every property of the tenant. */
    Long propertyId();

    Long actorId();

    Instant timestamp();

    String entityId();

    String entityType();

    Map<String, Object> metadata();

    /** Channel this event is published on by default. */
    Channel channel();

    /**
     * Whether the event may be published on the given channel.
     * Finance events are mirrored to the reports channel.
     */
    default boolean deliverableOn(Channel target) {
        return target == channel() || (target == Channel.REPORTS && this instanceof FinanceEvent);
    }

    static String idOrRandom(String eventId) {
        return eventId == null || eventId.isBlank() ? UUID.randomUUID().toString() : eventId;
    }

    static String versionOrDefault(String eventVersion) {
        return eventVersion == null || eventVersion.isBlank() ? CURRENT_VERSION : eventVersion;
    }

    static Instant timestampOrNow(Instant timestamp) {
        return timestamp != null ? timestamp : Instant.now();
    }

    static Map<String, Object> metadataOf(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static void requireCommon(String eventType, long tenantId) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType is required");
        }
        if (tenantId <= 0) {
            throw new IllegalArgumentException("tenantId must be positive, got " + tenantId);
        }
    }
}
