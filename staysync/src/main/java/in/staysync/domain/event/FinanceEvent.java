package in.staysync.domain.event;

import in.staysync.domain.common.Channel;

import java.time.Instant;
import java.util.Map;

/**
 * Expense, revenue and cash balance event. The type is normalized to the finance vocabulary
 * on construction, so legacy names never reach consumers.
 */
public record FinanceEvent(
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

    public FinanceEvent {
        DomainEvent.requireCommon(eventType, tenantId);
        eventType = FinanceEventType.resolve(eventType, entityType).wireName();
        eventId = DomainEvent.idOrRandom(eventId);
        eventVersion = DomainEvent.versionOrDefault(eventVersion);
        timestamp = DomainEvent.timestampOrNow(timestamp);
        metadata = DomainEvent.metadataOf(metadata);
    }

    public FinanceEventType type() {
        return FinanceEventType.resolve(eventType, entityType);
    }

    @Override
    public Channel channel() {
        return Channel.FINANCE;
    }
}
