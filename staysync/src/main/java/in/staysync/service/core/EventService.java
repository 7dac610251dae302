package in.staysync.service.core;

import in.staysync.domain.common.Channel;
import in.staysync.domain.event.DomainEvent;
import in.staysync.domain.event.EventEnvelope;
import in.staysync.domain.event.FinanceEvent;
import in.staysync.engine.router.PublishException;
import in.staysync.engine.router.SubscriptionRouter;
import in.staysync.longpoll.LongPollBuffers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Producer-facing event service.
 * Delivery rule: stream first, then the long-poll buffer. Finance events are mirrored to reports.
 */
public final class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final SubscriptionRouter router;
    private final LongPollBuffers longPoll;

    public EventService(SubscriptionRouter router, LongPollBuffers longPoll) {
        this.router = router;
        this.longPoll = longPoll;
    }

    /**
     * Publish an event on its own channel.
     */
    public EventEnvelope publish(DomainEvent event) {
        return publish(event.channel(), event);
    }

    /**
     * Publish an event to stream subscribers and long-poll waiters of a channel.
     *
     * @throws IllegalArgumentException if the event does not belong on the channel
     * @throws PublishException if delivery could not be started
     */
    public EventEnvelope publish(Channel channel, DomainEvent event) {
        EventEnvelope envelope = deliver(channel, event);
        if (event instanceof FinanceEvent && channel == Channel.FINANCE) {
            try {
                deliver(Channel.REPORTS, event);
            } catch (PublishException e) {
                log.warn("[EventService] Mirror to reports failed for tenant {}: {}", event.tenantId(), e.getMessage());
            }
        }
        return envelope;
    }

    /**
     * Ask subscribers of a channel to refetch the given cache keys.
     */
    public void invalidate(long tenantId, Channel channel, List<String> keys) {
        router.invalidate(tenantId, channel, keys);
        log.debug("[EventService] Invalidated {} keys on {}/{}", keys.size(), tenantId, channel);
    }

    private EventEnvelope deliver(Channel channel, DomainEvent event) {
        EventEnvelope envelope = router.publish(channel, event);
        try {
            longPoll.push(channel, event);
        } catch (RuntimeException e) {
            log.error("[EventService] Long-poll buffer push failed on {} for tenant {}", channel, event.tenantId(), e);
            throw new PublishException(channel, event.tenantId(), "Long-poll buffer unavailable", e);
        }
        log.debug("[EventService] Published {} on {} seq={}", event.eventType(), channel, envelope.seq());
        return envelope;
    }
}
