package in.staysync.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.staysync.auth.TokenVerifier;
import in.staysync.domain.common.Channel;
import in.staysync.domain.common.Identity;
import in.staysync.domain.event.DomainEvent;
import in.staysync.domain.event.EventEnvelope;
import in.staysync.engine.router.PublishException;
import in.staysync.service.core.EventService;
import in.staysync.util.Json;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * POST /v2/realtime/publish/{channel}: producer entry point over HTTP.
 */
public final class PublishHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PublishHandler.class);

    private final EventService eventService;
    private final TokenVerifier verifier;

    public PublishHandler(EventService eventService, TokenVerifier verifier) {
        this.eventService = eventService;
        this.verifier = verifier;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Identity identity = verifier.verify(HttpResponses.bearerToken(exchange));
        if (identity == null) {
            HttpResponses.sendError(exchange, StatusCodes.UNAUTHORIZED, "Invalid or missing token");
            return;
        }
        Optional<Channel> channel = Channel.lookup(HttpResponses.queryParam(exchange, "channel"));
        if (channel.isEmpty()) {
            HttpResponses.sendError(exchange, StatusCodes.BAD_REQUEST, "Unknown channel");
            return;
        }

        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            DomainEvent event;
            try {
                event = Json.MAPPER.readValue(body, DomainEvent.class);
            } catch (JsonProcessingException e) {
                HttpResponses.sendError(ex, StatusCodes.BAD_REQUEST, "Invalid event: " + e.getOriginalMessage());
                return;
            }

            if (event.tenantId() != identity.tenantId()) {
                log.warn("[Publish] Tenant mismatch: token tenant {} published for tenant {}",
                    identity.tenantId(), event.tenantId());
                HttpResponses.sendError(ex, StatusCodes.FORBIDDEN, "Tenant mismatch");
                return;
            }

            try {
                EventEnvelope envelope = eventService.publish(channel.get(), event);
                HttpResponses.sendJson(ex, StatusCodes.ACCEPTED, Map.of("seq", envelope.seq()));
            } catch (IllegalArgumentException e) {
                HttpResponses.sendError(ex, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (PublishException e) {
                HttpResponses.sendError(ex, StatusCodes.SERVICE_UNAVAILABLE, e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }
}
