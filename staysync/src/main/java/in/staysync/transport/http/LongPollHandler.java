package in.staysync.transport.http;

import in.staysync.auth.TokenVerifier;
import in.staysync.domain.common.Channel;
import in.staysync.domain.common.Identity;
import in.staysync.longpoll.LongPollBuffers;
import in.staysync.longpoll.LongPollResult;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.SameThreadExecutor;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * GET /v1/{channel}/realtime/subscribe?lastEventId=&lt;ISO&gt;&amp;propertyId=&lt;long&gt;
 *
 * Parks the exchange without holding a worker thread until events arrive or the poll times out.
 */
public final class LongPollHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(LongPollHandler.class);

    private final LongPollBuffers buffers;
    private final TokenVerifier verifier;

    public LongPollHandler(LongPollBuffers buffers, TokenVerifier verifier) {
        this.buffers = buffers;
        this.verifier = verifier;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Optional<Channel> channel = Channel.lookup(HttpResponses.queryParam(exchange, "channel"));
        if (channel.isEmpty()) {
            HttpResponses.sendError(exchange, StatusCodes.BAD_REQUEST, "Unknown channel");
            return;
        }

        Identity identity = verifier.verify(HttpResponses.bearerToken(exchange));
        if (identity == null) {
            HttpResponses.sendError(exchange, StatusCodes.UNAUTHORIZED, "Invalid or missing token");
            return;
        }

        Instant since;
        Long propertyId;
        try {
            String lastEventId = HttpResponses.queryParam(exchange, "lastEventId");
            since = lastEventId == null ? null : Instant.parse(lastEventId);
            String property = HttpResponses.queryParam(exchange, "propertyId");
            propertyId = property == null ? null : Long.valueOf(property);
        } catch (DateTimeParseException | NumberFormatException e) {
            HttpResponses.sendError(exchange, StatusCodes.BAD_REQUEST, "Malformed parameter: " + e.getMessage());
            return;
        }

        CompletableFuture<LongPollResult> poll =
            buffers.forChannel(channel.get()).subscribe(identity.tenantId(), propertyId, since);
        if (poll.isDone()) {
            respond(exchange, poll);
            return;
        }

        exchange.addExchangeCompleteListener((ex, next) -> {
            poll.cancel(false);
            next.proceed();
        });
        exchange.dispatch(SameThreadExecutor.INSTANCE, () ->
            poll.whenComplete((result, err) -> {
                if (err == null || !poll.isCancelled()) {
                    exchange.getIoThread().execute(() -> respond(exchange, poll));
                }
            }));
        log.debug("[LongPoll] Parked tenant={} channel={} property={}", identity.tenantId(), channel.get(), propertyId);
    }

    private void respond(HttpServerExchange exchange, CompletableFuture<LongPollResult> poll) {
        if (exchange.isResponseStarted()) {
            return;
        }
        LongPollResult result;
        try {
            result = poll.join();
        } catch (RuntimeException e) {
            log.error("[LongPoll] Poll failed: {}", e.getMessage());
            HttpResponses.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Poll failed");
            return;
        }
        HttpResponses.sendJson(exchange, StatusCodes.OK, result);
    }
}
