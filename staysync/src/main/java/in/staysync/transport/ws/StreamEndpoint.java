package in.staysync.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.staysync.auth.TokenVerifier;
import in.staysync.domain.common.ErrorCode;
import in.staysync.domain.common.Identity;
import in.staysync.domain.stream.Handshake;
import in.staysync.domain.stream.StreamMessage;
import in.staysync.engine.registry.Connection;
import in.staysync.engine.router.HandshakeException;
import in.staysync.engine.router.SubscriptionRouter;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.IoUtils;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Undertow WebSocket endpoint for {@code /v2/realtime/stream}.
 *
 * The first text frame is the handshake. The token comes from {@code authToken} in that frame
 * or from {@code ?token=} on the upgrade URL. Rejections are sent as an {@code error} message
 * followed by close. Later client frames only refresh the connection's activity time.
 */
public final class StreamEndpoint {
    private static final Logger log = LoggerFactory.getLogger(StreamEndpoint.class);

    private final ConcurrentMap<WebSocketChannel, Connection> connections = new ConcurrentHashMap<>();
    private final SubscriptionRouter router;
    private final TokenVerifier verifier;
    private final ObjectMapper mapper;

    public StreamEndpoint(SubscriptionRouter router, TokenVerifier verifier, ObjectMapper mapper) {
        this.router = router;
        this.verifier = verifier;
        this.mapper = mapper;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                String queryToken = extractToken(exchange.getQueryString());

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        handleFrame(ch, message.getData(), queryToken);
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        cleanup(ch, "client");
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[Stream] WS error from {}: {}", ch.getSourceAddress(), error.toString());
                        cleanup(ch, "transport_error");
                        super.onError(ch, error);
                    }
                });
                channel.addCloseTask(ch -> cleanup(ch, "client"));
                channel.resumeReceives();
                log.debug("[Stream] WS upgraded from {}", channel.getSourceAddress());
            }
        });
    }

    public int connectionCount() {
        return connections.size();
    }

    private void handleFrame(WebSocketChannel channel, String raw, String queryToken) {
        Connection existing = connections.get(channel);
        if (existing != null) {
            existing.touch();
            return;
        }

        Handshake handshake;
        try {
            handshake = mapper.readValue(raw, Handshake.class);
        } catch (JsonProcessingException e) {
            reject(channel, ErrorCode.INVALID_ARGUMENT, "Malformed handshake: " + e.getOriginalMessage());
            return;
        }

        String token = handshake.authToken() != null ? handshake.authToken() : queryToken;
        Identity identity = verifier.verify(token);
        try {
            Connection conn = router.open(handshake, identity, new WebSocketSink(channel, mapper));
            connections.put(channel, conn);
            if (!channel.isOpen()) {
                cleanup(channel, "client");
            }
        } catch (HandshakeException e) {
            reject(channel, e.getCode(), e.getMessage());
        }
    }

    private void reject(WebSocketChannel channel, ErrorCode code, String message) {
        log.warn("[Stream] Handshake rejected from {}: {} {}", channel.getSourceAddress(), code, message);
        String json;
        try {
            json = mapper.writeValueAsString(StreamMessage.error(message, code, null));
        } catch (JsonProcessingException e) {
            IoUtils.safeClose(channel);
            return;
        }
        WebSockets.sendText(json, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                WebSockets.sendClose(CloseMessage.NORMAL_CLOSURE, code.name(), ch, null);
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                IoUtils.safeClose(ch);
            }
        });
    }

    private void cleanup(WebSocketChannel channel, String reason) {
        Connection conn = connections.remove(channel);
        if (conn != null) {
            router.close(conn, reason);
            log.info("[Stream] WS disconnected: {} ({})", channel.getSourceAddress(), conn.getId());
        }
    }

    private static String extractToken(String query) {
        if (query == null) {
            return null;
        }
        for (String param : query.split("&")) {
            if (param.startsWith("token=")) {
                return URLDecoder.decode(param.substring(6), StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
