package in.staysync.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.staysync.domain.stream.StreamMessage;
import in.staysync.engine.registry.ConnectionSink;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.xnio.IoUtils;

import java.util.concurrent.CompletableFuture;

/**
 * Connection sink writing JSON text frames to an Undertow WebSocket channel.
 */
final class WebSocketSink implements ConnectionSink {

    private final WebSocketChannel channel;
    private final ObjectMapper mapper;

    WebSocketSink(WebSocketChannel channel, ObjectMapper mapper) {
        this.channel = channel;
        this.mapper = mapper;
    }

    @Override
    public CompletableFuture<Void> send(StreamMessage message) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (!channel.isOpen()) {
            done.completeExceptionally(new IllegalStateException("WebSocket channel is closed"));
            return done;
        }
        String json;
        try {
            json = mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            done.completeExceptionally(e);
            return done;
        }
        WebSockets.sendText(json, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                done.complete(null);
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                done.completeExceptionally(throwable);
            }
        });
        return done;
    }

    @Override
    public void close(String reason) {
        if (!channel.isOpen()) {
            return;
        }
        WebSockets.sendClose(CloseMessage.NORMAL_CLOSURE, reason, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                IoUtils.safeClose(ch);
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                IoUtils.safeClose(ch);
            }
        });
    }
}
