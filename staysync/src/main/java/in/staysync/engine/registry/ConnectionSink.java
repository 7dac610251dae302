package in.staysync.engine.registry;

import in.staysync.domain.stream.StreamMessage;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound side of a consumer connection.
 */
public interface ConnectionSink {

    /**
     * Send asynchronously. The future completes when the transport accepted the frame
     * and fails when the write failed.
     */
    CompletableFuture<Void> send(StreamMessage message);

    /**
     * Close the underlying transport. Must be safe to call more than once.
     */
    default void close(String reason) {}
}
