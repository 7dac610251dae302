package in.staysync.engine.registry;

import in.staysync.domain.common.MessageType;
import in.staysync.domain.stream.StreamMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * In-memory sink that records every frame. Can be told to fail or to leave sends pending.
 */
public final class RecordingSink implements ConnectionSink {

    private final List<StreamMessage> messages = new CopyOnWriteArrayList<>();
    private final List<String> closeReasons = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<Void>> pending = new CopyOnWriteArrayList<>();
    private volatile Predicate<StreamMessage> failWhen = m -> false;
    private volatile boolean hang;

    public void failWhen(Predicate<StreamMessage> predicate) {
        this.failWhen = predicate;
    }

    public void failAll() {
        failWhen(m -> true);
    }

    /**
     * Leave every later send incomplete, like a peer that stopped reading.
     */
    public void hang() {
        this.hang = true;
    }

    @Override
    public CompletableFuture<Void> send(StreamMessage message) {
        messages.add(message);
        if (failWhen.test(message)) {
            return CompletableFuture.failedFuture(new IllegalStateException("peer gone"));
        }
        if (hang) {
            CompletableFuture<Void> f = new CompletableFuture<>();
            pending.add(f);
            return f;
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close(String reason) {
        closeReasons.add(reason);
    }

    public List<StreamMessage> messages() {
        return new ArrayList<>(messages);
    }

    public List<StreamMessage> ofType(MessageType type) {
        List<StreamMessage> out = new ArrayList<>();
        for (StreamMessage m : messages) {
            if (m.type() == type) {
                out.add(m);
            }
        }
        return out;
    }

    public List<String> closeReasons() {
        return new ArrayList<>(closeReasons);
    }

    /**
     * Poll until at least {@code count} frames of the type arrived.
     */
    public boolean await(MessageType type, int count, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (ofType(type).size() >= count) {
                return true;
            }
            Thread.sleep(5);
        }
        return ofType(type).size() >= count;
    }

    public boolean awaitClosed(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (!closeReasons.isEmpty()) {
                return true;
            }
            Thread.sleep(5);
        }
        return !closeReasons.isEmpty();
    }
}
