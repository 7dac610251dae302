package in.staysync.engine.router;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Periodic ping for one connection, scheduled on the router's shared scheduler.
 *
 * A failed ping stops the task and hands the cause to {@code onFailure}, which tears the
 * connection down.
 *
 * Usage:
 * <pre>
 * KeepAlive keepAlive = new KeepAlive(conn.getId(), Duration.ofSeconds(30), scheduler,
 *     () -> registry.sendDirect(conn, StreamMessage.ping()),
 *     cause -> router.close(conn, "ping_failure"));
 * keepAlive.start();
 * // On teardown:
 * keepAlive.stop();
 * </pre>
 */
public class KeepAlive {

    private static final Logger log = LoggerFactory.getLogger(KeepAlive.class);

    private final String connectionId;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final Supplier<CompletableFuture<Void>> pingFunction;
    private final Consumer<Throwable> onFailure;

    private volatile ScheduledFuture<?> pingTask;
    private volatile boolean running = false;

    public KeepAlive(String connectionId, Duration interval, ScheduledExecutorService scheduler,
                     Supplier<CompletableFuture<Void>> pingFunction, Consumer<Throwable> onFailure) {
        this.connectionId = connectionId;
        this.interval = interval;
        this.scheduler = scheduler;
        this.pingFunction = pingFunction;
        this.onFailure = onFailure;
    }

    public synchronized void start() {
        if (running) {
            log.warn("[KeepAlive:{}] Already running", connectionId);
            return;
        }
        running = true;
        pingTask = scheduler.scheduleAtFixedRate(this::tick,
            interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("[KeepAlive:{}] Started, interval {}ms", connectionId, interval.toMillis());
    }

    /**
     * Cancel the ping task. Idempotent.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
        log.debug("[KeepAlive:{}] Stopped", connectionId);
    }

    public boolean isRunning() {
        return running;
    }

    private void tick() {
        if (!running) {
            return;
        }
        CompletableFuture<Void> ping;
        try {
            ping = pingFunction.get();
        } catch (Exception e) {
            fail(e);
            return;
        }
        ping.whenComplete((v, err) -> {
            if (err != null) {
                fail(err);
            }
        });
    }

    private void fail(Throwable cause) {
        log.error("[KeepAlive:{}] Ping failed: {}", connectionId, cause.getMessage());
        stop();
        onFailure.accept(cause);
    }
}
