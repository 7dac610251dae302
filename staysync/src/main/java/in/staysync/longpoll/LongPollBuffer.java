package in.staysync.longpoll;

import in.staysync.config.LongPollConfig;
import in.staysync.domain.common.Channel;
import in.staysync.domain.event.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-tenant bounded event buffer with parked waiters, for clients that cannot hold a stream open.
 *
 * A waiter only sees events pushed after it parked, so the first matching push always wakes it.
 * Unanswered waiters are resolved with an empty list once their timeout elapses.
 */
public final class LongPollBuffer {
    private static final Logger log = LoggerFactory.getLogger(LongPollBuffer.class);

    private final Channel channel;
    private final LongPollConfig config;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final ConcurrentHashMap<Long, TenantBuffer> tenants = new ConcurrentHashMap<>();

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong rejections = new AtomicLong();

    public LongPollBuffer(Channel channel, LongPollConfig config, ScheduledExecutorService scheduler, Clock clock) {
        this.channel = channel;
        this.config = config;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public Channel getChannel() {
        return channel;
    }

    /**
     * Buffer an event and wake every waiter whose property filter matches it.
     */
    public void push(long tenantId, DomainEvent event) {
        List<Wake> wakes = new ArrayList<>();
        while (true) {
            TenantBuffer buf = tenants.computeIfAbsent(tenantId, k -> new TenantBuffer(clock.instant()));
            synchronized (buf) {
                if (buf.evicted) {
                    continue;
                }
                Instant now = clock.instant();
                pruneExpired(buf, now);
                buf.events.addLast(new Entry(++buf.lastOrdinal, now, event));
                while (buf.events.size() > config.maxBufferSize()) {
                    buf.events.pollFirst();
                    dropped.incrementAndGet();
                }
                buf.lastActivity = now;

                Iterator<Waiter> it = buf.waiters.iterator();
                while (it.hasNext()) {
                    Waiter w = it.next();
                    if (!matches(w.propertyFilter, event)) {
                        continue;
                    }
                    it.remove();
                    List<DomainEvent> events = new ArrayList<>();
                    for (Entry e : buf.events) {
                        if (e.ordinal > w.afterOrdinal && matches(w.propertyFilter, e.event)) {
                            events.add(e.event);
                        }
                    }
                    wakes.add(new Wake(w, LongPollResult.of(events, w.since, now)));
                }
            }
            break;
        }
        published.incrementAndGet();

        for (Wake wake : wakes) {
            if (wake.waiter.timeout != null) {
                wake.waiter.timeout.cancel(false);
            }
            if (wake.waiter.future.complete(wake.result)) {
                delivered.addAndGet(wake.result.events().size());
            }
        }
    }

    /**
     * Return buffered events newer than {@code since} right away, or park until a matching push
     * or the timeout.
     *
     * @param propertyFilter only events of this property; null for all
     * @param since          only events stamped after this instant; null for everything buffered
     */
    public CompletableFuture<LongPollResult> subscribe(long tenantId, Long propertyFilter, Instant since,
                                                       Duration timeout) {
        while (true) {
            TenantBuffer buf = tenants.computeIfAbsent(tenantId, k -> new TenantBuffer(clock.instant()));
            synchronized (buf) {
                if (buf.evicted) {
                    continue;
                }
                Instant now = clock.instant();
                pruneExpired(buf, now);
                buf.lastActivity = now;

                List<DomainEvent> available = new ArrayList<>();
                for (Entry e : buf.events) {
                    if ((since == null || e.event.timestamp().isAfter(since)) && matches(propertyFilter, e.event)) {
                        available.add(e.event);
                    }
                }
                if (!available.isEmpty()) {
                    delivered.addAndGet(available.size());
                    return CompletableFuture.completedFuture(LongPollResult.of(available, since, now));
                }

                if (buf.waiters.size() >= config.maxWaitersPerTenant()) {
                    rejections.incrementAndGet();
                    log.warn("[LongPoll:{}] Waiter cap reached for tenant {} ({} waiting)",
                        channel, tenantId, buf.waiters.size());
                    return CompletableFuture.completedFuture(LongPollResult.of(List.of(), since, now));
                }

                Waiter waiter = new Waiter(propertyFilter, buf.lastOrdinal, since);
                buf.waiters.add(waiter);
                waiter.timeout = scheduler.schedule(() -> expire(buf, waiter),
                    timeout.toMillis(), TimeUnit.MILLISECONDS);
                waiter.future.whenComplete((r, err) -> {
                    if (err != null) {
                        // Cancelled by the transport, e.g. client went away.
                        withdraw(buf, waiter);
                    }
                });
                return waiter.future;
            }
        }
    }

    /**
     * Subscribe with the configured timeout.
     */
    public CompletableFuture<LongPollResult> subscribe(long tenantId, Long propertyFilter, Instant since) {
        return subscribe(tenantId, propertyFilter, since, config.pollTimeout());
    }

    /**
     * Drop expired events and evict tenants idle past the eviction window.
     *
     * @return number of tenants evicted
     */
    public int sweep() {
        Instant now = clock.instant();
        Instant idleCutoff = now.minus(config.tenantIdleEvict());
        int evicted = 0;
        for (Map.Entry<Long, TenantBuffer> e : tenants.entrySet()) {
            TenantBuffer buf = e.getValue();
            synchronized (buf) {
                pruneExpired(buf, now);
                if (buf.waiters.isEmpty() && buf.lastActivity.isBefore(idleCutoff)) {
                    buf.evicted = true;
                    tenants.remove(e.getKey(), buf);
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.debug("[LongPoll:{}] Evicted {} idle tenants", channel, evicted);
        }
        return evicted;
    }

    /**
     * Resolve every parked waiter with an empty result. Used on shutdown.
     */
    public void releaseAll() {
        Instant now = clock.instant();
        for (TenantBuffer buf : tenants.values()) {
            List<Waiter> parked;
            synchronized (buf) {
                parked = new ArrayList<>(buf.waiters);
                buf.waiters.clear();
            }
            for (Waiter w : parked) {
                if (w.timeout != null) {
                    w.timeout.cancel(false);
                }
                w.future.complete(LongPollResult.of(List.of(), w.since, now));
            }
        }
    }

    public LongPollStats getStats() {
        int buffered = 0;
        int waiting = 0;
        for (TenantBuffer buf : tenants.values()) {
            synchronized (buf) {
                buffered += buf.events.size();
                waiting += buf.waiters.size();
            }
        }
        return new LongPollStats(tenants.size(), buffered, waiting, published.get(), delivered.get(),
                                 dropped.get(), timeouts.get(), rejections.get());
    }

    private void expire(TenantBuffer buf, Waiter waiter) {
        boolean removed;
        synchronized (buf) {
            removed = buf.waiters.remove(waiter);
        }
        if (removed) {
            timeouts.incrementAndGet();
            waiter.future.complete(LongPollResult.of(List.of(), waiter.since, clock.instant()));
        }
    }

    private void withdraw(TenantBuffer buf, Waiter waiter) {
        synchronized (buf) {
            buf.waiters.remove(waiter);
        }
        if (waiter.timeout != null) {
            waiter.timeout.cancel(false);
        }
    }

    private void pruneExpired(TenantBuffer buf, Instant now) {
        Instant cutoff = now.minus(config.eventTtl());
        while (!buf.events.isEmpty() && buf.events.peekFirst().bufferedAt.isBefore(cutoff)) {
            buf.events.pollFirst();
        }
    }

    private static boolean matches(Long propertyFilter, DomainEvent event) {
        return propertyFilter == null || propertyFilter.equals(event.propertyId());
    }

    private static final class TenantBuffer {
        private final ArrayDeque<Entry> events = new ArrayDeque<>();
        private final List<Waiter> waiters = new ArrayList<>();
        private long lastOrdinal;
        private Instant lastActivity;
        private boolean evicted;

        TenantBuffer(Instant now) {
            this.lastActivity = now;
        }
    }

    private record Entry(long ordinal, Instant bufferedAt, DomainEvent event) {}

    private static final class Waiter {
        private final Long propertyFilter;
        private final long afterOrdinal;
        private final Instant since;
        private final CompletableFuture<LongPollResult> future = new CompletableFuture<>();
        private volatile ScheduledFuture<?> timeout;

        Waiter(Long propertyFilter, long afterOrdinal, Instant since) {
            this.propertyFilter = propertyFilter;
            this.afterOrdinal = afterOrdinal;
            this.since = since;
        }
    }

    private record Wake(Waiter waiter, LongPollResult result) {}
}
