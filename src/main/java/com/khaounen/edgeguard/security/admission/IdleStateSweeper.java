package com.khaounen.edgeguard.security.admission;

import com.khaounen.edgeguard.security.exclusion.ExclusionRegistry;
import com.khaounen.edgeguard.store.IdleEvictable;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Slf4j
public class IdleStateSweeper implements AutoCloseable {

    private final ExclusionRegistry registry;
    private final List<IdleEvictable> evictables;
    private final Duration idleTtl;
    private final Duration interval;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public IdleStateSweeper(
            ExclusionRegistry registry,
            List<IdleEvictable> evictables,
            Duration idleTtl,
            Duration interval,
            Clock clock
    ) {
        this.registry = registry;
        this.evictables = List.copyOf(evictables);
        this.idleTtl = idleTtl == null ? Duration.ZERO : idleTtl;
        this.interval = interval;
        this.clock = clock;
    }

    public synchronized void start() {
        if (scheduler != null || interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "edge-guard-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
        if (idleTtl.isZero()) {
            log.info("per-address state idle eviction disabled, counters grow with distinct addresses");
        }
    }

    public int sweep() {
        Instant now = clock.instant();
        int reaped = registry.sweepExpired(now);
        int evicted = 0;
        if (!idleTtl.isZero() && !idleTtl.isNegative()) {
            Instant cutoff = now.minus(idleTtl);
            for (IdleEvictable evictable : evictables) {
                evicted += evictable.evictIdle(cutoff);
            }
        }
        if (reaped > 0 || evicted > 0) {
            log.debug("sweep reaped {} exclusion(s), evicted {} idle state entr(ies)", reaped, evicted);
        }
        return reaped + evicted;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException ex) {
            log.warn("state sweep failed", ex);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
