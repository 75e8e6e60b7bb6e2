package com.khaounen.edgeguard.security.concurrency;

import com.khaounen.edgeguard.store.AddressStateStore;
import com.khaounen.edgeguard.store.IdleEvictable;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
public class ConcurrencyGate implements IdleEvictable {

    private final int perAddressLimit;
    private final int globalLimit;
    private final AddressStateStore<Slots> slots;
    private final Clock clock;
    private final AtomicInteger globalActive = new AtomicInteger();

    public ConcurrencyGate(int perAddressLimit, int globalLimit, AddressStateStore<Slots> slots, Clock clock) {
        if (perAddressLimit < 1 || globalLimit < 1) {
            throw new IllegalArgumentException(
                    "concurrency limits must be positive: perAddress=" + perAddressLimit + ", global=" + globalLimit
            );
        }
        this.perAddressLimit = perAddressLimit;
        this.globalLimit = globalLimit;
        this.slots = slots;
        this.clock = clock;
    }

    public ConcurrencyPermit acquire(String address) {
        if (!incrementGlobal()) {
            return ConcurrencyPermit.denied(address, ConcurrencyPermit.Scope.GLOBAL);
        }
        boolean[] admitted = new boolean[1];
        try {
            slots.update(address, (key, existing) -> {
                int active = existing == null ? 0 : sanitize(key, existing.active());
                if (active >= perAddressLimit) {
                    return existing;
                }
                admitted[0] = true;
                return new Slots(active + 1, clock.instant());
            });
        } finally {
            if (!admitted[0]) {
                decrementGlobal();
            }
        }
        if (!admitted[0]) {
            return ConcurrencyPermit.denied(address, ConcurrencyPermit.Scope.PER_ADDRESS);
        }
        return ConcurrencyPermit.granted(this, address);
    }

    public void release(String address) {
        boolean[] released = new boolean[1];
        slots.update(address, (key, existing) -> {
            if (existing == null) {
                return null;
            }
            int active = sanitize(key, existing.active());
            if (active == 0) {
                return active == existing.active() ? existing : new Slots(0, existing.lastChange());
            }
            released[0] = true;
            return new Slots(active - 1, clock.instant());
        });
        if (released[0]) {
            decrementGlobal();
        }
    }

    public int activeFor(String address) {
        Slots current = slots.get(address);
        return current == null ? 0 : current.active();
    }

    public int globalActive() {
        return globalActive.get();
    }

    @Override
    public int evictIdle(Instant cutoff) {
        int evicted = 0;
        for (String address : slots.snapshot().keySet()) {
            if (slots.removeIf(address, current -> current.active() == 0 && current.lastChange().isBefore(cutoff))) {
                evicted++;
            }
        }
        return evicted;
    }

    private boolean incrementGlobal() {
        while (true) {
            int current = globalActive.get();
            if (current >= globalLimit) {
                return false;
            }
            if (globalActive.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private void decrementGlobal() {
        while (true) {
            int current = globalActive.get();
            if (current <= 0) {
                if (current < 0 && globalActive.compareAndSet(current, 0)) {
                    log.warn("global concurrency counter was {}, reset to 0", current);
                }
                return;
            }
            if (globalActive.compareAndSet(current, current - 1)) {
                return;
            }
        }
    }

    private static int sanitize(String address, int active) {
        if (active < 0) {
            log.warn("concurrency counter for {} was {}, reset to 0", address, active);
            return 0;
        }
        return active;
    }

    public record Slots(int active, Instant lastChange) {
    }
}
