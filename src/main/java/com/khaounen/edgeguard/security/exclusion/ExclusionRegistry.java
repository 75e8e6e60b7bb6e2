package com.khaounen.edgeguard.security.exclusion;

import com.khaounen.edgeguard.store.AddressStateStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A HARD entry that expires locally keeps its packet-filter rule until {@link #release(String)}.
 */
@Slf4j
public class ExclusionRegistry {

    private final AddressStateStore<ExclusionEntry> entries;
    private final PacketFilterSynchronizer packetFilter;
    private final List<ExclusionListener> listeners = new CopyOnWriteArrayList<>();

    public ExclusionRegistry(AddressStateStore<ExclusionEntry> entries, PacketFilterSynchronizer packetFilter) {
        this.entries = entries;
        this.packetFilter = packetFilter;
    }

    public void addListener(ExclusionListener listener) {
        listeners.add(listener);
    }

    public boolean isExcluded(String address, Instant now) {
        return find(address, now) != null;
    }

    public ExclusionEntry find(String address, Instant now) {
        ExclusionEntry entry = entries.get(address);
        if (entry == null) {
            return null;
        }
        if (!entry.isConsistent()) {
            if (entries.removeIf(address, current -> current == entry)) {
                log.warn("dropped inconsistent exclusion entry {}", entry);
            }
            return null;
        }
        if (entry.isExpired(now)) {
            expire(entry);
            return null;
        }
        return entry;
    }

    public ExclusionResult exclude(ExclusionEntry entry) {
        ExclusionEntry[] previous = new ExclusionEntry[1];
        entries.update(entry.address(), (key, existing) -> {
            previous[0] = existing;
            return entry;
        });
        if (entry.tier() == ExclusionTier.HARD) {
            packetFilter.block(entry.address());
        }
        boolean wasActive = previous[0] != null && !previous[0].isExpired(entry.createdAt());
        if (wasActive) {
            log.info("exclusion of {} replaced ({}, {})", entry.address(), entry.tier(),
                    entry.isPermanent() ? "permanent" : "until " + entry.expiresAt());
        } else {
            announce(entry);
        }
        return ExclusionResult.changed(entry);
    }

    public ExclusionResult excludeIfAbsent(ExclusionEntry candidate) {
        Instant now = candidate.createdAt();
        boolean[] created = new boolean[1];
        ExclusionEntry inForce = entries.update(candidate.address(), (key, existing) -> {
            if (existing != null && existing.isConsistent() && !existing.isExpired(now)) {
                return existing;
            }
            created[0] = true;
            return candidate;
        });
        if (!created[0]) {
            return ExclusionResult.unchanged(inForce);
        }
        if (candidate.tier() == ExclusionTier.HARD) {
            packetFilter.block(candidate.address());
        }
        announce(candidate);
        return ExclusionResult.changed(candidate);
    }

    public ExclusionResult release(String address) {
        ExclusionEntry removed = entries.delete(address);
        packetFilter.unblock(address);
        if (removed == null) {
            return ExclusionResult.unchanged(null);
        }
        notifyListeners(listener -> listener.onReleased(removed));
        log.info("released {}", address);
        return ExclusionResult.changed(removed);
    }

    public List<ExclusionView> list(Instant now) {
        List<ExclusionView> views = new ArrayList<>();
        for (String address : entries.snapshot().keySet()) {
            ExclusionEntry entry = find(address, now);
            if (entry != null) {
                views.add(ExclusionView.of(entry, now));
            }
        }
        views.sort(Comparator.comparing(ExclusionView::address));
        return views;
    }

    public int sweepExpired(Instant now) {
        int reaped = 0;
        for (ExclusionEntry entry : entries.snapshot().values()) {
            if (entry.isExpired(now) && expire(entry)) {
                reaped++;
            }
        }
        return reaped;
    }

    public int reconcile(Instant now) {
        Set<String> blocked = packetFilter.importBlocked();
        int imported = 0;
        for (String address : blocked) {
            ExclusionEntry entry = ExclusionEntry.permanent(address, now, ExclusionTier.HARD,
                    ExclusionSource.BACKEND_IMPORT);
            boolean[] created = new boolean[1];
            entries.update(address, (key, existing) -> {
                if (existing != null) {
                    return existing;
                }
                created[0] = true;
                return entry;
            });
            if (created[0]) {
                imported++;
            }
        }
        if (imported > 0) {
            log.info("imported {} address(es) from the packet filter", imported);
        }
        return imported;
    }

    public int size() {
        return (int) entries.size();
    }

    private boolean expire(ExclusionEntry entry) {
        if (!entries.removeIf(entry.address(), current -> current == entry)) {
            return false;
        }
        if (entry.tier() == ExclusionTier.HARD) {
            log.warn("exclusion of {} expired locally; its packet-filter rule stays until explicitly unblocked",
                    entry.address());
        } else {
            log.info("exclusion of {} expired", entry.address());
        }
        notifyListeners(listener -> listener.onExpired(entry));
        return true;
    }

    private void announce(ExclusionEntry entry) {
        log.info("excluded {} ({}, {}, {})", entry.address(), entry.tier(), entry.source(),
                entry.isPermanent() ? "permanent" : "until " + entry.expiresAt());
        notifyListeners(listener -> listener.onExcluded(entry));
    }

    private void notifyListeners(Consumer<ExclusionListener> event) {
        for (ExclusionListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException ex) {
                log.warn("exclusion listener {} failed", listener.getClass().getSimpleName(), ex);
            }
        }
    }
}
