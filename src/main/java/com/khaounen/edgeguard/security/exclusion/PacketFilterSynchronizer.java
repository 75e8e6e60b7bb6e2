package com.khaounen.edgeguard.security.exclusion;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

@Slf4j
public class PacketFilterSynchronizer implements AutoCloseable {

    private final PacketFilterBackend backend;
    private final ExecutorService executor;

    public PacketFilterSynchronizer(PacketFilterBackend backend) {
        this(backend, Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "edge-guard-packet-filter");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public PacketFilterSynchronizer(PacketFilterBackend backend, ExecutorService executor) {
        this.backend = backend;
        this.executor = executor;
    }

    public CompletableFuture<Boolean> block(String address) {
        return submit("block", address, () -> backend.block(address));
    }

    public CompletableFuture<Boolean> unblock(String address) {
        return submit("unblock", address, () -> backend.unblock(address));
    }

    public Set<String> importBlocked() {
        try {
            return backend.listBlocked();
        } catch (PacketFilterException ex) {
            log.warn("packet filter list failed, starting with local exclusions only: {}", ex.getMessage());
            return Set.of();
        }
    }

    private CompletableFuture<Boolean> submit(String operation, String address, Runnable call) {
        try {
            return CompletableFuture.supplyAsync(() -> apply(operation, address, call), executor);
        } catch (RejectedExecutionException ex) {
            log.warn("packet filter {} of {} dropped, synchronizer is shut down", operation, address);
            return CompletableFuture.completedFuture(false);
        }
    }

    private boolean apply(String operation, String address, Runnable call) {
        try {
            call.run();
            log.debug("packet filter {} of {} applied", operation, address);
            return true;
        } catch (PacketFilterException ex) {
            if (ex.isUnavailable()) {
                log.warn("packet filter unavailable, {} of {} enforced locally only: {}",
                        operation, address, ex.getMessage());
            } else {
                log.warn("packet filter {} of {} failed: {}", operation, address, ex.getMessage());
            }
            return false;
        } catch (RuntimeException ex) {
            log.warn("packet filter {} of {} failed", operation, address, ex);
            return false;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
