package com.khaounen.edgeguard.telemetry;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
public class HostTelemetrySampler implements AutoCloseable {

    private static final double MB = 1024d * 1024d;

    private final HostStatsProvider provider;
    private final List<TelemetrySink> sinks;
    private final Duration interval;
    private final double linkSpeedMbps;
    private final Clock clock;
    private final AtomicReference<TelemetrySnapshot> latest = new AtomicReference<>();

    private HostStats previous;
    private Instant previousAt;
    private ScheduledExecutorService scheduler;

    public HostTelemetrySampler(
            HostStatsProvider provider,
            List<TelemetrySink> sinks,
            Duration interval,
            double linkSpeedMbps,
            Clock clock
    ) {
        this.provider = provider;
        this.sinks = List.copyOf(sinks);
        this.interval = interval;
        this.linkSpeedMbps = linkSpeedMbps;
        this.clock = clock;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "edge-guard-telemetry");
            thread.setDaemon(true);
            return thread;
        });
        long millis = Math.max(1, interval.toMillis());
        scheduler.scheduleAtFixedRate(this::sampleSafely, 0, millis, TimeUnit.MILLISECONDS);
    }

    public synchronized TelemetrySnapshot sample() {
        HostStats stats = provider.read();
        Instant now = clock.instant();
        double sentPerSecond = 0;
        double recvPerSecond = 0;
        if (previous != null) {
            double seconds = Math.max(1e-6, Duration.between(previousAt, now).toNanos() / 1_000_000_000d);
            sentPerSecond = Math.max(0, stats.bytesSent() - previous.bytesSent()) / seconds;
            recvPerSecond = Math.max(0, stats.bytesRecv() - previous.bytesRecv()) / seconds;
        }
        previous = stats;
        previousAt = now;

        double memoryPercent = stats.memoryTotalBytes() == 0
                ? 0
                : 100d * stats.memoryUsedBytes() / stats.memoryTotalBytes();
        double linkUtilization = linkSpeedMbps <= 0
                ? 0
                : 100d * ((sentPerSecond + recvPerSecond) * 8) / (linkSpeedMbps * 1_000_000d);

        TelemetrySnapshot snapshot = new TelemetrySnapshot(
                now.getEpochSecond(),
                round(stats.cpuPercent(), 2),
                round(memoryPercent, 2),
                round(stats.memoryUsedBytes() / MB, 2),
                round(stats.memoryTotalBytes() / MB, 2),
                stats.tcpEstablished(),
                round(sentPerSecond, 1),
                round(recvPerSecond, 1),
                round(Math.min(100, linkUtilization), 2),
                stats.bytesSent(),
                stats.bytesRecv()
        );
        latest.set(snapshot);
        for (TelemetrySink sink : sinks) {
            try {
                sink.record(snapshot);
            } catch (RuntimeException ex) {
                log.warn("telemetry sink {} failed: {}", sink.getClass().getSimpleName(), ex.getMessage());
            }
        }
        return snapshot;
    }

    public TelemetrySnapshot latest() {
        return latest.get();
    }

    private void sampleSafely() {
        try {
            sample();
        } catch (RuntimeException ex) {
            log.warn("telemetry sample failed", ex);
        }
    }

    private static double round(double value, int digits) {
        double scale = Math.pow(10, digits);
        return Math.round(value * scale) / scale;
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
