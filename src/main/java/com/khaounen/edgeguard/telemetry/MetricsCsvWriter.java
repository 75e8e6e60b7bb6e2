package com.khaounen.edgeguard.telemetry;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;

public class MetricsCsvWriter implements TelemetrySink {

    static final String HEADER =
            "ts,cpu_percent,memory_percent,memory_used_mb,memory_total_mb,tcp_established,bytes_sent,bytes_recv";

    private final Path file;

    public MetricsCsvWriter(Path file) {
        this.file = file;
    }

    @Override
    public synchronized void record(TelemetrySnapshot snapshot) {
        try {
            boolean fresh = !Files.exists(file) || Files.size(file) == 0;
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                if (fresh) {
                    writer.write(HEADER);
                    writer.newLine();
                }
                writer.write(row(snapshot));
                writer.newLine();
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("cannot append metrics to " + file, ex);
        }
    }

    static String row(TelemetrySnapshot s) {
        return String.format(Locale.ROOT, "%d,%s,%s,%s,%s,%d,%d,%d",
                s.timestamp(), s.cpuPercent(), s.memoryPercent(), s.memoryUsedMb(), s.memoryTotalMb(),
                s.tcpEstablished(), s.bytesSent(), s.bytesRecv());
    }
}
