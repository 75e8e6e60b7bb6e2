package com.khaounen.edgeguard.telemetry;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

@Slf4j
public class ProcfsHostStatsProvider implements HostStatsProvider {

    private static final String TCP_ESTABLISHED = "01";

    private final Path procNet;

    public ProcfsHostStatsProvider() {
        this(Paths.get("/proc/net"));
    }

    public ProcfsHostStatsProvider(Path procNet) {
        this.procNet = procNet;
    }

    @Override
    public HostStats read() {
        double cpu = 0;
        long total = 0;
        long used = 0;
        if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean os) {
            double load = os.getCpuLoad();
            cpu = load < 0 ? 0 : load * 100;
            total = os.getTotalMemorySize();
            used = total - os.getFreeMemorySize();
        }
        long[] net = readNetDev();
        return new HostStats(cpu, total, used, net[0], net[1], countEstablished());
    }

    long[] readNetDev() {
        long sent = 0;
        long recv = 0;
        List<String> lines = readLines(procNet.resolve("dev"));
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String iface = line.substring(0, colon).trim();
            if (iface.equals("lo")) {
                continue;
            }
            String[] fields = line.substring(colon + 1).trim().split("\\s+");
            if (fields.length < 9) {
                continue;
            }
            try {
                recv += Long.parseLong(fields[0]);
                sent += Long.parseLong(fields[8]);
            } catch (NumberFormatException ex) {
                log.debug("unreadable /proc/net/dev line: {}", line);
            }
        }
        return new long[]{sent, recv};
    }

    int countEstablished() {
        Path tcp = procNet.resolve("tcp");
        Path tcp6 = procNet.resolve("tcp6");
        if (!Files.isReadable(tcp) && !Files.isReadable(tcp6)) {
            return -1;
        }
        return countState(readLines(tcp)) + countState(readLines(tcp6));
    }

    private static int countState(List<String> lines) {
        int count = 0;
        for (String line : lines) {
            String[] fields = line.trim().split("\\s+");
            // sl local_address rem_address st ...
            if (fields.length > 3 && TCP_ESTABLISHED.equals(fields[3])) {
                count++;
            }
        }
        return count;
    }

    private static List<String> readLines(Path path) {
        if (!Files.isReadable(path)) {
            return List.of();
        }
        try {
            return Files.readAllLines(path, StandardCharsets.US_ASCII);
        } catch (IOException ex) {
            log.debug("cannot read {}: {}", path, ex.getMessage());
            return List.of();
        }
    }
}
