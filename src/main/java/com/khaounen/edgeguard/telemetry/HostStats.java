package com.khaounen.edgeguard.telemetry;

public record HostStats(
        double cpuPercent,
        long memoryTotalBytes,
        long memoryUsedBytes,
        long bytesSent,
        long bytesRecv,
        int tcpEstablished
) {
}
