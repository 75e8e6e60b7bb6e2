package com.khaounen.edgeguard.telemetry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record TelemetrySnapshot(
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("cpu_percent") double cpuPercent,
        @JsonProperty("memory_percent") double memoryPercent,
        @JsonProperty("memory_used_mb") double memoryUsedMb,
        @JsonProperty("memory_total_mb") double memoryTotalMb,
        @JsonProperty("tcp_established") int tcpEstablished,
        @JsonProperty("bytes_sent_per_s") double bytesSentPerSecond,
        @JsonProperty("bytes_recv_per_s") double bytesRecvPerSecond,
        @JsonProperty("link_utilization_percent") double linkUtilizationPercent,
        @JsonIgnore long bytesSent,
        @JsonIgnore long bytesRecv
) {
}
