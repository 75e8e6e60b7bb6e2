package com.khaounen.edgeguard.telemetry;

@FunctionalInterface
public interface TelemetrySink {

    void record(TelemetrySnapshot snapshot);
}
