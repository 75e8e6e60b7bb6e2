package com.khaounen.edgeguard.telemetry;

@FunctionalInterface
public interface HostStatsProvider {

    HostStats read();
}
