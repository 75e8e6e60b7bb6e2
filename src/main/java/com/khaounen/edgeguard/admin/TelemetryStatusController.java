package com.khaounen.edgeguard.admin;

import com.khaounen.edgeguard.telemetry.HostTelemetrySampler;
import com.khaounen.edgeguard.telemetry.TelemetrySnapshot;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TelemetryStatusController {

    private final HostTelemetrySampler sampler;

    public TelemetryStatusController(HostTelemetrySampler sampler) {
        this.sampler = sampler;
    }

    @GetMapping("/status")
    public TelemetrySnapshot status() {
        TelemetrySnapshot latest = sampler.latest();
        return latest != null ? latest : sampler.sample();
    }
}
