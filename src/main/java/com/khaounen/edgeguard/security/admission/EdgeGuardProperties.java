package com.khaounen.edgeguard.security.admission;

import com.khaounen.edgeguard.security.escalation.MitigationProfile;
import com.khaounen.edgeguard.security.ratelimit.RateLimitStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.AntPathMatcher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "edge-guard")
public class EdgeGuardProperties {

    private boolean enabled = false;
    private boolean failOpen = false;
    private ExclusionStatus exclusionStatus = ExclusionStatus.TOO_MANY_REQUESTS;
    private boolean trustForwardedHeaders = false;
    private List<String> bypassPaths = new ArrayList<>();
    private RateLimit rateLimit = new RateLimit();
    private Concurrency concurrency = new Concurrency();
    private Escalation escalation = new Escalation();
    private State state = new State();
    private PacketFilter packetFilter = new PacketFilter();
    private Telemetry telemetry = new Telemetry();
    private Admin admin = new Admin();

    private final AntPathMatcher matcher = new AntPathMatcher();

    public boolean isBypassed(String path) {
        if (path == null || bypassPaths == null) {
            return false;
        }
        for (String pattern : bypassPaths) {
            if (matcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Data
    public static class RateLimit {
        private RateLimitStrategy strategy = RateLimitStrategy.SLIDING_WINDOW;
        private double rateBase = 5;
        private int rateBurst = 20;
        private int windowSeconds = 10;
        private int windowMaxRequests = 12;
    }

    @Data
    public static class Concurrency {
        private int perAddressLimit = 6;
        private int globalLimit = 80;
    }

    @Data
    public static class Escalation {
        private int banThreshold = 4;
        private int banSeconds = 120;
        private boolean banPermanent = false;
        private MitigationProfile profile = MitigationProfile.SOFT;
    }

    @Data
    public static class State {
        private Duration idleTtl = Duration.ZERO;
        private Duration sweepInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class PacketFilter {
        private boolean enabled = false;
        private List<String> command = new ArrayList<>(List.of("ipset"));
        private String setName = "edge-guard-blocked";
        private int timeoutMs = 2000;
        private boolean reconcileOnStartup = true;
    }

    @Data
    public static class Telemetry {
        private boolean enabled = false;
        private Duration interval = Duration.ofSeconds(5);
        private String csvFile = "metrics.csv";
        private double linkSpeedMbps = 1000;
    }

    @Data
    public static class Admin {
        private boolean enabled = false;
    }

    public enum ExclusionStatus {
        TOO_MANY_REQUESTS(429),
        NOT_FOUND(404);

        private final int code;

        ExclusionStatus(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }
    }
}
