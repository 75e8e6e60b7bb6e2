package com.khaounen.edgeguard.admin;

import com.khaounen.edgeguard.security.admission.EdgeGuardProperties;
import com.khaounen.edgeguard.security.concurrency.ConcurrencyGate;
import com.khaounen.edgeguard.security.exclusion.ExclusionEntry;
import com.khaounen.edgeguard.security.exclusion.ExclusionRegistry;
import com.khaounen.edgeguard.security.exclusion.ExclusionResult;
import com.khaounen.edgeguard.security.exclusion.ExclusionSource;
import com.khaounen.edgeguard.security.exclusion.ExclusionView;
import com.khaounen.edgeguard.utils.IpUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic and block/unblock endpoints. Unauthenticated: expose on a trusted network only.
 */
@RestController
public class ExclusionAdminController {

    private final ExclusionRegistry registry;
    private final ConcurrencyGate concurrencyGate;
    private final EdgeGuardProperties properties;
    private final Clock clock;

    public ExclusionAdminController(
            ExclusionRegistry registry,
            ConcurrencyGate concurrencyGate,
            EdgeGuardProperties properties,
            Clock clock
    ) {
        this.registry = registry;
        this.concurrencyGate = concurrencyGate;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/_debug/defense_status")
    public Map<String, Object> defenseStatus() {
        Instant now = clock.instant();
        Map<String, Long> banned = new LinkedHashMap<>();
        for (ExclusionView view : registry.list(now)) {
            banned.put(view.address(), view.permanent() ? -1L : view.remainingSeconds());
        }
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("global_active_requests", concurrencyGate.globalActive());
        status.put("banned_count", banned.size());
        status.put("banned_ips", banned);
        status.put("profile", properties.getEscalation().getProfile().name());
        return status;
    }

    @GetMapping("/_admin/exclusions")
    public List<ExclusionView> list() {
        return registry.list(clock.instant());
    }

    @PutMapping("/_admin/exclusions/{address}")
    public ResponseEntity<ExclusionView> block(
            @PathVariable("address") String address,
            @RequestParam(name = "seconds", required = false) Long seconds
    ) {
        String normalized = IpUtils.normalize(address);
        if (!IpUtils.isIpLiteral(normalized) || (seconds != null && seconds <= 0)) {
            return ResponseEntity.badRequest().build();
        }
        Instant now = clock.instant();
        var tier = properties.getEscalation().getProfile().tier();
        ExclusionEntry entry = seconds == null
                ? ExclusionEntry.permanent(normalized, now, tier, ExclusionSource.ADMIN)
                : ExclusionEntry.temporary(normalized, now, Duration.ofSeconds(seconds), tier, ExclusionSource.ADMIN);
        ExclusionResult result = registry.exclude(entry);
        return ResponseEntity.ok(ExclusionView.of(result.entry(), now));
    }

    @DeleteMapping("/_admin/exclusions/{address}")
    public ResponseEntity<Map<String, Object>> unblock(@PathVariable("address") String address) {
        String normalized = IpUtils.normalize(address);
        if (!IpUtils.isIpLiteral(normalized)) {
            return ResponseEntity.badRequest().build();
        }
        ExclusionResult result = registry.release(normalized);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("address", normalized);
        body.put("released", result.changed());
        return ResponseEntity.ok(body);
    }
}
