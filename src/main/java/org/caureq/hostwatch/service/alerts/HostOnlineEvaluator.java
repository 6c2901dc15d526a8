package org.caureq.hostwatch.service.alerts;

import org.caureq.hostwatch.domain.Host;
import org.caureq.hostwatch.domain.Reading;
import org.caureq.hostwatch.domain.Severity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Alerts when a host has been silent for longer than {@code offline_threshold_minutes},
 * or has never reported at all. Exactly the threshold is still online.
 */
@Component
public class HostOnlineEvaluator implements CheckEvaluator<HostOnlineEvaluator.OfflineParams> {
    public static final String KIND = "host_online";

    public record OfflineParams(int offlineThresholdMinutes) {}

    @Override public String kind() { return KIND; }
    @Override public String displayName() { return "Host Online"; }
    @Override public Severity defaultSeverity() { return Severity.L1; }
    @Override public Map<String, Object> defaultParams() { return Map.of("offline_threshold_minutes", 60); }

    @Override
    public OfflineParams parse(Map<String, Object> merged) {
        return new OfflineParams(Params.positiveInt(KIND, merged, "offline_threshold_minutes"));
    }

    @Override
    public Verdict evaluate(Host host, Optional<Reading> latest, OfflineParams p, Instant now) {
        if (latest.isEmpty()) {
            return Verdict.alerting("Host '%s' has never reported data".formatted(host.getHostname()));
        }
        Instant lastSeen = host.getLastSeen() != null ? host.getLastSeen() : latest.get().getCollectedAt();
        var silent = Duration.between(lastSeen, now);
        var limit = Duration.ofMinutes(p.offlineThresholdMinutes());
        if (silent.compareTo(limit) > 0) {
            return Verdict.alerting("Host '%s' offline for %d minutes (threshold: %d)"
                    .formatted(host.getHostname(), silent.toMinutes(), p.offlineThresholdMinutes()));
        }
        return Verdict.ok("Host '%s' is online".formatted(host.getHostname()));
    }
}
