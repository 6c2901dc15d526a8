package org.caureq.hostwatch.service.alerts;

import org.caureq.hostwatch.domain.Host;
import org.caureq.hostwatch.domain.Reading;
import org.caureq.hostwatch.domain.Severity;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Base for checks comparing one percentage of the latest reading against {@code threshold_pct}.
 * A value equal to the threshold alerts. A missing reading or a missing field yields NO_DATA.
 */
public abstract class PercentThresholdEvaluator implements CheckEvaluator<PercentThresholdEvaluator.ThresholdParams> {

    public record ThresholdParams(double thresholdPct) {}

    /** Short label used in messages, e.g. "disk". */
    protected abstract String label();

    /** The measured percentage, or null if the agent did not report it. */
    protected abstract Double measure(Reading r);

    @Override public Severity defaultSeverity() { return Severity.L2; }
    @Override public Map<String, Object> defaultParams() { return Map.of("threshold_pct", 90); }

    @Override
    public ThresholdParams parse(Map<String, Object> merged) {
        return new ThresholdParams(Params.percent(kind(), merged, "threshold_pct"));
    }

    @Override
    public Verdict evaluate(Host host, Optional<Reading> latest, ThresholdParams p, Instant now) {
        Double value = latest.map(this::measure).orElse(null);
        if (value == null) {
            return Verdict.noData("No %s data available for host '%s'".formatted(label(), host.getHostname()));
        }
        if (value >= p.thresholdPct()) {
            return Verdict.alerting(String.format(Locale.ROOT, "Host '%s' %s usage critical: %.1f%% (threshold: %.1f%%)",
                    host.getHostname(), label(), value, p.thresholdPct()));
        }
        return Verdict.ok(String.format(Locale.ROOT, "Host '%s' %s usage normal: %.1f%%",
                host.getHostname(), label(), value));
    }
}
