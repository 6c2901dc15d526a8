package org.caureq.hostwatch.service.alerts;

import org.caureq.hostwatch.domain.Host;
import org.caureq.hostwatch.domain.Reading;

import java.time.Instant;
import java.util.Optional;

/** An evaluator bound to validated parameters for one (host, check) pair. */
public record ResolvedCheck<P>(CheckEvaluator<P> evaluator, P params) {
    public Verdict evaluate(Host host, Optional<Reading> latest, Instant now) {
        return evaluator.evaluate(host, latest, params, now);
    }
}
