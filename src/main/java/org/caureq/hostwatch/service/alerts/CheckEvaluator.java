package org.caureq.hostwatch.service.alerts;

import org.caureq.hostwatch.domain.Host;
import org.caureq.hostwatch.domain.Reading;
import org.caureq.hostwatch.domain.Severity;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * One kind of check. Implementations are Spring beans collected by {@link CheckRegistry}.
 *
 * @param <P> typed parameters built from the merged default/override map
 */
public interface CheckEvaluator<P> {

    /** Key stored in {@code check_types.checkKey}. */
    String kind();

    String displayName();

    Severity defaultSeverity();

    /** Parameters used when the catalog entry is seeded. */
    Map<String, Object> defaultParams();

    /**
     * Builds typed parameters from the merged map.
     *
     * @throws InvalidCheckConfigException if a value is missing, of the wrong type or out of range
     */
    P parse(Map<String, Object> merged);

    /** Must not touch storage; everything it needs is passed in. */
    Verdict evaluate(Host host, Optional<Reading> latest, P params, Instant now);
}
