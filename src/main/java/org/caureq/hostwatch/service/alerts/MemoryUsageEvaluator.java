package org.caureq.hostwatch.service.alerts;

import org.caureq.hostwatch.domain.Reading;
import org.springframework.stereotype.Component;

@Component
public class MemoryUsageEvaluator extends PercentThresholdEvaluator {
    public static final String KIND = "memory_usage";

    @Override public String kind() { return KIND; }
    @Override public String displayName() { return "Memory Usage"; }
    @Override protected String label() { return "memory"; }
    @Override protected Double measure(Reading r) { return r.getMemPct(); }
}
