package org.caureq.hostwatch.service.alerts;

import org.caureq.hostwatch.domain.Reading;
import org.springframework.stereotype.Component;

@Component
public class CpuUsageEvaluator extends PercentThresholdEvaluator {
    public static final String KIND = "cpu_usage";

    @Override public String kind() { return KIND; }
    @Override public String displayName() { return "CPU Usage"; }
    @Override protected String label() { return "CPU"; }
    @Override protected Double measure(Reading r) { return r.getCpuPct(); }
}
