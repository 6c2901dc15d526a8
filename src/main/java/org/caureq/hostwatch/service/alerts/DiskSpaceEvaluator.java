package org.caureq.hostwatch.service.alerts;

import org.caureq.hostwatch.domain.Reading;
import org.springframework.stereotype.Component;

@Component
public class DiskSpaceEvaluator extends PercentThresholdEvaluator {
    public static final String KIND = "disk_space";

    @Override public String kind() { return KIND; }
    @Override public String displayName() { return "Disk Space"; }
    @Override protected String label() { return "disk"; }
    @Override protected Double measure(Reading r) { return r.getDiskPct(); }
}
