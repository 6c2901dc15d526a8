package org.caureq.hostwatch.domain;

import java.util.List;

public enum AlertStatus {
    OPEN, ACKNOWLEDGED, RESOLVED;

    /** Statuses that make a record the active alert of its (host, check) pair. */
    public static final List<AlertStatus> ACTIVE = List.of(OPEN, ACKNOWLEDGED);

    public boolean isActive() {
        return this != RESOLVED;
    }
}
