package org.caureq.hostwatch.service.alerts;

import java.time.Instant;

/**
 * Counters of one sweep. {@code skipped} are pairs left out because of configuration errors,
 * {@code failed} are pairs or hosts that hit a storage or unexpected error.
 */
public record SweepReport(Instant startedAt, Instant finishedAt, int hosts, int checksRun,
                          int opened, int resolved, int ongoing, int notified, int noData,
                          int skipped, int failed, boolean aborted) {

    /** Alert rows inserted or updated, lastNotifiedAt refreshes excluded. */
    public int stateChanges() {
        return opened + resolved;
    }

    static final class Tally {
        int hosts, checksRun, opened, resolved, ongoing, notified, noData, skipped, failed;
        boolean aborted;

        void count(Transition t) {
            switch (t) {
                case OPENED -> opened++;
                case RESOLVED -> resolved++;
                case ONGOING -> ongoing++;
                case NOTIFIED -> notified++;
                case NO_DATA -> noData++;
                case UNCHANGED -> { }
            }
        }

        SweepReport finish(Instant startedAt, Instant finishedAt) {
            return new SweepReport(startedAt, finishedAt, hosts, checksRun, opened, resolved,
                    ongoing, notified, noData, skipped, failed, aborted);
        }
    }
}
