package org.caureq.hostwatch.service.alerts;

/**
 * Result of one check evaluation. {@link Outcome#NO_DATA} means the check could not be
 * evaluated and must not change alert state.
 */
public record Verdict(Outcome outcome, String message) {
    public enum Outcome { ALERTING, OK, NO_DATA }

    public static Verdict alerting(String message) { return new Verdict(Outcome.ALERTING, message); }
    public static Verdict ok(String message) { return new Verdict(Outcome.OK, message); }
    public static Verdict noData(String message) { return new Verdict(Outcome.NO_DATA, message); }

    public boolean isAlerting() { return outcome == Outcome.ALERTING; }
}
