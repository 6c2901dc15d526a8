package org.caureq.hostwatch.service.alerts;

/** What one reconciliation did to the alert state of a (host, check) pair. */
public enum Transition {
    /** normal -> alerting, a new open record was inserted */
    OPENED,
    /** alerting -> normal, the active record was resolved */
    RESOLVED,
    /** still alerting, nothing written */
    ONGOING,
    /** still alerting, lastNotifiedAt refreshed after the cooldown */
    NOTIFIED,
    /** no verdict, nothing written */
    NO_DATA,
    /** normal and staying normal, or lost a race to another writer */
    UNCHANGED
}
