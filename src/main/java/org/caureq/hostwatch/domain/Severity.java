package org.caureq.hostwatch.domain;

/** L1 is the most urgent. */
public enum Severity { L1, L2, L3 }
