package com.homeostat.core.model;

/**
 * System-wide operating regime. Exactly one is active at a time and only the
 * mode controller changes it.
 */
public enum Mode {
    NORMAL,
    ALERT,
    DEGRADED,
    LOCKDOWN,
    RECOVERY
}
