package com.tradetracker.domain.enums;

/** Severity of a circuit breaker alert. */
public enum AlertSeverity {
    /** Asset paused, trading resumes after the pause duration. */
    HIGH,

    /** Asset blacklisted, needs manual review. */
    CRITICAL
}
