package com.tradetracker.domain.enums;

/**
 * Trading status of an (instrument, direction, source) key.
 *
 * <p>Transitions: ACTIVE → PAUSED → RECOVERY → ACTIVE, and PAUSED/RECOVERY/ACTIVE →
 * BLACKLISTED. BLACKLISTED is terminal until manual review.
 */
public enum AssetStatus {
    ACTIVE,
    PAUSED,
    RECOVERY,
    BLACKLISTED;

    /** Whether new trades may be accepted for a key in this status. */
    public boolean allowsTrading() {
        return this == ACTIVE || this == RECOVERY;
    }
}
