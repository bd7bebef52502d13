package com.tradetracker.domain.enums;

/**
 * Progress of a trade through its take-profit levels, used by the adaptive trailing
 * stop to pick the trailing distance. The state only ever advances.
 */
public enum MomentumState {
    /** Before TP1: widest trail to survive early noise. */
    PRE_TP1(1.5),

    /** Between TP1 and TP2: normal trail. */
    TP1_TP2(1.0),

    /** After TP2: tight trail to lock in profit. */
    POST_TP2(0.7);

    private final double defaultMultiplier;

    MomentumState(double defaultMultiplier) {
        this.defaultMultiplier = defaultMultiplier;
    }

    public double getDefaultMultiplier() {
        return defaultMultiplier;
    }

    public boolean isAfter(MomentumState other) {
        return ordinal() > other.ordinal();
    }
}
