package com.tradetracker.domain.enums;

/**
 * Direction of a tracked trade. PnL, excursions and stop crossings are all
 * computed relative to this direction.
 */
public enum TradeDirection {
    LONG,
    SHORT;

    public boolean isLong() {
        return this == LONG;
    }
}
