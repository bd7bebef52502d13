package com.tradetracker.domain.enums;

/** Lifecycle status of a trade setup. A trade never returns to ACTIVE once completed. */
public enum TradeStatus {
    ACTIVE,
    COMPLETED
}
