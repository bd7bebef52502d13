package com.tradetracker.domain.enums;

/**
 * Final outcome recorded when a trade is closed.
 *
 * <p>TP3 is the only take-profit level that closes a trade by itself; TP1 and TP2
 * only record their hit. Any exit evaluator close (static stop, breakeven stop,
 * quality filter, trailing stop) is recorded as SL.
 */
public enum TradeOutcome {
    TP1,
    TP2,
    TP3,
    SL,
    TIMEOUT
}
