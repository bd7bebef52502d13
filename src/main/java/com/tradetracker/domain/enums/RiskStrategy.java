package com.tradetracker.domain.enums;

/**
 * Exit strategy variant assigned to a trade at creation. Each variant is bound to
 * exactly one {@code ExitEvaluator} implementation.
 */
public enum RiskStrategy {
    /** Fixed stop-loss by price, falling back to percentage. */
    STATIC,

    /** Requires early profit within a time window, then trails at breakeven. */
    EARLY_MOMENTUM,

    /** Static stop plus a momentum-aware trailing stop. */
    ADAPTIVE_TRAILING
}
