package com.tradetracker.domain.enums;

/**
 * Risk profile derived from observed win rate and risk-reward. The profile selects
 * the circuit breaker thresholds applied to a key.
 */
public enum StrategyProfile {
    /** Win rate at least 65% with risk-reward at least 1. */
    HIGH_WR,

    /** Win rate 50-65% with risk-reward between 1 and 2. */
    MODERATE_WR,

    /** Win rate below 50% compensated by risk-reward above 2. Uses STANDARD thresholds. */
    LOW_WR,

    STANDARD;

    public static StrategyProfile classify(double winRate, double riskReward) {
        if (winRate >= 65 && riskReward >= 1.0) {
            return HIGH_WR;
        }
        if (winRate >= 50 && winRate < 65 && riskReward >= 1.0 && riskReward <= 2.0) {
            return MODERATE_WR;
        }
        if (winRate < 50 && riskReward > 2.0) {
            return LOW_WR;
        }
        return STANDARD;
    }
}
