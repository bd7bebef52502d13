package com.tradetracker.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Rolling performance of the most recent completed trades for one asset key.
 * Windowed sums (5/10 trades) are 0 when fewer trades exist.
 */
@Value
@Builder
public class PerformanceMetrics {

    int totalTrades;
    double winRate;
    double cumulativePnl5;
    double cumulativePnl10;
    double cumulativePnl20;

    /** Losses among the newest 10 trades; null with fewer than 10 trades. */
    Integer lossesIn10;

    int consecutiveLosses;
    int consecutiveWins;
    double riskReward;
    double hourlyPnl;
    double dailyPnl;
    double maxDrawdown;
    double expectedWinRate;
    double breakevenWinRate;
    double kellyFraction;

    public static PerformanceMetrics empty() {
        return PerformanceMetrics.builder().riskReward(1.0).expectedWinRate(50.0).build();
    }
}
