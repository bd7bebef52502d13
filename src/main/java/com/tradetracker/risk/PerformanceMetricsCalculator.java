package com.tradetracker.risk;

import com.tradetracker.domain.model.PerformanceMetrics;
import com.tradetracker.domain.model.Trade;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Computes rolling performance metrics from completed trades ordered newest first.
 *
 * <p>A trade is a win when its final PnL is above zero. Loss streaks and the 10-trade
 * loss count treat a flat trade as a loss; the risk-reward average only uses trades
 * strictly below zero. A missing final PnL counts as 0.
 */
@Component
public class PerformanceMetricsCalculator {

    private static final double KELLY_SCALE = 0.25;
    private static final double KELLY_CAP = 0.25;

    public PerformanceMetrics calculate(List<Trade> newestFirst, LocalDateTime now) {
        if (newestFirst.isEmpty()) {
            return PerformanceMetrics.empty();
        }
        int total = newestFirst.size();

        int wins = 0;
        double winSum = 0;
        int winCount = 0;
        double lossSum = 0;
        int lossCount = 0;
        double hourlyPnl = 0;
        double dailyPnl = 0;
        double pnl20 = 0;

        for (Trade trade : newestFirst) {
            double pnl = pnlOf(trade);
            pnl20 += pnl;
            if (pnl > 0) {
                wins++;
                winSum += pnl;
                winCount++;
            } else if (pnl < 0) {
                lossSum += Math.abs(pnl);
                lossCount++;
            }
            if (trade.getCreatedAt() != null) {
                Duration age = Duration.between(trade.getCreatedAt(), now);
                if (age.compareTo(Duration.ofHours(1)) < 0) {
                    hourlyPnl += pnl;
                }
                if (age.compareTo(Duration.ofDays(1)) < 0) {
                    dailyPnl += pnl;
                }
            }
        }

        double winRate = wins * 100.0 / total;
        double riskReward = 1.0;
        if (winCount > 0 && lossCount > 0) {
            double avgLoss = lossSum / lossCount;
            riskReward = avgLoss > 0 ? (winSum / winCount) / avgLoss : 1.0;
        }

        return PerformanceMetrics.builder()
                .totalTrades(total)
                .winRate(winRate)
                .cumulativePnl5(total >= 5 ? sumNewest(newestFirst, 5) : 0.0)
                .cumulativePnl10(total >= 10 ? sumNewest(newestFirst, 10) : 0.0)
                .cumulativePnl20(pnl20)
                .lossesIn10(total >= 10 ? lossesInNewest(newestFirst, 10) : null)
                .consecutiveLosses(streak(newestFirst, false))
                .consecutiveWins(streak(newestFirst, true))
                .riskReward(riskReward)
                .hourlyPnl(hourlyPnl)
                .dailyPnl(dailyPnl)
                .maxDrawdown(maxDrawdown(newestFirst))
                .expectedWinRate(riskReward > 1 ? 70.0 : 50.0)
                .breakevenWinRate(breakevenWinRate(riskReward))
                .kellyFraction(kellyFraction(winRate, riskReward))
                .build();
    }

    /** Minimum win rate (percent) that breaks even at the given risk-reward. */
    public static double breakevenWinRate(double riskReward) {
        if (riskReward <= 0) {
            return 100.0;
        }
        return 100.0 / (1 + riskReward);
    }

    /** Quarter Kelly, clamped to [0, 0.25]. */
    public static double kellyFraction(double winRate, double riskReward) {
        if (riskReward <= 0) {
            return 0.0;
        }
        double p = winRate / 100.0;
        double kelly = (p * riskReward - (1 - p)) / riskReward;
        return Math.max(0.0, Math.min(kelly * KELLY_SCALE, KELLY_CAP));
    }

    /** Sum of final PnL over a list of trades, missing values counting as 0. */
    public static double sumPnl(List<Trade> trades) {
        double sum = 0;
        for (Trade trade : trades) {
            sum += pnlOf(trade);
        }
        return sum;
    }

    /** Leading run of wins (or of losses) from the newest trade. */
    public static int streak(List<Trade> newestFirst, boolean wins) {
        int count = 0;
        for (Trade trade : newestFirst) {
            boolean win = pnlOf(trade) > 0;
            if (win != wins) {
                break;
            }
            count++;
        }
        return count;
    }

    static double pnlOf(Trade trade) {
        return trade.getFinalPnlPct() != null ? trade.getFinalPnlPct() : 0.0;
    }

    private static double sumNewest(List<Trade> newestFirst, int n) {
        return sumPnl(newestFirst.subList(0, n));
    }

    private static int lossesInNewest(List<Trade> newestFirst, int n) {
        int losses = 0;
        for (Trade trade : newestFirst.subList(0, n)) {
            if (pnlOf(trade) <= 0) {
                losses++;
            }
        }
        return losses;
    }

    /** Deepest fall of the cumulative PnL curve below its running peak, walked oldest first. */
    private static double maxDrawdown(List<Trade> newestFirst) {
        double cumulative = 0;
        double peak = 0;
        double maxDrawdown = 0;
        for (int i = newestFirst.size() - 1; i >= 0; i--) {
            cumulative += pnlOf(newestFirst.get(i));
            peak = Math.max(peak, cumulative);
            maxDrawdown = Math.min(maxDrawdown, cumulative - peak);
        }
        return maxDrawdown;
    }
}
