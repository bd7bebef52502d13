package com.tradetracker.risk;

import com.tradetracker.domain.enums.StrategyProfile;
import java.util.EnumMap;
import java.util.Map;

/**
 * Circuit breaker limits for one strategy profile. High win-rate profiles get tighter
 * limits because a streak of losses is stronger evidence that the edge is gone.
 *
 * <p>Percent limits are negative PnL percentages; a value strictly below the limit trips it.
 */
public record ProfileThresholds(
        int consecutiveLossLimit,
        int lossesIn10Limit,
        double maxDrawdownPct,
        double minWinRate20,
        int pauseDurationDays,
        int maxPauseCount,
        int recoveryWinsRequired,
        double recoveryWinRate10,
        double recoveryPnlThreshold,
        double positionSizeMultiplier,
        double hourlyLossCapPct,
        double dailyLossCapPct) {

    public static final ProfileThresholds STANDARD =
            new ProfileThresholds(5, 7, -5.0, 40.0, 7, 3, 2, 50.0, 1.0, 1.0, -3.0, -5.0);

    public static final ProfileThresholds HIGH_WR =
            new ProfileThresholds(3, 5, -3.0, 55.0, 3, 2, 3, 60.0, 2.0, 0.75, -1.5, -3.0);

    public static final ProfileThresholds MODERATE_WR =
            new ProfileThresholds(4, 6, -4.0, 45.0, 5, 3, 2, 55.0, 1.5, 0.9, -2.0, -4.0);

    private static final Map<StrategyProfile, ProfileThresholds> BY_PROFILE = new EnumMap<>(StrategyProfile.class);

    static {
        BY_PROFILE.put(StrategyProfile.STANDARD, STANDARD);
        BY_PROFILE.put(StrategyProfile.HIGH_WR, HIGH_WR);
        BY_PROFILE.put(StrategyProfile.MODERATE_WR, MODERATE_WR);
        BY_PROFILE.put(StrategyProfile.LOW_WR, STANDARD);
    }

    public static ProfileThresholds forProfile(StrategyProfile profile) {
        return profile != null ? BY_PROFILE.get(profile) : STANDARD;
    }
}
