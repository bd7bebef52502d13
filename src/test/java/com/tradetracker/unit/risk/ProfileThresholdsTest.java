package com.tradetracker.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradetracker.domain.enums.StrategyProfile;
import com.tradetracker.risk.ProfileThresholds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ProfileThresholdsTest {

    @ParameterizedTest(name = "WR {0}% RR {1} -> {2}")
    @CsvSource({
        "70, 1.5, HIGH_WR",
        "65, 1.0, HIGH_WR",
        "55, 1.5, MODERATE_WR",
        "55, 2.5, STANDARD",
        "40, 2.5, LOW_WR",
        "40, 2.0, STANDARD",
        "65, 0.9, STANDARD"
    })
    void classify(double winRate, double riskReward, StrategyProfile expected) {
        assertThat(StrategyProfile.classify(winRate, riskReward)).isEqualTo(expected);
    }

    @Test
    void forProfile_lowWinRateUsesStandardLimits() {
        assertThat(ProfileThresholds.forProfile(StrategyProfile.LOW_WR)).isSameAs(ProfileThresholds.STANDARD);
        assertThat(ProfileThresholds.forProfile(null)).isSameAs(ProfileThresholds.STANDARD);
    }

    @Test
    void highWinRateLimitsAreTighterThanStandard() {
        ProfileThresholds high = ProfileThresholds.forProfile(StrategyProfile.HIGH_WR);
        ProfileThresholds standard = ProfileThresholds.STANDARD;

        assertThat(high.consecutiveLossLimit()).isLessThan(standard.consecutiveLossLimit());
        assertThat(high.maxDrawdownPct()).isGreaterThan(standard.maxDrawdownPct());
        assertThat(high.minWinRate20()).isGreaterThan(standard.minWinRate20());
        assertThat(high.maxPauseCount()).isLessThan(standard.maxPauseCount());
        assertThat(high.positionSizeMultiplier()).isEqualTo(0.75);
    }
}
