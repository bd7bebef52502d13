package com.tradetracker.unit.exit;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradetracker.config.ExitStrategyConfig;
import com.tradetracker.domain.enums.RiskStrategy;
import com.tradetracker.domain.enums.TradeDirection;
import com.tradetracker.domain.model.ExitDecision;
import com.tradetracker.domain.model.Trade;
import com.tradetracker.exit.EarlyMomentumEvaluator;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EarlyMomentumEvaluatorTest {

    private static final LocalDateTime ENTRY = LocalDateTime.of(2024, 3, 1, 10, 0);

    private EarlyMomentumEvaluator evaluator;
    private Trade trade;

    @BeforeEach
    void setUp() {
        evaluator = new EarlyMomentumEvaluator(new ExitStrategyConfig());
        trade = Trade.builder()
                .tradeIdentifier("T-EM")
                .symbol("ETHUSDT.P")
                .direction(TradeDirection.LONG)
                .entryPrice(new BigDecimal("100"))
                .entryTime(ENTRY)
                .riskStrategy(RiskStrategy.EARLY_MOMENTUM)
                .build();
    }

    private ExitDecision tick(double pnl, double minute) {
        BigDecimal price = BigDecimal.valueOf(100 + pnl);
        return evaluator.evaluate(trade, price, pnl, minute, ENTRY.plusSeconds((long) (minute * 60)));
    }

    @Nested
    @DisplayName("Momentum detected")
    class MomentumDetected {

        @Test
        @DisplayName("evaluate: +0.6% at minute 3 then 0% keeps the trade open")
        void breakevenAtEntryKeepsOpen() {
            assertThat(tick(0.6, 3).close()).isFalse();
            assertThat(trade.isMomentumDetected()).isTrue();
            assertThat(trade.isSlMovedToBreakeven()).isTrue();
            assertThat(trade.getMomentumPnlPct()).isEqualTo(0.6);

            assertThat(tick(0.0, 4).close()).isFalse();
            assertThat(tick(0.1, 30).close()).isFalse();
        }

        @Test
        @DisplayName("evaluate: falling below entry after momentum closes at breakeven")
        void belowEntryClosesAtBreakeven() {
            tick(0.6, 3);

            ExitDecision decision = tick(-0.1, 8);

            assertThat(decision.close()).isTrue();
            assertThat(decision.reason()).isEqualTo(EarlyMomentumEvaluator.REASON_BREAKEVEN);
            assertThat(trade.getSlTypeHit()).isEqualTo("breakeven");
            assertThat(trade.isLowQualitySignal()).isFalse();
        }
    }

    @Nested
    @DisplayName("No momentum")
    class NoMomentum {

        @Test
        @DisplayName("evaluate: +0.2% at minute 6 closes as quality_filter")
        void windowExpiredClosesAsLowQuality() {
            assertThat(tick(0.2, 2).close()).isFalse();

            ExitDecision decision = tick(0.2, 6);

            assertThat(decision.close()).isTrue();
            assertThat(decision.reason()).isEqualTo(EarlyMomentumEvaluator.REASON_QUALITY_FILTER);
            assertThat(trade.isLowQualitySignal()).isTrue();
            assertThat(trade.isSlHit()).isTrue();
            assertThat(trade.getSlTimeMinutes()).isEqualTo(6);
        }

        @Test
        @DisplayName("evaluate: per-trade window and threshold override the defaults")
        void perTradeOverrides() {
            trade.setMomentumWindowMinutes(10.0);
            trade.setMomentumThresholdPct(1.0);

            assertThat(tick(0.6, 3).close()).isFalse();
            assertThat(trade.isMomentumDetected()).isFalse();
            assertThat(tick(0.3, 8).close()).isFalse();
            assertThat(tick(1.2, 9).close()).isFalse();
            assertThat(trade.isMomentumDetected()).isTrue();
        }
    }
}
