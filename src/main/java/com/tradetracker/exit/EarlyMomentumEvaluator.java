package com.tradetracker.exit;

import com.tradetracker.config.ExitStrategyConfig;
import com.tradetracker.domain.enums.RiskStrategy;
import com.tradetracker.domain.model.ExitDecision;
import com.tradetracker.domain.model.Trade;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Early-momentum quality filter.
 *
 * <p>A trade must reach the momentum threshold within the momentum window. If it
 * does, its stop moves to breakeven for the rest of its life and only the breakeven
 * stop is checked from then on. If the window passes first, the signal is flagged
 * low quality and the trade closes immediately.
 *
 * <p>The breakeven stop fires once PnL is below zero; a tick exactly at entry keeps
 * the trade open.
 */
@Component
public class EarlyMomentumEvaluator implements ExitEvaluator {

    private static final Logger log = LoggerFactory.getLogger(EarlyMomentumEvaluator.class);

    public static final String REASON_BREAKEVEN = "breakeven";
    public static final String REASON_QUALITY_FILTER = "quality_filter";

    private final ExitStrategyConfig config;

    public EarlyMomentumEvaluator(ExitStrategyConfig config) {
        this.config = config;
    }

    @Override
    public RiskStrategy getStrategy() {
        return RiskStrategy.EARLY_MOMENTUM;
    }

    @Override
    public ExitDecision evaluate(Trade trade, BigDecimal price, double pnlPct, double elapsedMinutes, LocalDateTime now) {
        if (trade.isMomentumDetected()) {
            if (pnlPct < 0) {
                trade.markStopHit(now, price, REASON_BREAKEVEN);
                log.info("Breakeven stop hit for {} {} @ {}", trade.getTradeIdentifier(), trade.getSymbol(), price);
                return ExitDecision.close(REASON_BREAKEVEN);
            }
            return ExitDecision.keepOpen();
        }

        double window = trade.getMomentumWindowMinutes() != null
                ? trade.getMomentumWindowMinutes()
                : config.getMomentumWindowMinutes();
        double threshold = trade.getMomentumThresholdPct() != null
                ? trade.getMomentumThresholdPct()
                : config.getMomentumThresholdPct();

        if (elapsedMinutes <= window) {
            if (pnlPct >= threshold) {
                trade.setMomentumDetected(true);
                trade.setMomentumDetectedAt(now);
                trade.setMomentumPnlPct(pnlPct);
                trade.setSlMovedToBreakeven(true);
                trade.setSlMoveTimestamp(now);
                log.info(
                        "Momentum detected for {} {}: {}% after {} min, stop moved to breakeven",
                        trade.getTradeIdentifier(),
                        trade.getSymbol(),
                        String.format("%.2f", pnlPct),
                        String.format("%.1f", elapsedMinutes));
            }
            return ExitDecision.keepOpen();
        }

        trade.setLowQualitySignal(true);
        trade.markStopHit(now, price, REASON_QUALITY_FILTER);
        log.info(
                "No momentum within {} min for {} {} ({}%), closing as low quality",
                window,
                trade.getTradeIdentifier(),
                trade.getSymbol(),
                String.format("%.2f", pnlPct));
        return ExitDecision.close(REASON_QUALITY_FILTER);
    }
}
