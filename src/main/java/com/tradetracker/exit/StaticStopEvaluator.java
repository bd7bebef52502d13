package com.tradetracker.exit;

import com.tradetracker.domain.enums.RiskStrategy;
import com.tradetracker.domain.model.ExitDecision;
import com.tradetracker.domain.model.Trade;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fixed stop loss. Uses the planned stop price when present, otherwise the planned
 * stop percentage (a negative PnL%).
 */
@Component
public class StaticStopEvaluator implements ExitEvaluator {

    private static final Logger log = LoggerFactory.getLogger(StaticStopEvaluator.class);

    public static final String REASON = "static";

    @Override
    public RiskStrategy getStrategy() {
        return RiskStrategy.STATIC;
    }

    @Override
    public ExitDecision evaluate(Trade trade, BigDecimal price, double pnlPct, double elapsedMinutes, LocalDateTime now) {
        if (!isStopCrossed(trade, price, pnlPct)) {
            return ExitDecision.keepOpen();
        }
        trade.markStopHit(now, price, REASON);
        log.warn(
                "Stop loss hit for {} {} @ {} ({}%) after {} min",
                trade.getTradeIdentifier(),
                trade.getSymbol(),
                price,
                String.format("%.2f", pnlPct),
                trade.getSlTimeMinutes());
        return ExitDecision.close(REASON);
    }

    /** True when the price is at or beyond the planned stop for the trade's direction. */
    static boolean isStopCrossed(Trade trade, BigDecimal price, double pnlPct) {
        BigDecimal slPrice = trade.getSlPrice();
        if (slPrice != null) {
            return trade.getDirection().isLong() ? price.compareTo(slPrice) <= 0 : price.compareTo(slPrice) >= 0;
        }
        return trade.getSlPct() != null && pnlPct <= trade.getSlPct();
    }
}
