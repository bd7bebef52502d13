package com.tradetracker.exit;

import com.tradetracker.config.ExitStrategyConfig;
import com.tradetracker.domain.enums.MomentumState;
import com.tradetracker.domain.enums.RiskStrategy;
import com.tradetracker.domain.model.ExitDecision;
import com.tradetracker.domain.model.Trade;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Trailing stop whose distance tightens as the trade moves through its take-profit
 * levels.
 *
 * <p>Order of checks per tick:
 * <ol>
 *   <li>initial static stop ({@code static_initial});</li>
 *   <li>momentum state advance from TP hit flags, never backwards;</li>
 *   <li>distance = base x state multiplier x volatility multiplier;</li>
 *   <li>extreme update: highest price for LONG, lowest for SHORT, seeded at entry;</li>
 *   <li>arming once PnL reaches the activation level (immediately when unset);</li>
 *   <li>stop level from the extreme and distance; crossing it closes.</li>
 * </ol>
 * A momentum state advance and every move of the stop level each count as one
 * trailing stop update.
 */
@Component
public class AdaptiveTrailingEvaluator implements ExitEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveTrailingEvaluator.class);

    public static final String REASON_STATIC_INITIAL = "static_initial";
    public static final String REASON_TRAILING = "adaptive_trailing";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ExitStrategyConfig config;

    public AdaptiveTrailingEvaluator(ExitStrategyConfig config) {
        this.config = config;
    }

    @Override
    public RiskStrategy getStrategy() {
        return RiskStrategy.ADAPTIVE_TRAILING;
    }

    @Override
    public ExitDecision evaluate(Trade trade, BigDecimal price, double pnlPct, double elapsedMinutes, LocalDateTime now) {
        if (StaticStopEvaluator.isStopCrossed(trade, price, pnlPct)) {
            trade.markStopHit(now, price, REASON_STATIC_INITIAL);
            log.warn("Initial stop hit for {} {} @ {}", trade.getTradeIdentifier(), trade.getSymbol(), price);
            return ExitDecision.close(REASON_STATIC_INITIAL);
        }

        advanceMomentumState(trade);

        double distance = trailDistance(trade);
        if (!Objects.equals(trade.getTrailingStopPct(), distance)) {
            trade.setTrailingStopPct(distance);
            trade.setTrailingStopDistancePct(distance);
        }

        boolean isLong = trade.getDirection().isLong();
        BigDecimal extreme = trade.getHighWater() != null ? trade.getHighWater() : trade.getEntryPrice();
        boolean improved = isLong ? price.compareTo(extreme) > 0 : price.compareTo(extreme) < 0;
        if (improved) {
            extreme = price;
        }
        if (improved || trade.getHighWater() == null) {
            trade.setHighWater(extreme);
        }

        if (!trade.isTrailingTriggered()
                && (trade.getActivationPct() == null || pnlPct >= trade.getActivationPct())) {
            trade.setTrailingTriggered(true);
            log.info(
                    "Adaptive trailing armed for {} {} @ {} (trail {}%)",
                    trade.getTradeIdentifier(),
                    trade.getSymbol(),
                    price,
                    String.format("%.2f", distance));
        }
        if (!trade.isTrailingTriggered()) {
            return ExitDecision.keepOpen();
        }

        BigDecimal stop = stopLevel(extreme, distance, isLong);
        if (trade.getTrailingStopPrice() == null || trade.getTrailingStopPrice().compareTo(stop) != 0) {
            trade.setTrailingStopPrice(stop);
            trade.setTrailingStopUpdates(trade.getTrailingStopUpdates() + 1);
        }

        boolean hit = isLong ? price.compareTo(stop) <= 0 : price.compareTo(stop) >= 0;
        if (!hit) {
            return ExitDecision.keepOpen();
        }

        trade.markStopHit(now, price, REASON_TRAILING);
        log.warn(
                "Adaptive trailing stop hit for {} {} @ {} (extreme {}, stop {}, trail {}%, state {}, updates {})",
                trade.getTradeIdentifier(),
                trade.getSymbol(),
                price,
                extreme,
                stop,
                String.format("%.2f", distance),
                trade.getMomentumState(),
                trade.getTrailingStopUpdates());
        return ExitDecision.close(REASON_TRAILING);
    }

    /** Effective trailing distance in percent for the trade's current momentum state. */
    public double trailDistance(Trade trade) {
        MomentumState state = trade.getMomentumState() != null ? trade.getMomentumState() : MomentumState.PRE_TP1;
        double volatility = trade.getVolatilityMultiplier() != null ? trade.getVolatilityMultiplier() : 1.0;
        return config.getTrailingBaseDistancePct() * stateMultiplier(state) * volatility;
    }

    private void advanceMomentumState(Trade trade) {
        MomentumState current = trade.getMomentumState() != null ? trade.getMomentumState() : MomentumState.PRE_TP1;
        MomentumState target = trade.isTp2Hit()
                ? MomentumState.POST_TP2
                : trade.isTp1Hit() ? MomentumState.TP1_TP2 : MomentumState.PRE_TP1;

        if (target.isAfter(current)) {
            trade.setMomentumState(target);
            trade.setTrailingStopUpdates(trade.getTrailingStopUpdates() + 1);
            log.info("Momentum state {} -> {} for {} {}", current, target, trade.getTradeIdentifier(), trade.getSymbol());
        } else if (trade.getMomentumState() == null) {
            trade.setMomentumState(current);
        }
    }

    private double stateMultiplier(MomentumState state) {
        return switch (state) {
            case PRE_TP1 -> config.getPreTp1Multiplier();
            case TP1_TP2 -> config.getTp1Tp2Multiplier();
            case POST_TP2 -> config.getPostTp2Multiplier();
        };
    }

    private static BigDecimal stopLevel(BigDecimal extreme, double distancePct, boolean isLong) {
        BigDecimal offset = BigDecimal.valueOf(distancePct).divide(HUNDRED, MathContext.DECIMAL64);
        BigDecimal factor = isLong ? BigDecimal.ONE.subtract(offset) : BigDecimal.ONE.add(offset);
        return extreme.multiply(factor, MathContext.DECIMAL64);
    }
}
