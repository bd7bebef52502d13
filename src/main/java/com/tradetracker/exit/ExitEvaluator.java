package com.tradetracker.exit;

import com.tradetracker.domain.enums.RiskStrategy;
import com.tradetracker.domain.model.ExitDecision;
import com.tradetracker.domain.model.Trade;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Decides on each processed tick whether an open trade should be closed.
 *
 * <p>Evaluators are stateless singletons; all per-trade state lives on the
 * {@link Trade}, which is the only object an evaluator may mutate. They run on the
 * watch loop thread of the trade's instrument, under its lock.
 */
public interface ExitEvaluator {

    /** The risk strategy this evaluator serves in the registry. */
    RiskStrategy getStrategy();

    ExitDecision evaluate(Trade trade, BigDecimal price, double pnlPct, double elapsedMinutes, LocalDateTime now);
}
