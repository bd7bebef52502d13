package com.tradetracker.event;

import com.tradetracker.domain.enums.TradeOutcome;
import com.tradetracker.domain.model.Trade;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the TradeTrackingEngine after a trade is closed and persisted.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>CircuitBreakerService: re-evaluates the trade's asset key</li>
 * </ul>
 */
public class TradeClosedEvent extends ApplicationEvent {

    private final Trade trade;
    private final TradeOutcome outcome;
    private final double finalPnlPct;

    public TradeClosedEvent(Object source, Trade trade, TradeOutcome outcome, double finalPnlPct) {
        super(source);
        this.trade = trade;
        this.outcome = outcome;
        this.finalPnlPct = finalPnlPct;
    }

    public Trade getTrade() {
        return trade;
    }

    public TradeOutcome getOutcome() {
        return outcome;
    }

    public double getFinalPnlPct() {
        return finalPnlPct;
    }
}
