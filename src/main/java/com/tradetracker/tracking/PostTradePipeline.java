package com.tradetracker.tracking;

import com.tradetracker.domain.enums.TradeOutcome;
import com.tradetracker.domain.model.Trade;

/**
 * Receives every trade after the tracking engine has closed and persisted it.
 * Implementations must not assume the trade is still tracked.
 */
public interface PostTradePipeline {

    void processCompletedTrade(Trade trade, TradeOutcome outcome, double finalPnlPct);
}
