package com.tradetracker.domain.model;

import com.tradetracker.domain.enums.TradeDirection;

/** Identity of a circuit breaker record: (signal-source symbol, direction, signal source). */
public record AssetKey(String symbol, TradeDirection direction, String source) {

    public static AssetKey of(Trade trade) {
        return new AssetKey(trade.getSymbol(), trade.getDirection(), trade.getWebhookSource());
    }

    @Override
    public String toString() {
        return symbol + "_" + direction + "_" + source;
    }
}
