package com.tradetracker.marketdata;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Receives price updates for one instrument from the {@link ConnectionMultiplexer}.
 * Invoked on the instrument's watch loop thread; calls for one instrument never overlap.
 */
@FunctionalInterface
public interface PriceListener {

    void onPrice(String symbol, BigDecimal price, LocalDateTime timestamp);
}
