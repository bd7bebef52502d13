package com.tradetracker.tracking;

import com.tradetracker.domain.enums.TradeDirection;
import java.math.BigDecimal;
import java.math.MathContext;

/** Direction-aware PnL percentage relative to entry. */
public final class PnlCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PnlCalculator() {}

    /**
     * {@code (price - entry) / entry * 100} for LONG, {@code (entry - price) / entry * 100}
     * for SHORT. Entry must be positive.
     */
    public static double pnlPct(TradeDirection direction, BigDecimal entry, BigDecimal price) {
        BigDecimal move = direction.isLong() ? price.subtract(entry) : entry.subtract(price);
        return move.divide(entry, MathContext.DECIMAL64).multiply(HUNDRED).doubleValue();
    }
}
