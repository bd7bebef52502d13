package com.tradetracker.tracking;

import com.tradetracker.domain.enums.TradeOutcome;
import com.tradetracker.domain.model.Trade;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/** The three planned take-profit levels, with access to their fields on {@link Trade}. */
enum TakeProfitLevel {
    TP1(TradeOutcome.TP1),
    TP2(TradeOutcome.TP2),
    TP3(TradeOutcome.TP3);

    private final TradeOutcome outcome;

    TakeProfitLevel(TradeOutcome outcome) {
        this.outcome = outcome;
    }

    TradeOutcome getOutcome() {
        return outcome;
    }

    boolean closesTrade() {
        return this == TP3;
    }

    Double plannedPct(Trade trade) {
        return switch (this) {
            case TP1 -> trade.getTp1Pct();
            case TP2 -> trade.getTp2Pct();
            case TP3 -> trade.getTp3Pct();
        };
    }

    boolean isHit(Trade trade) {
        return switch (this) {
            case TP1 -> trade.isTp1Hit();
            case TP2 -> trade.isTp2Hit();
            case TP3 -> trade.isTp3Hit();
        };
    }

    /** Stamps the hit once. The caller checks {@link #isHit} first. */
    void markHit(Trade trade, LocalDateTime at, BigDecimal price, int minutes, Double maePct) {
        switch (this) {
            case TP1 -> {
                trade.setTp1Hit(true);
                trade.setTp1HitAt(at);
                trade.setTp1HitPrice(price);
                trade.setTp1TimeMinutes(minutes);
                trade.setTp1MaePct(maePct);
            }
            case TP2 -> {
                trade.setTp2Hit(true);
                trade.setTp2HitAt(at);
                trade.setTp2HitPrice(price);
                trade.setTp2TimeMinutes(minutes);
                trade.setTp2MaePct(maePct);
            }
            case TP3 -> {
                trade.setTp3Hit(true);
                trade.setTp3HitAt(at);
                trade.setTp3HitPrice(price);
                trade.setTp3TimeMinutes(minutes);
                trade.setTp3MaePct(maePct);
            }
        }
    }
}
