package com.tradetracker.domain.model;

import com.tradetracker.domain.enums.MomentumState;
import com.tradetracker.domain.enums.RiskStrategy;
import com.tradetracker.domain.enums.TradeDirection;
import com.tradetracker.domain.enums.TradeOutcome;
import com.tradetracker.domain.enums.TradeStatus;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tracked trade setup: entry, planned exits, running excursions and the facts
 * recorded while it is open.
 *
 * <p>While ACTIVE the instance is owned by the TradeTrackingEngine and mutated only
 * on the watch loop thread of its instrument (tick processing and the exit evaluator
 * it invokes). After close, ownership passes to the post-trade pipeline.
 *
 * <p>Percentages are signed PnL percentages relative to entry, positive when the
 * trade is in profit for its direction. {@code slPct} follows the same convention,
 * so a 2% stop is stored as -2.0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    private Long id;
    private String tradeIdentifier;

    /** Symbol as sent by the signal source, e.g. HIPPOUSDT.P. */
    private String symbol;

    /** Venue-neutral symbol, e.g. HIPPO/USDT:USDT. Subscriptions are keyed by this. */
    private String tradingSymbol;

    private TradeDirection direction;
    private BigDecimal entryPrice;
    private LocalDateTime entryTime;
    private String webhookSource;
    private RiskStrategy riskStrategy;

    // ---- Planned exits ----

    private BigDecimal tp1Price;
    private Double tp1Pct;
    private BigDecimal tp2Price;
    private Double tp2Pct;
    private BigDecimal tp3Price;
    private Double tp3Pct;
    private BigDecimal slPrice;
    private Double slPct;

    // ---- Trailing stop ----

    private boolean useTrailingStop;
    private Double trailingStopDistancePct;

    /** PnL% at which the trailing stop arms. Null arms it immediately. */
    private Double activationPct;

    private boolean trailingTriggered;

    /** High-water mark for LONG, low-water mark for SHORT. */
    private BigDecimal highWater;

    private BigDecimal trailingStopPrice;

    /** Effective trailing distance used for the current stop. */
    private Double trailingStopPct;

    private int trailingStopUpdates;
    private Double volatilityMultiplier;
    private MomentumState momentumState;

    // ---- Early momentum ----

    /** Per-trade override of the momentum window; null uses the configured default. */
    private Double momentumWindowMinutes;

    /** Per-trade override of the momentum threshold; null uses the configured default. */
    private Double momentumThresholdPct;

    private boolean momentumDetected;
    private LocalDateTime momentumDetectedAt;
    private Double momentumPnlPct;
    private boolean lowQualitySignal;
    private boolean slMovedToBreakeven;
    private LocalDateTime slMoveTimestamp;

    // ---- Excursions ----

    private Double maxProfitPct;
    private Double maxDrawdownPct;
    private BigDecimal maxFavorableExcursion;

    // ---- Take-profit and stop hits ----

    private boolean tp1Hit;
    private LocalDateTime tp1HitAt;
    private BigDecimal tp1HitPrice;
    private Integer tp1TimeMinutes;
    private Double tp1MaePct;

    private boolean tp2Hit;
    private LocalDateTime tp2HitAt;
    private BigDecimal tp2HitPrice;
    private Integer tp2TimeMinutes;
    private Double tp2MaePct;

    private boolean tp3Hit;
    private LocalDateTime tp3HitAt;
    private BigDecimal tp3HitPrice;
    private Integer tp3TimeMinutes;
    private Double tp3MaePct;

    private boolean slHit;
    private LocalDateTime slHitAt;
    private BigDecimal slHitPrice;
    private Integer slTimeMinutes;

    /** Which rule fired the stop, e.g. static, breakeven, quality_filter, adaptive_trailing. */
    private String slTypeHit;

    // ---- Outcome ----

    private TradeStatus status;
    private TradeOutcome finalOutcome;
    private Double finalPnlPct;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;

    public boolean isActive() {
        return status == TradeStatus.ACTIVE;
    }

    public boolean hasUsableEntryPrice() {
        return entryPrice != null && entryPrice.signum() > 0;
    }

    /** Fractional minutes elapsed since entry, 0 when entry time is unknown. */
    public double minutesSinceEntry(LocalDateTime now) {
        if (entryTime == null) {
            return 0.0;
        }
        return Duration.between(entryTime, now).toMillis() / 60_000.0;
    }

    /** Records a stop hit. The first call wins; later calls are ignored. */
    public void markStopHit(LocalDateTime at, BigDecimal price, String type) {
        if (slHit) {
            return;
        }
        this.slHit = true;
        this.slHitAt = at;
        this.slHitPrice = price;
        this.slTimeMinutes = (int) minutesSinceEntry(at);
        this.slTypeHit = type;
    }
}
