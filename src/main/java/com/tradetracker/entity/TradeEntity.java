package com.tradetracker.entity;

import com.tradetracker.domain.enums.MomentumState;
import com.tradetracker.domain.enums.RiskStrategy;
import com.tradetracker.domain.enums.TradeDirection;
import com.tradetracker.domain.enums.TradeOutcome;
import com.tradetracker.domain.enums.TradeStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trade_setups table.
 *
 * <p>Prices use scale 10 because low-priced crypto instruments quote far below one
 * unit. The (symbol, direction, webhook_source, status) index serves the circuit
 * breaker's recent-history queries.
 */
@Entity
@Table(
        name = "trade_setups",
        indexes = {
            @Index(name = "idx_trade_setups_status", columnList = "status"),
            @Index(name = "idx_trade_setups_asset", columnList = "symbol, direction, webhook_source, status")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trade_identifier", length = 100, nullable = false, unique = true)
    private String tradeIdentifier;

    @Column(length = 50, nullable = false)
    private String symbol;

    @Column(name = "trading_symbol", length = 50)
    private String tradingSymbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeDirection direction;

    @Column(name = "entry_price", precision = 24, scale = 10)
    private BigDecimal entryPrice;

    @Column(name = "entry_time")
    private LocalDateTime entryTime;

    @Column(name = "webhook_source", length = 100)
    private String webhookSource;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_strategy", columnDefinition = "varchar(30)")
    private RiskStrategy riskStrategy;

    // Planned exits
    @Column(name = "tp1_price", precision = 24, scale = 10)
    private BigDecimal tp1Price;

    @Column(name = "tp1_pct")
    private Double tp1Pct;

    @Column(name = "tp2_price", precision = 24, scale = 10)
    private BigDecimal tp2Price;

    @Column(name = "tp2_pct")
    private Double tp2Pct;

    @Column(name = "tp3_price", precision = 24, scale = 10)
    private BigDecimal tp3Price;

    @Column(name = "tp3_pct")
    private Double tp3Pct;

    @Column(name = "sl_price", precision = 24, scale = 10)
    private BigDecimal slPrice;

    @Column(name = "sl_pct")
    private Double slPct;

    // Trailing stop
    @Column(name = "use_trailing_stop")
    private boolean useTrailingStop;

    @Column(name = "trailing_stop_distance_pct")
    private Double trailingStopDistancePct;

    @Column(name = "activation_pct")
    private Double activationPct;

    @Column(name = "trailing_triggered")
    private boolean trailingTriggered;

    @Column(name = "high_water", precision = 24, scale = 10)
    private BigDecimal highWater;

    @Column(name = "trailing_stop_price", precision = 24, scale = 10)
    private BigDecimal trailingStopPrice;

    @Column(name = "trailing_stop_pct")
    private Double trailingStopPct;

    @Column(name = "trailing_stop_updates")
    private int trailingStopUpdates;

    @Column(name = "volatility_multiplier")
    private Double volatilityMultiplier;

    @Enumerated(EnumType.STRING)
    @Column(name = "momentum_state", columnDefinition = "varchar(20)")
    private MomentumState momentumState;

    // Early momentum
    @Column(name = "momentum_window_minutes")
    private Double momentumWindowMinutes;

    @Column(name = "momentum_threshold_pct")
    private Double momentumThresholdPct;

    @Column(name = "momentum_detected")
    private boolean momentumDetected;

    @Column(name = "momentum_detected_at")
    private LocalDateTime momentumDetectedAt;

    @Column(name = "momentum_pnl_pct")
    private Double momentumPnlPct;

    @Column(name = "low_quality_signal")
    private boolean lowQualitySignal;

    @Column(name = "sl_moved_to_breakeven")
    private boolean slMovedToBreakeven;

    @Column(name = "sl_move_timestamp")
    private LocalDateTime slMoveTimestamp;

    // Excursions
    @Column(name = "max_profit_pct")
    private Double maxProfitPct;

    @Column(name = "max_drawdown_pct")
    private Double maxDrawdownPct;

    @Column(name = "max_favorable_excursion", precision = 24, scale = 10)
    private BigDecimal maxFavorableExcursion;

    // Hits
    @Column(name = "tp1_hit")
    private boolean tp1Hit;

    @Column(name = "tp1_hit_at")
    private LocalDateTime tp1HitAt;

    @Column(name = "tp1_hit_price", precision = 24, scale = 10)
    private BigDecimal tp1HitPrice;

    @Column(name = "tp1_time_minutes")
    private Integer tp1TimeMinutes;

    @Column(name = "tp1_mae_pct")
    private Double tp1MaePct;

    @Column(name = "tp2_hit")
    private boolean tp2Hit;

    @Column(name = "tp2_hit_at")
    private LocalDateTime tp2HitAt;

    @Column(name = "tp2_hit_price", precision = 24, scale = 10)
    private BigDecimal tp2HitPrice;

    @Column(name = "tp2_time_minutes")
    private Integer tp2TimeMinutes;

    @Column(name = "tp2_mae_pct")
    private Double tp2MaePct;

    @Column(name = "tp3_hit")
    private boolean tp3Hit;

    @Column(name = "tp3_hit_at")
    private LocalDateTime tp3HitAt;

    @Column(name = "tp3_hit_price", precision = 24, scale = 10)
    private BigDecimal tp3HitPrice;

    @Column(name = "tp3_time_minutes")
    private Integer tp3TimeMinutes;

    @Column(name = "tp3_mae_pct")
    private Double tp3MaePct;

    @Column(name = "sl_hit")
    private boolean slHit;

    @Column(name = "sl_hit_at")
    private LocalDateTime slHitAt;

    @Column(name = "sl_hit_price", precision = 24, scale = 10)
    private BigDecimal slHitPrice;

    @Column(name = "sl_time_minutes")
    private Integer slTimeMinutes;

    @Column(name = "sl_type_hit", length = 30)
    private String slTypeHit;

    // Outcome
    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(15)")
    private TradeStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "final_outcome", columnDefinition = "varchar(10)")
    private TradeOutcome finalOutcome;

    @Column(name = "final_pnl_pct")
    private Double finalPnlPct;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;
}
