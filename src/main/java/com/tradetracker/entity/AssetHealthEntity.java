package com.tradetracker.entity;

import com.tradetracker.domain.enums.AssetStatus;
import com.tradetracker.domain.enums.StrategyProfile;
import com.tradetracker.domain.enums.TradeDirection;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for asset_status, keyed by the unique (symbol, direction, webhook_source). */
@Entity
@Table(
        name = "asset_status",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_asset_status_key",
                        columnNames = {"symbol", "direction", "webhook_source"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AssetHealthEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 50, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)", nullable = false)
    private TradeDirection direction;

    @Column(name = "webhook_source", length = 100, nullable = false)
    private String webhookSource;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(15)")
    private AssetStatus status;

    @Column(name = "pause_reason", length = 500)
    private String pauseReason;

    @Column(name = "paused_at")
    private LocalDateTime pausedAt;

    @Column(name = "pause_count")
    private int pauseCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "strategy_profile", columnDefinition = "varchar(15)")
    private StrategyProfile strategyProfile;

    @Column(name = "cumulative_pnl_last_20")
    private Double cumulativePnlLast20;

    @Column(name = "win_rate_last_20")
    private Double winRateLast20;

    @Column(name = "total_trades")
    private int totalTrades;

    @Column(name = "consecutive_losses")
    private int consecutiveLosses;

    @Column(name = "consecutive_wins")
    private int consecutiveWins;

    @Column(name = "expected_win_rate")
    private Double expectedWinRate;

    @Column(name = "expected_risk_reward")
    private Double expectedRiskReward;

    @Column(name = "recovery_started_at")
    private LocalDateTime recoveryStartedAt;

    @Column(name = "last_checked_at")
    private LocalDateTime lastCheckedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
