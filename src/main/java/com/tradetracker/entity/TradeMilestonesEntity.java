package com.tradetracker.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for trade_milestones, one row per trade (unique trade_id). */
@Entity
@Table(name = "trade_milestones")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeMilestonesEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trade_id", nullable = false, unique = true)
    private Long tradeId;

    @Column(name = "entry_price", precision = 24, scale = 10)
    private BigDecimal entryPrice;

    @Column(name = "entry_time")
    private LocalDateTime entryTime;

    @Column(name = "profit_0_5_at")
    private LocalDateTime profit05At;

    @Column(name = "profit_1_at")
    private LocalDateTime profit1At;

    @Column(name = "profit_1_5_at")
    private LocalDateTime profit15At;

    @Column(name = "profit_2_at")
    private LocalDateTime profit2At;

    @Column(name = "profit_3_at")
    private LocalDateTime profit3At;

    @Column(name = "profit_5_at")
    private LocalDateTime profit5At;

    @Column(name = "profit_8_at")
    private LocalDateTime profit8At;

    @Column(name = "profit_10_at")
    private LocalDateTime profit10At;

    @Column(name = "drawdown_0_5_at")
    private LocalDateTime drawdown05At;

    @Column(name = "drawdown_1_at")
    private LocalDateTime drawdown1At;

    @Column(name = "drawdown_1_5_at")
    private LocalDateTime drawdown15At;

    @Column(name = "drawdown_2_at")
    private LocalDateTime drawdown2At;

    @Column(name = "drawdown_3_at")
    private LocalDateTime drawdown3At;

    @Column(name = "drawdown_5_at")
    private LocalDateTime drawdown5At;

    @Column(name = "drawdown_8_at")
    private LocalDateTime drawdown8At;

    @Column(name = "drawdown_10_at")
    private LocalDateTime drawdown10At;

    @Column(name = "max_profit_pct")
    private Double maxProfitPct;

    @Column(name = "max_profit_at")
    private LocalDateTime maxProfitAt;

    @Column(name = "max_drawdown_pct")
    private Double maxDrawdownPct;

    @Column(name = "max_drawdown_at")
    private LocalDateTime maxDrawdownAt;

    @Column(name = "exit_price", precision = 24, scale = 10)
    private BigDecimal exitPrice;

    @Column(name = "exit_at")
    private LocalDateTime exitAt;

    @Column(name = "final_pnl_pct")
    private Double finalPnlPct;
}
