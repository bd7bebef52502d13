package com.tradetracker.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * First-crossing timestamps of fixed PnL thresholds for one trade.
 *
 * <p>Each threshold timestamp is written once and never cleared. Downstream replay
 * uses these to simulate alternative TP/SL levels without storing every tick.
 * Threshold fields are read and written through {@code MilestoneThreshold}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeMilestones {

    private Long id;
    private Long tradeId;
    private BigDecimal entryPrice;
    private LocalDateTime entryTime;

    private LocalDateTime profit05At;
    private LocalDateTime profit1At;
    private LocalDateTime profit15At;
    private LocalDateTime profit2At;
    private LocalDateTime profit3At;
    private LocalDateTime profit5At;
    private LocalDateTime profit8At;
    private LocalDateTime profit10At;

    private LocalDateTime drawdown05At;
    private LocalDateTime drawdown1At;
    private LocalDateTime drawdown15At;
    private LocalDateTime drawdown2At;
    private LocalDateTime drawdown3At;
    private LocalDateTime drawdown5At;
    private LocalDateTime drawdown8At;
    private LocalDateTime drawdown10At;

    private Double maxProfitPct;
    private LocalDateTime maxProfitAt;
    private Double maxDrawdownPct;
    private LocalDateTime maxDrawdownAt;

    private BigDecimal exitPrice;
    private LocalDateTime exitAt;
    private Double finalPnlPct;
}
