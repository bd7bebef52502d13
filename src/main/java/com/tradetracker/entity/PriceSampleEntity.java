package com.tradetracker.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * JPA entity for trade_price_samples. High-volume and short-lived: rows are deleted
 * by trade id once the trade has closed.
 */
@Entity
@Table(name = "trade_price_samples", indexes = @Index(name = "idx_price_samples_trade", columnList = "trade_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceSampleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trade_id", nullable = false)
    private Long tradeId;

    private LocalDateTime timestamp;

    @Column(precision = 24, scale = 10)
    private BigDecimal price;

    @Column(name = "pnl_pct")
    private Double pnlPct;

    @Column(name = "max_profit_so_far")
    private Double maxProfitSoFar;

    @Column(name = "max_drawdown_so_far")
    private Double maxDrawdownSoFar;
}
