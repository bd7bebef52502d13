package com.tradetracker.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Per-tick snapshot of a trade's price and running excursions. Kept only while
 * the trade is open; removed after close once downstream replay has used it.
 */
@Data
@Builder
public class PriceSample {

    private Long tradeId;
    private LocalDateTime timestamp;
    private BigDecimal price;
    private Double pnlPct;
    private Double maxProfitSoFar;
    private Double maxDrawdownSoFar;
}
