package com.tradetracker.domain.model;

import com.tradetracker.domain.enums.AssetStatus;
import com.tradetracker.domain.enums.StrategyProfile;
import com.tradetracker.domain.enums.TradeDirection;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Circuit breaker record for one (symbol, direction, source) key.
 *
 * <p>Created on first evaluation and refreshed after every completed trade for the
 * key. Cached in Redis for the trade-acceptance path, so it must stay JSON friendly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetHealth {

    private Long id;
    private String symbol;
    private TradeDirection direction;
    private String webhookSource;

    private AssetStatus status;
    private String pauseReason;
    private LocalDateTime pausedAt;
    private int pauseCount;
    private StrategyProfile strategyProfile;

    private Double cumulativePnlLast20;
    private Double winRateLast20;
    private int totalTrades;
    private int consecutiveLosses;
    private int consecutiveWins;
    private Double expectedWinRate;
    private Double expectedRiskReward;

    private LocalDateTime recoveryStartedAt;
    private LocalDateTime lastCheckedAt;
    private LocalDateTime updatedAt;

    public AssetKey key() {
        return new AssetKey(symbol, direction, webhookSource);
    }

    public static AssetHealth newRecord(AssetKey key, LocalDateTime now) {
        return AssetHealth.builder()
                .symbol(key.symbol())
                .direction(key.direction())
                .webhookSource(key.source())
                .status(AssetStatus.ACTIVE)
                .strategyProfile(StrategyProfile.STANDARD)
                .updatedAt(now)
                .build();
    }
}
