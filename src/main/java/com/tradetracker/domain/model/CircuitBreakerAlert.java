package com.tradetracker.domain.model;

import com.tradetracker.domain.enums.AlertSeverity;
import com.tradetracker.domain.enums.AssetStatus;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CircuitBreakerAlert {

    String id;
    LocalDateTime timestamp;
    AssetKey key;
    AssetStatus status;
    AlertSeverity severity;
    String reason;
    double winRate;
    int consecutiveLosses;
    double maxDrawdown;
    double cumulativePnl20;
}
