package com.tradetracker.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the circuit breaker. Per-profile thresholds are fixed
 * in {@code ProfileThresholds}; this only controls windows and caching.
 */
@Configuration
@ConfigurationProperties(prefix = "tradetracker.circuit-breaker")
@Validated
@Getter
@Setter
public class CircuitBreakerConfig {

    /** When false, every key reports ACTIVE and evaluations only refresh metrics. */
    private boolean enabled = true;

    /** Number of most recent completed trades used for metrics. */
    @Min(10)
    private int historySize = 20;

    /** Minimum completed trades before any condition is enforced. */
    @Min(1)
    private int minimumTrades = 10;

    /** Trades since recovery start considered for recovery progress. */
    @Min(1)
    private int recoveryWindow = 10;

    private int alertRetentionHours = 24;

    @Min(1)
    private int maxAlerts = 500;

    private long statusCacheTtlSeconds = 300;
}
