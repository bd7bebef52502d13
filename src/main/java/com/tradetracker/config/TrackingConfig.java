package com.tradetracker.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the trade tracking engine.
 *
 * <p>{@code tickProcessIntervalMs} bounds per-instrument CPU cost: ticks arriving
 * faster are dropped. {@code commitIntervalMs} bounds database write pressure: price
 * samples and trade updates are committed in per-instrument batches at this rate.
 */
@Configuration
@ConfigurationProperties(prefix = "tradetracker.tracking")
@Validated
@Getter
@Setter
public class TrackingConfig {

    private long tickProcessIntervalMs = 2_000;

    @Positive
    private long commitIntervalMs = 5_000;

    /** Trades open longer than this are closed with outcome TIMEOUT. */
    @Positive
    private long timeoutHours = 24;

    private long timeoutCheckIntervalMs = 60_000;

    /** Whether the default post-trade pipeline deletes price samples after close. */
    private boolean cleanupSamplesOnClose = true;

    /** Whether active trades are loaded and subscribed on application start. */
    private boolean autoStart = true;
}
