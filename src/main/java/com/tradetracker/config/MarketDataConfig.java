package com.tradetracker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the connection multiplexer and venue clients.
 *
 * <p>Streaming venues are tried in {@code venuePriority} order; names must match a
 * registered {@code StreamingVenueClient}. When every streaming venue fails, the
 * symbol is polled from {@code pollingVenue}.
 */
@Configuration
@ConfigurationProperties(prefix = "tradetracker.market-data")
@Validated
@Getter
@Setter
public class MarketDataConfig {

    /** Streaming venue names in failover order. */
    @NotEmpty
    private List<String> venuePriority = new ArrayList<>(List.of("bybit", "binance", "okx"));

    /** Venue used for REST polling when streaming is unavailable. */
    @NotBlank
    private String pollingVenue = "binance";

    @Positive
    private long pollingIntervalMs = 1_000;

    /** Sleep after a failed poll before the next attempt. */
    private long pollingErrorBackoffMs = 5_000;

    @Positive
    private long healthCheckIntervalMs = 10_000;

    /** A symbol with no tick for this long has its watch loop restarted. */
    private long staleTickTimeoutMs = 30_000;

    /** First delay before retrying the streaming venue cycle; doubles per attempt. */
    @Positive
    private long reconnectInitialDelayMs = 1_000;

    private long reconnectMaxDelayMs = 30_000;

    /** Polling rounds before streaming venues are retried without a subscriber event. */
    private int pollsBeforeStreamingRetry = 300;

    private int executorCorePoolSize = 8;

    private int executorMaxPoolSize = 512;

    @Valid
    private Venues venues = new Venues();

    @Getter
    @Setter
    public static class Venues {
        @NotBlank
        private String bybitStreamUrl = "wss://stream.bybit.com/v5/public/linear";
        @NotBlank
        private String binanceStreamUrl = "wss://fstream.binance.com/ws";
        @NotBlank
        private String okxStreamUrl = "wss://ws.okx.com:8443/ws/v5/public";
        @NotBlank
        private String binanceRestUrl = "https://fapi.binance.com";
        private long pingIntervalSeconds = 20;
        private long connectTimeoutSeconds = 10;
    }
}
