package com.tradetracker.marketdata.venue;

import com.tradetracker.config.MarketDataConfig;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared OkHttp client for every venue. WebSocket and REST calls reuse its connection
 * pool and dispatcher; the read timeout is disabled so long-lived streams are not cut.
 */
@Configuration
public class VenueClientConfig {

    @Bean(destroyMethod = "")
    public OkHttpClient venueHttpClient(MarketDataConfig marketDataConfig) {
        MarketDataConfig.Venues venues = marketDataConfig.getVenues();
        return new OkHttpClient.Builder()
                .pingInterval(venues.getPingIntervalSeconds(), TimeUnit.SECONDS)
                .connectTimeout(venues.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }
}
