package com.tradetracker.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradetracker.config.MarketDataConfig;
import com.tradetracker.exception.VenueException;
import com.tradetracker.marketdata.PollingVenueClient;
import com.tradetracker.marketdata.venue.BinancePollingClient;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.springboot3.circuitbreaker.autoconfigure.CircuitBreakerAutoConfiguration;
import io.github.resilience4j.springboot3.ratelimiter.autoconfigure.RateLimiterAutoConfiguration;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.aop.AopAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;

/**
 * The Binance REST fetch runs behind the shared {@code binanceRest} rate limiter and
 * circuit breaker. The venue URL points at a closed local port, so every call that
 * gets through fails immediately with a {@link VenueException}.
 */
@SpringBootTest(
        classes = BinancePollingResilienceIntegrationTest.TestConfig.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
            "resilience4j.ratelimiter.instances.binanceRest.limit-for-period=3",
            "resilience4j.ratelimiter.instances.binanceRest.limit-refresh-period=1h",
            "resilience4j.ratelimiter.instances.binanceRest.timeout-duration=0",
            "resilience4j.circuitbreaker.instances.binanceRest.sliding-window-size=10",
            "resilience4j.circuitbreaker.instances.binanceRest.minimum-number-of-calls=10"
        })
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class BinancePollingResilienceIntegrationTest {

    private static final String SYMBOL = "BTC/USDT:USDT";

    @Configuration
    @ImportAutoConfiguration({
        AopAutoConfiguration.class,
        CircuitBreakerAutoConfiguration.class,
        RateLimiterAutoConfiguration.class
    })
    @Import(BinancePollingClient.class)
    static class TestConfig {

        @Bean
        OkHttpClient venueHttpClient() {
            return new OkHttpClient();
        }

        @Bean
        MarketDataConfig marketDataConfig() {
            MarketDataConfig config = new MarketDataConfig();
            config.getVenues().setBinanceRestUrl("http://127.0.0.1:1");
            return config;
        }
    }

    @Autowired
    private PollingVenueClient pollingClient;

    @Autowired
    private RateLimiterRegistry rateLimiterRegistry;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @Test
    @DisplayName("fetchLastPrice: calls beyond the rate limit are rejected without a request")
    void throttledBeyondLimit() {
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> pollingClient.fetchLastPrice(SYMBOL)).isInstanceOf(VenueException.class);
        }

        assertThatThrownBy(() -> pollingClient.fetchLastPrice(SYMBOL)).isInstanceOf(RequestNotPermitted.class);
        assertThat(rateLimiterRegistry
                        .rateLimiter(BinancePollingClient.RESILIENCE_INSTANCE)
                        .getMetrics()
                        .getAvailablePermissions())
                .isZero();
    }

    @Test
    @DisplayName("fetchLastPrice: open breaker fails fast without using a rate-limit permit")
    void failsFastWhenOpen() {
        circuitBreakerRegistry
                .circuitBreaker(BinancePollingClient.RESILIENCE_INSTANCE)
                .transitionToOpenState();

        assertThatThrownBy(() -> pollingClient.fetchLastPrice(SYMBOL)).isInstanceOf(CallNotPermittedException.class);
        assertThat(rateLimiterRegistry
                        .rateLimiter(BinancePollingClient.RESILIENCE_INSTANCE)
                        .getMetrics()
                        .getAvailablePermissions())
                .isEqualTo(3);
    }

    @Test
    @DisplayName("fetchLastPrice: failed calls are recorded by the breaker")
    void failuresRecorded() {
        assertThatThrownBy(() -> pollingClient.fetchLastPrice(SYMBOL)).isInstanceOf(VenueException.class);

        assertThat(circuitBreakerRegistry
                        .circuitBreaker(BinancePollingClient.RESILIENCE_INSTANCE)
                        .getMetrics()
                        .getNumberOfFailedCalls())
                .isEqualTo(1);
    }
}
