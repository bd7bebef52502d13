package com.tradetracker.marketdata.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradetracker.config.MarketDataConfig;
import com.tradetracker.exception.VenueException;
import com.tradetracker.mapper.JsonHelper;
import com.tradetracker.marketdata.PollingVenueClient;
import com.tradetracker.marketdata.SymbolNormalizer;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

/**
 * Binance USD-M futures REST last price, {@code GET /fapi/v1/ticker/price}.
 *
 * <p>Every polling watch loop shares the {@code binanceRest} rate limiter, so the
 * request weight stays under the venue's per-IP limit however many symbols fall back
 * to polling. The {@code binanceRest} circuit breaker rejects calls while the venue is
 * failing; the polling loop treats a rejection like any other failed poll.
 */
@Component
public class BinancePollingClient implements PollingVenueClient {

    public static final String NAME = "binance";

    public static final String RESILIENCE_INSTANCE = "binanceRest";

    private static final long REQUEST_TIMEOUT_SECONDS = 5;

    private final OkHttpClient httpClient;
    private final MarketDataConfig config;

    public BinancePollingClient(OkHttpClient venueHttpClient, MarketDataConfig config) {
        // Same pool as the streams, but REST calls must not block forever.
        this.httpClient = venueHttpClient
                .newBuilder()
                .readTimeout(REQUEST_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .callTimeout(REQUEST_TIMEOUT_SECONDS * 2, TimeUnit.SECONDS)
                .build();
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    @RateLimiter(name = RESILIENCE_INSTANCE)
    @CircuitBreaker(name = RESILIENCE_INSTANCE)
    public BigDecimal fetchLastPrice(String symbol) {
        String venueSymbol = SymbolNormalizer.parseTradingSymbol(symbol).concatenated();
        HttpUrl url = HttpUrl.get(config.getVenues().getBinanceRestUrl())
                .newBuilder()
                .addPathSegments("fapi/v1/ticker/price")
                .addQueryParameter("symbol", venueSymbol)
                .build();

        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new VenueException(NAME, "HTTP " + response.code() + " for " + venueSymbol + ": " + payload);
            }
            JsonNode json = JsonHelper.readTree(payload);
            JsonNode price = json.get("price");
            if (price == null || price.asText().isBlank()) {
                throw new VenueException(NAME, "no price in response for " + venueSymbol);
            }
            return new BigDecimal(price.asText());
        } catch (IOException e) {
            throw new VenueException(NAME, "request for " + venueSymbol + " failed: " + e.getMessage(), e);
        } catch (IllegalStateException | NumberFormatException e) {
            throw new VenueException(NAME, "unreadable response for " + venueSymbol + ": " + e.getMessage(), e);
        }
    }
}
