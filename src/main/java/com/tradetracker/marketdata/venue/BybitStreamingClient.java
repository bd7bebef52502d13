package com.tradetracker.marketdata.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradetracker.config.MarketDataConfig;
import com.tradetracker.domain.model.PriceTick;
import com.tradetracker.exception.VenueException;
import com.tradetracker.mapper.JsonHelper;
import com.tradetracker.marketdata.SymbolNormalizer.Instrument;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * Bybit v5 public linear stream, {@code tickers.<SYMBOL>} topic.
 * Snapshot and delta frames both carry {@code data.lastPrice} when it changed.
 */
@Component
public class BybitStreamingClient extends AbstractWebSocketVenueClient {

    public static final String NAME = "bybit";

    private final MarketDataConfig config;

    public BybitStreamingClient(OkHttpClient venueHttpClient, Clock clock, MarketDataConfig config) {
        super(venueHttpClient, clock);
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected String buildUrl(Instrument instrument) {
        return config.getVenues().getBybitStreamUrl();
    }

    @Override
    protected String buildSubscribeMessage(Instrument instrument) {
        return JsonHelper.toJson(Map.of("op", "subscribe", "args", List.of(topic(instrument))));
    }

    @Override
    protected PriceTick parseMessage(String symbol, JsonNode message) {
        if (message.has("op")) {
            if (message.has("success") && !message.get("success").asBoolean()) {
                throw new VenueException(NAME, "subscribe rejected: " + message.path("ret_msg").asText());
            }
            return null;
        }
        BigDecimal price = decimal(message.path("data").get("lastPrice"));
        if (price == null) {
            return null;
        }
        return new PriceTick(symbol, price, timestamp(message.get("ts")), NAME);
    }

    private static String topic(Instrument instrument) {
        return "tickers." + instrument.concatenated();
    }
}
