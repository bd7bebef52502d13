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

/** OKX v5 public {@code tickers} channel on the linear swap ({@code BASE-QUOTE-SWAP}). */
@Component
public class OkxStreamingClient extends AbstractWebSocketVenueClient {

    public static final String NAME = "okx";

    private final MarketDataConfig config;

    public OkxStreamingClient(OkHttpClient venueHttpClient, Clock clock, MarketDataConfig config) {
        super(venueHttpClient, clock);
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected String buildUrl(Instrument instrument) {
        return config.getVenues().getOkxStreamUrl();
    }

    @Override
    protected String buildSubscribeMessage(Instrument instrument) {
        Map<String, String> arg = Map.of("channel", "tickers", "instId", instrument.okxSwapId());
        return JsonHelper.toJson(Map.of("op", "subscribe", "args", List.of(arg)));
    }

    @Override
    protected PriceTick parseMessage(String symbol, JsonNode message) {
        String event = message.path("event").asText("");
        if ("error".equals(event)) {
            throw new VenueException(NAME, "code " + message.path("code").asText() + ": " + message.path("msg").asText());
        }
        if (!event.isEmpty()) {
            return null;
        }
        JsonNode data = message.path("data");
        if (!data.isArray() || data.isEmpty()) {
            return null;
        }
        JsonNode ticker = data.get(0);
        BigDecimal price = decimal(ticker.get("last"));
        if (price == null) {
            return null;
        }
        return new PriceTick(symbol, price, timestamp(ticker.get("ts")), NAME);
    }
}
