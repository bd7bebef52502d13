package com.tradetracker.marketdata.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradetracker.config.MarketDataConfig;
import com.tradetracker.domain.model.PriceTick;
import com.tradetracker.marketdata.SymbolNormalizer.Instrument;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/** Binance USD-M futures aggregate trade stream; the stream is selected by URL path. */
@Component
public class BinanceStreamingClient extends AbstractWebSocketVenueClient {

    public static final String NAME = "binance";

    private final MarketDataConfig config;

    public BinanceStreamingClient(OkHttpClient venueHttpClient, Clock clock, MarketDataConfig config) {
        super(venueHttpClient, clock);
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected String buildUrl(Instrument instrument) {
        return config.getVenues().getBinanceStreamUrl() + "/"
                + instrument.concatenated().toLowerCase(Locale.ROOT) + "@aggTrade";
    }

    @Override
    protected String buildSubscribeMessage(Instrument instrument) {
        return null;
    }

    @Override
    protected PriceTick parseMessage(String symbol, JsonNode message) {
        if (!"aggTrade".equals(message.path("e").asText())) {
            return null;
        }
        BigDecimal price = decimal(message.get("p"));
        if (price == null) {
            return null;
        }
        JsonNode time = message.has("T") ? message.get("T") : message.get("E");
        return new PriceTick(symbol, price, timestamp(time), NAME);
    }
}
