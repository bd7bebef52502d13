package com.tradetracker.marketdata;

import java.math.BigDecimal;

/** A venue queried on demand for the last traded price. Used as the fallback when streaming fails. */
public interface PollingVenueClient {

    String getName();

    /** @throws com.tradetracker.exception.VenueException when the venue cannot supply a price */
    BigDecimal fetchLastPrice(String symbol);
}
