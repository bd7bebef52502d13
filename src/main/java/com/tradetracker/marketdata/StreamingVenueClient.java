package com.tradetracker.marketdata;

import com.tradetracker.domain.model.PriceTick;
import java.util.function.Consumer;

/**
 * A venue that pushes live prices over a persistent connection.
 *
 * <p>{@link #stream} blocks the calling watch loop thread for the life of the
 * connection. It returns normally when the venue closes the stream, throws
 * {@link com.tradetracker.exception.VenueException} on failure, and throws
 * {@link InterruptedException} (after closing the connection) when the loop is cancelled.
 */
public interface StreamingVenueClient extends AutoCloseable {

    String getName();

    void stream(String symbol, Consumer<PriceTick> sink) throws InterruptedException;

    /** Releases every connection opened by this client. */
    @Override
    default void close() {}
}
