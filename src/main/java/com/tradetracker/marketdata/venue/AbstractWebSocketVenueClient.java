package com.tradetracker.marketdata.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradetracker.domain.model.PriceTick;
import com.tradetracker.exception.VenueException;
import com.tradetracker.mapper.JsonHelper;
import com.tradetracker.marketdata.StreamingVenueClient;
import com.tradetracker.marketdata.SymbolNormalizer;
import com.tradetracker.marketdata.SymbolNormalizer.Instrument;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for venues that push prices over an OkHttp WebSocket.
 *
 * <p>OkHttp delivers frames on its own reader thread. Parsed ticks are queued and
 * handed to the sink on the caller's (watch loop) thread, so every tick of an
 * instrument is processed on one thread and cancellation is a plain interrupt.
 *
 * <p>Subclasses supply the endpoint, the optional subscribe frame, and a parser for
 * venue messages. A parser returns null for frames that carry no price (acks,
 * heartbeats, partial deltas) and throws {@link VenueException} for venue-reported
 * errors, which end the stream.
 */
public abstract class AbstractWebSocketVenueClient implements StreamingVenueClient {

    private static final Logger log = LoggerFactory.getLogger(AbstractWebSocketVenueClient.class);

    private static final int NORMAL_CLOSURE = 1000;
    private static final int MAX_PENDING_TICKS = 10_000;
    private static final long QUEUE_POLL_MS = 500;

    protected final OkHttpClient httpClient;
    protected final Clock clock;

    private final Set<WebSocket> openSockets = ConcurrentHashMap.newKeySet();

    protected AbstractWebSocketVenueClient(OkHttpClient httpClient, Clock clock) {
        this.httpClient = httpClient;
        this.clock = clock;
    }

    protected abstract String buildUrl(Instrument instrument);

    /** Frame sent right after the socket opens, or null when the URL itself selects the stream. */
    protected abstract String buildSubscribeMessage(Instrument instrument);

    protected abstract PriceTick parseMessage(String symbol, JsonNode message);

    @Override
    public void stream(String symbol, Consumer<PriceTick> sink) throws InterruptedException {
        Instrument instrument = SymbolNormalizer.parseTradingSymbol(symbol);
        BlockingQueue<PriceTick> pending = new LinkedBlockingQueue<>(MAX_PENDING_TICKS);
        CompletableFuture<Void> finished = new CompletableFuture<>();

        Request request = new Request.Builder().url(buildUrl(instrument)).build();
        WebSocket socket = httpClient.newWebSocket(
                request, new StreamListener(symbol, buildSubscribeMessage(instrument), pending, finished));
        openSockets.add(socket);

        try {
            while (!finished.isDone()) {
                PriceTick tick = pending.poll(QUEUE_POLL_MS, TimeUnit.MILLISECONDS);
                if (tick != null) {
                    sink.accept(tick);
                }
            }
            PriceTick tick;
            while ((tick = pending.poll()) != null) {
                sink.accept(tick);
            }
            finished.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VenueException venueException) {
                throw venueException;
            }
            throw new VenueException(getName(), "stream for " + symbol + " failed: " + cause.getMessage(), cause);
        } finally {
            openSockets.remove(socket);
            socket.cancel();
        }
    }

    @Override
    public void close() {
        for (WebSocket socket : openSockets) {
            socket.cancel();
        }
        openSockets.clear();
    }

    /** Number of sockets currently open through this client. */
    public int getOpenSocketCount() {
        return openSockets.size();
    }

    // ---- Parsing helpers ----

    protected static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return new BigDecimal(node.asText());
    }

    /** Venue timestamp in epoch millis, or the service clock when the frame carries none. */
    protected LocalDateTime timestamp(JsonNode epochMillis) {
        if (epochMillis == null || epochMillis.isNull() || epochMillis.asText().isBlank()) {
            return LocalDateTime.now(clock);
        }
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis.asLong()), ZoneOffset.UTC);
    }

    private final class StreamListener extends WebSocketListener {

        private final String symbol;
        private final String subscribeMessage;
        private final BlockingQueue<PriceTick> pending;
        private final CompletableFuture<Void> finished;

        StreamListener(
                String symbol,
                String subscribeMessage,
                BlockingQueue<PriceTick> pending,
                CompletableFuture<Void> finished) {
            this.symbol = symbol;
            this.subscribeMessage = subscribeMessage;
            this.pending = pending;
            this.finished = finished;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            log.info("{} connected for {}", getName(), symbol);
            if (subscribeMessage != null) {
                webSocket.send(subscribeMessage);
            }
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            PriceTick tick;
            try {
                tick = parseMessage(symbol, JsonHelper.readTree(text));
            } catch (VenueException e) {
                log.warn("{} reported an error for {}: {}", getName(), symbol, e.getMessage());
                finished.completeExceptionally(e);
                webSocket.close(NORMAL_CLOSURE, null);
                return;
            } catch (RuntimeException e) {
                log.warn("{} sent an unreadable frame for {}: {}", getName(), symbol, e.getMessage());
                return;
            }
            if (tick != null && !pending.offer(tick)) {
                log.debug("{} tick queue full for {}, dropping {}", getName(), symbol, tick.price());
            }
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            log.info("{} closing stream for {}: {} {}", getName(), symbol, code, reason);
            webSocket.close(NORMAL_CLOSURE, null);
            finished.complete(null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            finished.complete(null);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            String detail = response != null ? "HTTP " + response.code() : String.valueOf(t.getMessage());
            finished.completeExceptionally(new VenueException(getName(), "connection failed for " + symbol + ": " + detail, t));
        }
    }
}
