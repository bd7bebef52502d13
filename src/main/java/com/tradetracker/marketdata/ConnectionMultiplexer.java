package com.tradetracker.marketdata;

import com.tradetracker.config.MarketDataConfig;
import com.tradetracker.domain.model.ConnectionStats;
import com.tradetracker.domain.model.PriceTick;
import com.tradetracker.observability.TrackerMetricsService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Owns at most one upstream price feed per instrument and fans its ticks out to every
 * registered listener.
 *
 * <p>Each subscribed instrument has a reference-counted listener set and one watch
 * loop running on the {@code marketDataExecutor}. The loop:
 * <ol>
 *   <li>streams from each venue in priority order, failing over on error;</li>
 *   <li>when every venue has failed, polls the polling venue at a fixed interval until
 *       a new subscriber asks for a streaming retry or the polling budget runs out;</li>
 *   <li>backs off exponentially (capped) and starts the venue cycle again.</li>
 * </ol>
 * The loop only ends when the last listener unsubscribes or the service shuts down.
 *
 * <p><b>Concurrency model:</b> subscribe/unsubscribe/restart mutate an instrument's
 * entry inside {@code ConcurrentHashMap.compute*}, so starting and cancelling its loop
 * is atomic with the listener count reaching one or zero. A loop checks on every
 * iteration that it is still the current loop of a registered entry; a cancelled loop
 * is interrupted and exits without touching the new state.
 *
 * <p>Listener failures are caught and logged per listener so one faulty callback cannot
 * block fan-out to the others.
 */
@Service
public class ConnectionMultiplexer {

    private static final Logger log = LoggerFactory.getLogger(ConnectionMultiplexer.class);

    static final String POLLING = "polling";

    private final Map<String, SymbolSubscription> subscriptions = new ConcurrentHashMap<>();

    private final List<StreamingVenueClient> streamingVenues;
    private final PollingVenueClient pollingVenue;
    private final AsyncTaskExecutor executor;
    private final MarketDataConfig config;
    private final Clock clock;
    private final TrackerMetricsService metrics;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public ConnectionMultiplexer(
            List<StreamingVenueClient> streamingVenueClients,
            List<PollingVenueClient> pollingVenueClients,
            @Qualifier("marketDataExecutor") AsyncTaskExecutor executor,
            MarketDataConfig config,
            Clock clock,
            TrackerMetricsService metrics) {
        this.streamingVenues = orderByPriority(streamingVenueClients, config.getVenuePriority());
        this.pollingVenue = selectPollingVenue(pollingVenueClients, config.getPollingVenue());
        this.executor = executor;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;

        metrics.registerGauge("multiplexer.symbols", "Instruments with at least one listener", subscriptions::size);
        metrics.registerGauge("multiplexer.polling", "Instruments served by polling", this::getPollingCount);

        log.info(
                "Connection multiplexer ready: streaming venues {}, polling venue {}",
                streamingVenues.stream().map(StreamingVenueClient::getName).toList(),
                pollingVenue != null ? pollingVenue.getName() : "none");
    }

    // ---- Subscription management ----

    /**
     * Registers a listener for an instrument. The first listener starts the instrument's
     * watch loop. A new listener on an instrument that is currently polling asks the
     * loop to retry streaming venues.
     *
     * @return true if this call started a new watch loop
     */
    public boolean subscribe(String symbol, PriceListener listener) {
        if (shutdown.get()) {
            log.warn("Ignoring subscribe for {} after shutdown", symbol);
            return false;
        }
        AtomicBoolean started = new AtomicBoolean(false);
        subscriptions.compute(symbol, (key, existing) -> {
            SymbolSubscription subscription = existing != null ? existing : new SymbolSubscription(key);
            if (!subscription.listeners.contains(listener)) {
                subscription.listeners.add(listener);
            }
            if (existing == null) {
                startWatchLoop(subscription);
                started.set(true);
            } else if (subscription.polling) {
                subscription.streamingRetryRequested.set(true);
            }
            return subscription;
        });

        log.info("Subscribed listener to {} ({} listeners, new loop: {})", symbol, getListenerCount(symbol), started.get());
        return started.get();
    }

    /**
     * Removes a listener. When the last listener leaves, the watch loop is cancelled and
     * all state for the instrument is dropped.
     *
     * @return true if this call tore down the instrument's watch loop
     */
    public boolean unsubscribe(String symbol, PriceListener listener) {
        AtomicBoolean stopped = new AtomicBoolean(false);
        subscriptions.computeIfPresent(symbol, (key, subscription) -> {
            subscription.listeners.remove(listener);
            if (!subscription.listeners.isEmpty()) {
                return subscription;
            }
            cancelWatchLoop(subscription);
            stopped.set(true);
            return null;
        });

        if (stopped.get()) {
            log.info("Last listener left {}, watch loop stopped", symbol);
        }
        return stopped.get();
    }

    public boolean isSubscribed(String symbol) {
        return subscriptions.containsKey(symbol);
    }

    public int getListenerCount(String symbol) {
        SymbolSubscription subscription = subscriptions.get(symbol);
        return subscription != null ? subscription.listeners.size() : 0;
    }

    public Set<String> getSubscribedSymbols() {
        return Collections.unmodifiableSet(subscriptions.keySet());
    }

    /** Number of watch loops currently owned by the multiplexer (one per subscribed instrument at most). */
    public int getActiveLoopCount() {
        return (int) subscriptions.values().stream()
                .filter(s -> s.future != null && !s.future.isDone())
                .count();
    }

    public int getPollingCount() {
        return (int) subscriptions.values().stream().filter(s -> s.polling).count();
    }

    // ---- Health monitor ----

    /**
     * Restarts the watch loop of any instrument that has not produced a tick within the
     * stale timeout, or whose loop is no longer running.
     */
    @Scheduled(fixedRateString = "${tradetracker.market-data.health-check-interval-ms:10000}")
    public void checkHealth() {
        long now = clock.millis();
        for (SymbolSubscription subscription : subscriptions.values()) {
            try {
                long silentFor = now - subscription.lastActivityMillis;
                boolean loopDead = subscription.future == null || subscription.future.isDone();
                if (silentFor > config.getStaleTickTimeoutMs() || loopDead) {
                    log.warn(
                            "HEALTH CHECK FAILED for {}: no tick for {}s (venue {}, loop running {}), restarting",
                            subscription.symbol,
                            silentFor / 1000,
                            subscription.activeVenue,
                            !loopDead);
                    restartWatchLoop(subscription);
                }
            } catch (Exception e) {
                log.error("Health check failed to restart {}: {}", subscription.symbol, e.getMessage(), e);
            }
        }
    }

    // ---- Statistics ----

    public ConnectionStats getConnectionStats() {
        long now = clock.millis();
        Map<String, Integer> venueDistribution = new TreeMap<>();
        Map<String, Long> tickAges = new LinkedHashMap<>();
        int subscribers = 0;
        int streaming = 0;
        int polling = 0;

        for (SymbolSubscription subscription : subscriptions.values()) {
            subscribers += subscription.listeners.size();
            if (subscription.polling) {
                polling++;
            } else if (subscription.activeVenue != null) {
                streaming++;
            }
            if (subscription.activeVenue != null) {
                venueDistribution.merge(subscription.activeVenue, 1, Integer::sum);
            }
            if (subscription.lastTickMillis > 0) {
                tickAges.put(subscription.symbol, (now - subscription.lastTickMillis) / 1000);
            }
        }

        return ConnectionStats.builder()
                .totalSymbols(subscriptions.size())
                .totalSubscribers(subscribers)
                .activeStreams(streaming)
                .pollingSymbols(polling)
                .venueDistribution(venueDistribution)
                .lastTickAgeSeconds(tickAges)
                .build();
    }

    // ---- Shutdown ----

    /**
     * Cancels every watch loop, drops all subscriptions and closes venue connections.
     * Errors while closing a venue are logged and do not stop the remaining teardown.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down connection multiplexer ({} symbols)", subscriptions.size());

        for (String symbol : new ArrayList<>(subscriptions.keySet())) {
            subscriptions.computeIfPresent(symbol, (key, subscription) -> {
                cancelWatchLoop(subscription);
                return null;
            });
        }

        for (StreamingVenueClient venue : streamingVenues) {
            try {
                venue.close();
            } catch (Exception e) {
                log.error("Error closing venue {}: {}", venue.getName(), e.getMessage(), e);
            }
        }
    }

    // ---- Watch loop lifecycle (called inside compute* for the symbol) ----

    private void startWatchLoop(SymbolSubscription subscription) {
        WatchLoop loop = new WatchLoop(subscription);
        subscription.loop = loop;
        subscription.lastActivityMillis = clock.millis();
        try {
            subscription.future = executor.submit(loop);
        } catch (TaskRejectedException e) {
            // Health monitor retries loops that never started.
            subscription.future = null;
            log.error("Watch loop for {} rejected by executor: {}", subscription.symbol, e.getMessage());
        }
    }

    private void cancelWatchLoop(SymbolSubscription subscription) {
        subscription.loop = null;
        Future<?> future = subscription.future;
        subscription.future = null;
        if (future != null) {
            future.cancel(true);
        }
        subscription.polling = false;
        subscription.activeVenue = null;
    }

    private void restartWatchLoop(SymbolSubscription stale) {
        subscriptions.computeIfPresent(stale.symbol, (key, current) -> {
            if (current != stale) {
                return current;
            }
            cancelWatchLoop(current);
            startWatchLoop(current);
            metrics.recordWatchRestart();
            return current;
        });
    }

    // ---- Fan-out ----

    private void dispatch(SymbolSubscription subscription, BigDecimal price, LocalDateTime timestamp) {
        long now = clock.millis();
        subscription.lastTickMillis = now;
        subscription.lastActivityMillis = now;

        for (PriceListener listener : subscription.listeners) {
            try {
                listener.onPrice(subscription.symbol, price, timestamp);
            } catch (Exception e) {
                log.error("Listener for {} failed on price {}: {}", subscription.symbol, price, e.getMessage(), e);
            }
        }
    }

    /**
     * Computes exponential backoff delay: initial, 2x, 4x, ... capped at the configured maximum.
     */
    long computeReconnectDelay(int attempt) {
        int shift = Math.min(Math.max(attempt - 1, 0), 20);
        return Math.min(config.getReconnectInitialDelayMs() * (1L << shift), config.getReconnectMaxDelayMs());
    }

    // ---- Helpers ----

    private static List<StreamingVenueClient> orderByPriority(List<StreamingVenueClient> clients, List<String> priority) {
        Map<String, StreamingVenueClient> byName = new LinkedHashMap<>();
        for (StreamingVenueClient client : clients) {
            byName.put(client.getName(), client);
        }
        List<StreamingVenueClient> ordered = new ArrayList<>();
        for (String name : priority) {
            StreamingVenueClient client = byName.remove(name);
            if (client != null) {
                ordered.add(client);
            } else {
                log.warn("Venue '{}' in priority list has no client, skipping", name);
            }
        }
        // Clients not named in the priority list go last, in registration order.
        ordered.addAll(byName.values());
        return List.copyOf(ordered);
    }

    private static PollingVenueClient selectPollingVenue(List<PollingVenueClient> clients, String name) {
        for (PollingVenueClient client : clients) {
            if (client.getName().equals(name)) {
                return client;
            }
        }
        if (!clients.isEmpty()) {
            log.warn("Polling venue '{}' not found, using {}", name, clients.get(0).getName());
            return clients.get(0);
        }
        return null;
    }

    /** Per-instrument state. Fields written by the watch loop are volatile for the health monitor. */
    private static final class SymbolSubscription {

        final String symbol;
        final List<PriceListener> listeners = new CopyOnWriteArrayList<>();
        final AtomicBoolean streamingRetryRequested = new AtomicBoolean(false);

        volatile WatchLoop loop;
        volatile Future<?> future;
        volatile String activeVenue;
        volatile boolean polling;
        volatile long lastTickMillis;

        /** Last tick, or loop start when no tick has arrived yet. */
        volatile long lastActivityMillis;

        SymbolSubscription(String symbol) {
            this.symbol = symbol;
        }
    }

    private final class WatchLoop implements Runnable {

        private final SymbolSubscription subscription;

        WatchLoop(SymbolSubscription subscription) {
            this.subscription = subscription;
        }

        @Override
        public void run() {
            String symbol = subscription.symbol;
            int failedCycles = 0;
            try {
                while (isCurrent()) {
                    long ticksBefore = subscription.lastTickMillis;
                    streamFromVenues();
                    if (!isCurrent()) {
                        return;
                    }
                    failedCycles = subscription.lastTickMillis != ticksBefore ? 1 : failedCycles + 1;

                    pollUntilStreamingRetry();
                    if (!isCurrent()) {
                        return;
                    }

                    long delay = computeReconnectDelay(failedCycles);
                    log.info("Retrying streaming venues for {} in {}ms (cycle {})", symbol, delay, failedCycles);
                    Thread.sleep(delay);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Watch loop for {} cancelled", symbol);
            } catch (RuntimeException e) {
                // Health monitor restarts loops that died.
                log.error("Watch loop for {} terminated unexpectedly: {}", symbol, e.getMessage(), e);
            }
        }

        private void streamFromVenues() throws InterruptedException {
            String symbol = subscription.symbol;
            for (StreamingVenueClient venue : streamingVenues) {
                if (!isCurrent()) {
                    return;
                }
                subscription.activeVenue = venue.getName();
                subscription.polling = false;
                try {
                    log.info("Streaming {} from {}", symbol, venue.getName());
                    venue.stream(symbol, this::onTick);
                    if (!isCurrent()) {
                        return;
                    }
                    log.warn("{} closed the stream for {}, failing over", venue.getName(), symbol);
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    if (!isCurrent()) {
                        return;
                    }
                    log.warn("{} failed for {}: {}, trying next venue", venue.getName(), symbol, e.getMessage());
                }
                metrics.recordVenueFailover();
            }
        }

        /**
         * Polls the REST venue until a new subscriber asks for streaming again, or until
         * {@code pollsBeforeStreamingRetry} rounds have run (300 by default, about five
         * minutes at the default interval), whichever comes first. Setting the budget
         * very high leaves polling to end only on a subscriber event.
         */
        private void pollUntilStreamingRetry() throws InterruptedException {
            String symbol = subscription.symbol;
            if (pollingVenue == null) {
                log.warn("All streaming venues failed for {} and no polling venue is configured", symbol);
                return;
            }

            log.warn("All streaming venues failed for {}, polling {}", symbol, pollingVenue.getName());
            metrics.recordPollingFallback();
            subscription.streamingRetryRequested.set(false);
            subscription.activeVenue = POLLING;
            subscription.polling = true;
            try {
                int polls = 0;
                while (isCurrent()
                        && !subscription.streamingRetryRequested.get()
                        && polls < config.getPollsBeforeStreamingRetry()) {
                    polls++;
                    try {
                        BigDecimal price = pollingVenue.fetchLastPrice(symbol);
                        dispatch(subscription, price, LocalDateTime.now(clock));
                        Thread.sleep(config.getPollingIntervalMs());
                    } catch (InterruptedException e) {
                        throw e;
                    } catch (Exception e) {
                        log.warn("Polling {} for {} failed: {}", pollingVenue.getName(), symbol, e.getMessage());
                        Thread.sleep(config.getPollingErrorBackoffMs());
                    }
                }
            } finally {
                subscription.polling = false;
            }
        }

        private void onTick(PriceTick tick) {
            if (!isCurrent() || tick.price() == null) {
                return;
            }
            dispatch(subscription, tick.price(), tick.timestamp());
        }

        private boolean isCurrent() {
            return !Thread.currentThread().isInterrupted()
                    && !shutdown.get()
                    && subscription.loop == this
                    && subscriptions.get(subscription.symbol) == subscription;
        }
    }
}
