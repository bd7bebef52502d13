package com.tradetracker.tracking;

import com.tradetracker.config.TrackingConfig;
import com.tradetracker.domain.enums.TradeOutcome;
import com.tradetracker.domain.enums.TradeStatus;
import com.tradetracker.domain.model.ExitDecision;
import com.tradetracker.domain.model.PriceSample;
import com.tradetracker.domain.model.Trade;
import com.tradetracker.domain.model.TradeMilestones;
import com.tradetracker.event.TradeClosedEvent;
import com.tradetracker.exit.ExitEvaluatorRegistry;
import com.tradetracker.mapper.TradeMapper;
import com.tradetracker.marketdata.ConnectionMultiplexer;
import com.tradetracker.marketdata.PriceListener;
import com.tradetracker.marketdata.SymbolNormalizer;
import com.tradetracker.milestone.MilestoneRecorder;
import com.tradetracker.observability.TrackerMetricsService;
import com.tradetracker.repository.jpa.TradeJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Tracks every open trade against live prices and closes it when a take-profit,
 * exit rule or timeout fires.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li><b>Registration:</b> one multiplexer subscription per instrument, shared by all
 *       trades on it; the subscription is released when its last trade leaves</li>
 *   <li><b>Tick processing:</b> throttled per instrument, then per trade: PnL,
 *       excursions, milestones, take-profit levels, exit evaluator, price sample</li>
 *   <li><b>Persistence:</b> per-tick writes go through the {@link TradeWriteBuffer};
 *       closing a trade flushes its instrument and persists the final state directly</li>
 *   <li><b>Closing:</b> publishes {@link TradeClosedEvent} and hands the trade to the
 *       {@link PostTradePipeline}</li>
 * </ul>
 *
 * <p><b>Concurrency model:</b> ticks for an instrument arrive on that instrument's
 * watch loop thread. A per-instrument ReentrantLock serializes tick processing with
 * add/remove/close for the same instrument, so a trade is never mutated by two threads
 * at once. Instruments are processed in parallel. One trade's failure is caught and
 * logged without affecting the others on the same tick.
 */
@Service
public class TradeTrackingEngine implements PriceListener {

    private static final Logger log = LoggerFactory.getLogger(TradeTrackingEngine.class);

    /** All tracked trades keyed by trade id. */
    private final Map<Long, Trade> activeTrades = new ConcurrentHashMap<>();

    /** Tracked trades per instrument. Inner maps are guarded by the instrument's lock. */
    private final Map<String, Map<Long, Trade>> tradesBySymbol = new ConcurrentHashMap<>();

    private final Map<String, ReentrantLock> symbolLocks = new ConcurrentHashMap<>();

    private final Map<String, Long> lastProcessedMillis = new ConcurrentHashMap<>();

    /** Last processed price per instrument, used as exit price for timeouts. */
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);

    private final ConnectionMultiplexer connectionMultiplexer;
    private final TradeJpaRepository tradeJpaRepository;
    private final TradeMapper tradeMapper;
    private final MilestoneRecorder milestoneRecorder;
    private final ExitEvaluatorRegistry exitEvaluatorRegistry;
    private final TradeWriteBuffer tradeWriteBuffer;
    private final PostTradePipeline postTradePipeline;
    private final ApplicationEventPublisher eventPublisher;
    private final TrackingConfig config;
    private final Clock clock;
    private final TrackerMetricsService metrics;

    public TradeTrackingEngine(
            ConnectionMultiplexer connectionMultiplexer,
            TradeJpaRepository tradeJpaRepository,
            TradeMapper tradeMapper,
            MilestoneRecorder milestoneRecorder,
            ExitEvaluatorRegistry exitEvaluatorRegistry,
            TradeWriteBuffer tradeWriteBuffer,
            PostTradePipeline postTradePipeline,
            ApplicationEventPublisher eventPublisher,
            TrackingConfig config,
            Clock clock,
            TrackerMetricsService metrics) {
        this.connectionMultiplexer = connectionMultiplexer;
        this.tradeJpaRepository = tradeJpaRepository;
        this.tradeMapper = tradeMapper;
        this.milestoneRecorder = milestoneRecorder;
        this.exitEvaluatorRegistry = exitEvaluatorRegistry;
        this.tradeWriteBuffer = tradeWriteBuffer;
        this.postTradePipeline = postTradePipeline;
        this.eventPublisher = eventPublisher;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;

        metrics.registerGauge("trades.active", "Trades currently tracked", activeTrades::size);
        metrics.registerGauge("trades.symbols", "Instruments with tracked trades", tradesBySymbol::size);
    }

    // ========================
    // LIFECYCLE
    // ========================

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (config.isAutoStart()) {
            startTracking();
        }
    }

    /**
     * Loads every ACTIVE trade from storage and subscribes one listener per instrument.
     * Calling it again while tracking is running does nothing.
     *
     * @return number of trades loaded, 0 if tracking was already running
     */
    public int startTracking() {
        if (!started.compareAndSet(false, true)) {
            log.info("Trade tracking already running ({} trades)", activeTrades.size());
            return 0;
        }

        List<Trade> trades = tradeMapper.toDomainList(tradeJpaRepository.findByStatus(TradeStatus.ACTIVE));
        int loaded = 0;
        for (Trade trade : trades) {
            try {
                if (addTrade(trade)) {
                    loaded++;
                }
            } catch (Exception e) {
                log.error("Failed to load trade {} ({}): {}", trade.getId(), trade.getSymbol(), e.getMessage(), e);
            }
        }
        log.info("Trade tracking started: {} active trades on {} instruments", loaded, tradesBySymbol.size());
        return loaded;
    }

    /** Releases every subscription and commits all pending writes. */
    public void stop() {
        log.info("Stopping trade tracking ({} trades, {} instruments)", activeTrades.size(), tradesBySymbol.size());
        for (String symbol : new ArrayList<>(tradesBySymbol.keySet())) {
            ReentrantLock lock = lockFor(symbol);
            lock.lock();
            try {
                connectionMultiplexer.unsubscribe(symbol, this);
                tradesBySymbol.remove(symbol);
            } catch (Exception e) {
                log.error("Failed to unsubscribe {} during stop: {}", symbol, e.getMessage(), e);
            } finally {
                lock.unlock();
            }
        }
        tradeWriteBuffer.flushAll();
        activeTrades.clear();
        lastProcessedMillis.clear();
        lastPrices.clear();
        milestoneRecorder.clearAll();
        started.set(false);
    }

    // ========================
    // REGISTRATION
    // ========================

    /**
     * Starts tracking a persisted trade. The first trade on an instrument subscribes
     * the engine to it.
     *
     * @return false if the trade was already tracked
     */
    public boolean addTrade(Trade trade) {
        if (trade.getId() == null) {
            throw new IllegalArgumentException("Trade must be persisted before tracking: " + trade.getTradeIdentifier());
        }
        String symbol = resolveSymbol(trade);
        ReentrantLock lock = lockFor(symbol);
        lock.lock();
        try {
            if (activeTrades.containsKey(trade.getId())) {
                log.debug("Trade {} already tracked", trade.getId());
                return false;
            }
            Map<Long, Trade> trades = tradesBySymbol.computeIfAbsent(symbol, s -> new LinkedHashMap<>());
            boolean firstOnSymbol = trades.isEmpty();
            trades.put(trade.getId(), trade);
            activeTrades.put(trade.getId(), trade);

            if (firstOnSymbol) {
                connectionMultiplexer.subscribe(symbol, this);
            }
            log.info(
                    "Tracking trade {} {} {} @ {} ({} on {})",
                    trade.getTradeIdentifier(),
                    trade.getDirection(),
                    symbol,
                    trade.getEntryPrice(),
                    trades.size(),
                    symbol);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops tracking a trade without closing it. The last trade on an instrument
     * releases its subscription.
     *
     * @return false if the trade was not tracked
     */
    public boolean removeTrade(Long tradeId) {
        Trade trade = activeTrades.get(tradeId);
        if (trade == null) {
            return false;
        }
        String symbol = trade.getTradingSymbol();
        ReentrantLock lock = lockFor(symbol);
        lock.lock();
        try {
            boolean removed = untrack(symbol, trade);
            releaseSymbolIfEmpty(symbol);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // TICK PROCESSING
    // ========================

    @Override
    public void onPrice(String symbol, BigDecimal price, LocalDateTime timestamp) {
        long nowMillis = clock.millis();
        Long last = lastProcessedMillis.get(symbol);
        if (last != null && nowMillis - last < config.getTickProcessIntervalMs()) {
            metrics.recordTickThrottled();
            return;
        }
        lastProcessedMillis.put(symbol, nowMillis);

        long startNanos = System.nanoTime();
        ReentrantLock lock = lockFor(symbol);
        lock.lock();
        try {
            Map<Long, Trade> trades = tradesBySymbol.get(symbol);
            if (trades == null || trades.isEmpty()) {
                return;
            }
            if (price != null) {
                lastPrices.put(symbol, price);
            }
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime tickTime = timestamp != null ? timestamp : now;
            for (Trade trade : new ArrayList<>(trades.values())) {
                try {
                    processTrade(symbol, trade, price, now, tickTime);
                } catch (Exception e) {
                    log.error(
                            "Tick processing failed for trade {} on {} @ {}: {}",
                            trade.getTradeIdentifier(),
                            symbol,
                            price,
                            e.getMessage(),
                            e);
                }
            }
            // Released after the loop: unsubscribing cancels this thread's watch loop.
            releaseSymbolIfEmpty(symbol);
        } finally {
            lock.unlock();
            metrics.recordTickProcessed(System.nanoTime() - startNanos);
        }
    }

    /** Milestones and exit stamps use the tick's own time; everything else uses the engine clock. */
    private void processTrade(
            String symbol, Trade trade, BigDecimal price, LocalDateTime now, LocalDateTime tickTime) {
        if (price == null || !trade.hasUsableEntryPrice()) {
            log.debug("Skipping trade {}: price {} entry {}", trade.getTradeIdentifier(), price, trade.getEntryPrice());
            return;
        }

        double pnlPct = PnlCalculator.pnlPct(trade.getDirection(), trade.getEntryPrice(), price);
        updateExcursions(trade, price, pnlPct);
        milestoneRecorder.updateMilestones(trade, pnlPct, tickTime);

        double elapsedMinutes = trade.minutesSinceEntry(now);
        for (TakeProfitLevel level : TakeProfitLevel.values()) {
            Double plannedPct = level.plannedPct(trade);
            if (plannedPct == null || level.isHit(trade) || pnlPct < plannedPct) {
                continue;
            }
            level.markHit(trade, now, price, (int) elapsedMinutes, trade.getMaxDrawdownPct());
            log.info(
                    "{} hit for {} {} @ {} ({}%) after {} min",
                    level,
                    trade.getTradeIdentifier(),
                    trade.getSymbol(),
                    price,
                    String.format("%.2f", pnlPct),
                    (int) elapsedMinutes);
            if (level.closesTrade()) {
                close(symbol, trade, level.getOutcome(), pnlPct, price, now, tickTime);
                return;
            }
        }

        if (!trade.isSlHit()) {
            ExitDecision decision = exitEvaluatorRegistry
                    .forStrategy(trade.getRiskStrategy())
                    .evaluate(trade, price, pnlPct, elapsedMinutes, now);
            if (decision.close()) {
                close(symbol, trade, TradeOutcome.SL, pnlPct, price, now, tickTime);
                return;
            }
        }

        tradeWriteBuffer.addSample(
                symbol,
                PriceSample.builder()
                        .tradeId(trade.getId())
                        .timestamp(now)
                        .price(price)
                        .pnlPct(pnlPct)
                        .maxProfitSoFar(trade.getMaxProfitPct())
                        .maxDrawdownSoFar(trade.getMaxDrawdownPct())
                        .build());
        tradeWriteBuffer.markTradeDirty(symbol, trade);
    }

    private static void updateExcursions(Trade trade, BigDecimal price, double pnlPct) {
        if (trade.getMaxProfitPct() == null || pnlPct > trade.getMaxProfitPct()) {
            trade.setMaxProfitPct(pnlPct);
            trade.setMaxFavorableExcursion(price);
        }
        if (trade.getMaxDrawdownPct() == null || pnlPct < trade.getMaxDrawdownPct()) {
            trade.setMaxDrawdownPct(pnlPct);
        }
    }

    // ========================
    // CLOSING
    // ========================

    /**
     * Closes a tracked trade with the given outcome and releases its instrument's
     * subscription if it was the last trade there. The exit price is the last
     * processed price of the instrument.
     */
    public void closeTrade(Trade trade, TradeOutcome outcome, double finalPnlPct) {
        String symbol = resolveSymbol(trade);
        ReentrantLock lock = lockFor(symbol);
        lock.lock();
        try {
            if (!activeTrades.containsKey(trade.getId())) {
                log.debug("Trade {} is no longer tracked, skipping close", trade.getTradeIdentifier());
                return;
            }
            LocalDateTime now = LocalDateTime.now(clock);
            close(symbol, trade, outcome, finalPnlPct, lastPrices.get(symbol), now, now);
            releaseSymbolIfEmpty(symbol);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes every trade open longer than the timeout horizon with outcome TIMEOUT and
     * its best PnL reached (0 when it never had a tick).
     *
     * @return number of trades closed
     */
    public int closeTimedOutTrades() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusHours(config.getTimeoutHours());
        int closed = 0;
        for (Trade trade : new ArrayList<>(activeTrades.values())) {
            LocalDateTime openedAt = trade.getEntryTime() != null ? trade.getEntryTime() : trade.getCreatedAt();
            if (openedAt == null || !openedAt.isBefore(cutoff)) {
                continue;
            }
            try {
                double finalPnl = trade.getMaxProfitPct() != null ? trade.getMaxProfitPct() : 0.0;
                log.info("Trade {} {} timed out (opened {})", trade.getTradeIdentifier(), trade.getSymbol(), openedAt);
                closeTrade(trade, TradeOutcome.TIMEOUT, finalPnl);
                closed++;
            } catch (Exception e) {
                log.error("Failed to close timed-out trade {}: {}", trade.getTradeIdentifier(), e.getMessage(), e);
            }
        }
        return closed;
    }

    /**
     * Caller holds the instrument lock and releases the subscription afterwards.
     *
     * <p>If the instrument's pending batch could not be committed, it still holds this
     * trade's pre-close snapshots. They are replaced with the completed ones before the
     * direct save, so a later retry of that batch writes the final state.
     */
    private void close(
            String symbol,
            Trade trade,
            TradeOutcome outcome,
            double finalPnlPct,
            BigDecimal exitPrice,
            LocalDateTime now,
            LocalDateTime exitAt) {
        boolean flushed = tradeWriteBuffer.forceFlush(symbol);

        trade.setStatus(TradeStatus.COMPLETED);
        trade.setFinalOutcome(outcome);
        trade.setCompletedAt(now);
        trade.setFinalPnlPct(finalPnlPct);

        TradeMilestones milestones = null;
        try {
            milestones = milestoneRecorder.recordExit(trade, exitPrice, finalPnlPct, exitAt);
            if (!flushed) {
                log.warn(
                        "Pending batch for {} not committed, re-queueing final state of {}",
                        symbol,
                        trade.getTradeIdentifier());
                requeueFinalState(symbol, trade, milestones);
            }
            tradeJpaRepository.save(tradeMapper.toEntity(trade));
            milestoneRecorder.save(milestones);
        } catch (Exception e) {
            // Queued snapshot is retried by the next batch commit.
            log.error("Failed to persist closed trade {}: {}", trade.getTradeIdentifier(), e.getMessage(), e);
            requeueFinalState(symbol, trade, milestones);
        }

        untrack(symbol, trade);
        metrics.recordTradeClosed(outcome);
        log.info(
                "Closed trade {} {} {}: {} at {} ({}%)",
                trade.getTradeIdentifier(),
                trade.getDirection(),
                trade.getSymbol(),
                outcome,
                exitPrice,
                String.format("%.2f", finalPnlPct));

        eventPublisher.publishEvent(new TradeClosedEvent(this, trade, outcome, finalPnlPct));

        try {
            postTradePipeline.processCompletedTrade(trade, outcome, finalPnlPct);
        } catch (Exception e) {
            log.error("Post-trade pipeline failed for {}: {}", trade.getTradeIdentifier(), e.getMessage(), e);
        }
    }

    // ========================
    // QUERIES
    // ========================

    public List<Trade> getActiveTrades() {
        return List.copyOf(activeTrades.values());
    }

    public int getActiveTradeCount() {
        return activeTrades.size();
    }

    public int getTrackedSymbolCount() {
        return tradesBySymbol.size();
    }

    public Optional<Trade> findActiveTrade(Long tradeId) {
        return Optional.ofNullable(activeTrades.get(tradeId));
    }

    public boolean isTracking(Long tradeId) {
        return activeTrades.containsKey(tradeId);
    }

    public boolean isStarted() {
        return started.get();
    }

    // ========================
    // HELPERS
    // ========================

    private void requeueFinalState(String symbol, Trade trade, TradeMilestones milestones) {
        tradeWriteBuffer.markTradeDirty(symbol, trade);
        if (milestones != null) {
            tradeWriteBuffer.markMilestonesDirty(symbol, milestones);
        }
    }

    /** Caller holds the instrument lock. */
    private boolean untrack(String symbol, Trade trade) {
        Map<Long, Trade> trades = tradesBySymbol.get(symbol);
        if (trades != null) {
            trades.remove(trade.getId());
        }
        milestoneRecorder.clearCache(trade.getId());
        return activeTrades.remove(trade.getId()) != null;
    }

    /** Caller holds the instrument lock. */
    private void releaseSymbolIfEmpty(String symbol) {
        Map<Long, Trade> trades = tradesBySymbol.get(symbol);
        if (trades == null || !trades.isEmpty()) {
            return;
        }
        tradesBySymbol.remove(symbol);
        lastProcessedMillis.remove(symbol);
        lastPrices.remove(symbol);
        connectionMultiplexer.unsubscribe(symbol, this);
        log.info("No trades left on {}, subscription released", symbol);
    }

    private String resolveSymbol(Trade trade) {
        if (trade.getTradingSymbol() == null) {
            trade.setTradingSymbol(SymbolNormalizer.normalize(trade.getSymbol()).tradingSymbol());
        }
        return trade.getTradingSymbol();
    }

    private ReentrantLock lockFor(String symbol) {
        return symbolLocks.computeIfAbsent(symbol, s -> new ReentrantLock());
    }
}
