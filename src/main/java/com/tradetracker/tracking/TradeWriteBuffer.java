package com.tradetracker.tracking;

import com.tradetracker.config.TrackingConfig;
import com.tradetracker.domain.model.PriceSample;
import com.tradetracker.domain.model.Trade;
import com.tradetracker.domain.model.TradeMilestones;
import com.tradetracker.entity.PriceSampleEntity;
import com.tradetracker.entity.TradeEntity;
import com.tradetracker.entity.TradeMilestonesEntity;
import com.tradetracker.mapper.PriceSampleMapper;
import com.tradetracker.mapper.TradeMapper;
import com.tradetracker.mapper.TradeMilestonesMapper;
import com.tradetracker.observability.TrackerMetricsService;
import com.tradetracker.repository.jpa.PriceSampleJpaRepository;
import com.tradetracker.repository.jpa.TradeJpaRepository;
import com.tradetracker.repository.jpa.TradeMilestonesJpaRepository;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Write-behind buffer for the tick hot path, partitioned by instrument.
 *
 * <p>Each instrument accumulates price samples plus the latest snapshot of every
 * trade and milestone record touched since its last commit. A batch is committed in
 * one transaction once the commit interval has elapsed, so database pressure is
 * bounded by the interval rather than by tick rate.
 *
 * <p>Snapshots are mapped to entities when queued, on the watch loop thread that owns
 * the trade, so a commit never reads a trade while a tick is mutating it. A newer
 * snapshot of the same trade replaces the queued one.
 *
 * <p>A per-instrument lock serializes check-and-commit; the due/empty check is
 * repeated after the lock is acquired. A batch is only cleared once its transaction
 * commits; a failed commit is rolled back and the data stays queued for the next
 * interval.
 */
@Service
public class TradeWriteBuffer {

    private static final Logger log = LoggerFactory.getLogger(TradeWriteBuffer.class);

    private final Map<String, PendingBatch> batches = new ConcurrentHashMap<>();

    private final TradeJpaRepository tradeJpaRepository;
    private final TradeMilestonesJpaRepository tradeMilestonesJpaRepository;
    private final PriceSampleJpaRepository priceSampleJpaRepository;
    private final TradeMapper tradeMapper;
    private final TradeMilestonesMapper tradeMilestonesMapper;
    private final PriceSampleMapper priceSampleMapper;
    private final TransactionTemplate transactionTemplate;
    private final TrackingConfig config;
    private final Clock clock;
    private final TrackerMetricsService metrics;

    public TradeWriteBuffer(
            TradeJpaRepository tradeJpaRepository,
            TradeMilestonesJpaRepository tradeMilestonesJpaRepository,
            PriceSampleJpaRepository priceSampleJpaRepository,
            TradeMapper tradeMapper,
            TradeMilestonesMapper tradeMilestonesMapper,
            PriceSampleMapper priceSampleMapper,
            TransactionTemplate transactionTemplate,
            TrackingConfig config,
            Clock clock,
            TrackerMetricsService metrics) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.tradeMilestonesJpaRepository = tradeMilestonesJpaRepository;
        this.priceSampleJpaRepository = priceSampleJpaRepository;
        this.tradeMapper = tradeMapper;
        this.tradeMilestonesMapper = tradeMilestonesMapper;
        this.priceSampleMapper = priceSampleMapper;
        this.transactionTemplate = transactionTemplate;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    // ---- Queue methods (called from the tick hot path) ----

    public void addSample(String symbol, PriceSample sample) {
        PendingBatch batch = batchFor(symbol);
        PriceSampleEntity entity = priceSampleMapper.toEntity(sample);
        batch.lock.lock();
        try {
            batch.samples.add(entity);
        } finally {
            batch.lock.unlock();
        }
    }

    public void markTradeDirty(String symbol, Trade trade) {
        PendingBatch batch = batchFor(symbol);
        TradeEntity entity = tradeMapper.toEntity(trade);
        batch.lock.lock();
        try {
            batch.trades.put(trade.getId(), entity);
        } finally {
            batch.lock.unlock();
        }
    }

    public void markMilestonesDirty(String symbol, TradeMilestones milestones) {
        PendingBatch batch = batchFor(symbol);
        TradeMilestonesEntity entity = tradeMilestonesMapper.toEntity(milestones);
        batch.lock.lock();
        try {
            batch.milestones.put(milestones.getTradeId(), entity);
        } finally {
            batch.lock.unlock();
        }
    }

    /**
     * Drops the trade's queued price samples so a later commit cannot re-insert rows
     * that were deleted after close.
     *
     * @return number of samples dropped
     */
    public int discardSamples(String symbol, Long tradeId) {
        PendingBatch batch = batches.get(symbol);
        if (batch == null) {
            return 0;
        }
        batch.lock.lock();
        try {
            int before = batch.samples.size();
            batch.samples.removeIf(sample -> tradeId.equals(sample.getTradeId()));
            return before - batch.samples.size();
        } finally {
            batch.lock.unlock();
        }
    }

    // ---- Flushing ----

    /** Commits every instrument whose commit interval has elapsed. */
    @Scheduled(fixedDelayString = "${tradetracker.tracking.commit-interval-ms:5000}")
    public void flushDue() {
        long now = clock.millis();
        for (Map.Entry<String, PendingBatch> entry : batches.entrySet()) {
            PendingBatch batch = entry.getValue();
            if (isDue(batch, now)) {
                flush(entry.getKey(), batch, false);
            }
        }
    }

    /** Commits the instrument's pending batch now, regardless of the interval. Returns false if the commit failed. */
    public boolean forceFlush(String symbol) {
        PendingBatch batch = batches.get(symbol);
        return batch == null || flush(symbol, batch, true);
    }

    /** Commits every pending batch. Used on shutdown. */
    public void flushAll() {
        int failed = 0;
        for (Map.Entry<String, PendingBatch> entry : batches.entrySet()) {
            if (!flush(entry.getKey(), entry.getValue(), true)) {
                failed++;
            }
        }
        log.info("Flushed all pending batches ({} instruments, {} failed)", batches.size(), failed);
    }

    public int getPendingSampleCount(String symbol) {
        PendingBatch batch = batches.get(symbol);
        if (batch == null) {
            return 0;
        }
        batch.lock.lock();
        try {
            return batch.samples.size();
        } finally {
            batch.lock.unlock();
        }
    }

    public boolean hasPendingWrites(String symbol) {
        PendingBatch batch = batches.get(symbol);
        if (batch == null) {
            return false;
        }
        batch.lock.lock();
        try {
            return !batch.isEmpty();
        } finally {
            batch.lock.unlock();
        }
    }

    private boolean flush(String symbol, PendingBatch batch, boolean force) {
        List<PriceSampleEntity> samples;
        List<TradeEntity> trades;
        List<TradeMilestonesEntity> milestones;

        batch.lock.lock();
        try {
            // Another thread may have committed while this one waited.
            if (batch.isEmpty() || (!force && !isDue(batch, clock.millis()))) {
                return true;
            }
            samples = new ArrayList<>(batch.samples);
            trades = new ArrayList<>(batch.trades.values());
            milestones = new ArrayList<>(batch.milestones.values());

            try {
                transactionTemplate.executeWithoutResult(status -> {
                    tradeJpaRepository.saveAll(trades);
                    tradeMilestonesJpaRepository.saveAll(milestones);
                    priceSampleJpaRepository.saveAll(samples);
                });
                batch.samples.clear();
                batch.trades.clear();
                batch.milestones.clear();
                batch.lastCommitMillis = clock.millis();
                log.debug(
                        "Committed {}: {} samples, {} trades, {} milestone records",
                        symbol,
                        samples.size(),
                        trades.size(),
                        milestones.size());
                return true;
            } catch (Exception e) {
                // Batch stays queued; the next interval retries it.
                batch.lastCommitMillis = clock.millis();
                metrics.recordFlushFailure();
                log.error(
                        "Commit failed for {} ({} samples, {} trades), retrying next interval: {}",
                        symbol,
                        samples.size(),
                        trades.size(),
                        e.getMessage(),
                        e);
                return false;
            }
        } finally {
            batch.lock.unlock();
        }
    }

    private boolean isDue(PendingBatch batch, long now) {
        return now - batch.lastCommitMillis >= config.getCommitIntervalMs();
    }

    private PendingBatch batchFor(String symbol) {
        return batches.computeIfAbsent(symbol, s -> new PendingBatch(clock.millis()));
    }

    private static final class PendingBatch {

        final ReentrantLock lock = new ReentrantLock();
        final List<PriceSampleEntity> samples = new ArrayList<>();
        final Map<Long, TradeEntity> trades = new LinkedHashMap<>();
        final Map<Long, TradeMilestonesEntity> milestones = new LinkedHashMap<>();
        volatile long lastCommitMillis;

        PendingBatch(long createdMillis) {
            this.lastCommitMillis = createdMillis;
        }

        boolean isEmpty() {
            return samples.isEmpty() && trades.isEmpty() && milestones.isEmpty();
        }
    }
}
