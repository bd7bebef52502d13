package com.tradetracker.milestone;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tradetracker.domain.model.Trade;
import com.tradetracker.domain.model.TradeMilestones;
import com.tradetracker.mapper.TradeMilestonesMapper;
import com.tradetracker.repository.jpa.TradeMilestonesJpaRepository;
import com.tradetracker.tracking.TradeWriteBuffer;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records when each open trade first crosses the fixed profit and drawdown thresholds.
 *
 * <p>Milestone records live in a Caffeine cache keyed by trade id while the trade is
 * open. The record is created lazily on first use and its updates go through the
 * {@link TradeWriteBuffer} with the trade's other per-tick writes.
 *
 * <p>Called on the watch loop thread of the trade's instrument, so per-trade calls
 * never overlap.
 */
@Service
public class MilestoneRecorder {

    private static final Logger log = LoggerFactory.getLogger(MilestoneRecorder.class);

    private final Cache<Long, TradeMilestones> cache;

    private final TradeMilestonesJpaRepository tradeMilestonesJpaRepository;
    private final TradeMilestonesMapper tradeMilestonesMapper;
    private final TradeWriteBuffer tradeWriteBuffer;

    public MilestoneRecorder(
            TradeMilestonesJpaRepository tradeMilestonesJpaRepository,
            TradeMilestonesMapper tradeMilestonesMapper,
            TradeWriteBuffer tradeWriteBuffer) {
        this.tradeMilestonesJpaRepository = tradeMilestonesJpaRepository;
        this.tradeMilestonesMapper = tradeMilestonesMapper;
        this.tradeWriteBuffer = tradeWriteBuffer;
        // Entries are removed on close; the access expiry only bounds leaks.
        this.cache = Caffeine.newBuilder()
                .expireAfterAccess(48, TimeUnit.HOURS)
                .maximumSize(50_000)
                .build();
    }

    /**
     * Returns the trade's milestone record, loading or creating it on first use.
     * Repeated calls return the same record and create at most one row.
     */
    public TradeMilestones ensureRecord(Trade trade) {
        TradeMilestones cached = cache.getIfPresent(trade.getId());
        if (cached != null) {
            return cached;
        }

        TradeMilestones milestones = tradeMilestonesJpaRepository
                .findByTradeId(trade.getId())
                .map(tradeMilestonesMapper::toDomain)
                .orElseGet(() -> create(trade));
        cache.put(trade.getId(), milestones);
        return milestones;
    }

    /**
     * Stamps every threshold crossed for the first time by this PnL and refreshes the
     * running extremes, then queues the record for the next commit.
     */
    public void updateMilestones(Trade trade, double pnlPct, LocalDateTime timestamp) {
        TradeMilestones milestones = ensureRecord(trade);

        for (MilestoneThreshold threshold : MilestoneThreshold.values()) {
            if (threshold.isCrossedBy(pnlPct) && threshold.markReached(milestones, timestamp)) {
                log.debug(
                        "Trade {} reached {}% at {}", trade.getTradeIdentifier(), threshold.getPct(), timestamp);
            }
        }

        if (milestones.getMaxProfitPct() == null || pnlPct > milestones.getMaxProfitPct()) {
            milestones.setMaxProfitPct(pnlPct);
            milestones.setMaxProfitAt(timestamp);
        }
        if (milestones.getMaxDrawdownPct() == null || pnlPct < milestones.getMaxDrawdownPct()) {
            milestones.setMaxDrawdownPct(pnlPct);
            milestones.setMaxDrawdownAt(timestamp);
        }

        tradeWriteBuffer.markMilestonesDirty(trade.getTradingSymbol(), milestones);
    }

    /** Stamps the exit fields. The caller persists the record. */
    public TradeMilestones recordExit(Trade trade, BigDecimal exitPrice, double finalPnlPct, LocalDateTime at) {
        TradeMilestones milestones = ensureRecord(trade);
        milestones.setExitPrice(exitPrice);
        milestones.setExitAt(at);
        milestones.setFinalPnlPct(finalPnlPct);
        return milestones;
    }

    /** Persists the record immediately, outside the batch. */
    public void save(TradeMilestones milestones) {
        tradeMilestonesJpaRepository.save(tradeMilestonesMapper.toEntity(milestones));
    }

    public void clearCache(Long tradeId) {
        cache.invalidate(tradeId);
    }

    public void clearAll() {
        cache.invalidateAll();
    }

    public long getCachedCount() {
        return cache.estimatedSize();
    }

    private TradeMilestones create(Trade trade) {
        TradeMilestones milestones = TradeMilestones.builder()
                .tradeId(trade.getId())
                .entryPrice(trade.getEntryPrice())
                .entryTime(trade.getEntryTime())
                .build();
        TradeMilestones saved =
                tradeMilestonesMapper.toDomain(tradeMilestonesJpaRepository.save(tradeMilestonesMapper.toEntity(milestones)));
        log.debug("Created milestone record {} for trade {}", saved.getId(), trade.getTradeIdentifier());
        return saved;
    }
}
