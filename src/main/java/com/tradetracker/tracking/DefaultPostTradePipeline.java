package com.tradetracker.tracking;

import com.tradetracker.config.TrackingConfig;
import com.tradetracker.domain.enums.TradeOutcome;
import com.tradetracker.domain.model.Trade;
import com.tradetracker.repository.jpa.PriceSampleJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Removes a closed trade's price samples once they are no longer needed. */
@Component
public class DefaultPostTradePipeline implements PostTradePipeline {

    private static final Logger log = LoggerFactory.getLogger(DefaultPostTradePipeline.class);

    private final PriceSampleJpaRepository priceSampleJpaRepository;
    private final TradeWriteBuffer tradeWriteBuffer;
    private final TrackingConfig config;

    public DefaultPostTradePipeline(
            PriceSampleJpaRepository priceSampleJpaRepository, TradeWriteBuffer tradeWriteBuffer, TrackingConfig config) {
        this.priceSampleJpaRepository = priceSampleJpaRepository;
        this.tradeWriteBuffer = tradeWriteBuffer;
        this.config = config;
    }

    @Override
    public void processCompletedTrade(Trade trade, TradeOutcome outcome, double finalPnlPct) {
        log.info(
                "Post-trade processing for {} {} ({}, {}%)",
                trade.getTradeIdentifier(),
                trade.getSymbol(),
                outcome,
                String.format("%.2f", finalPnlPct));

        if (config.isCleanupSamplesOnClose()) {
            // Samples still queued after a failed commit would be re-inserted later.
            int dropped = trade.getTradingSymbol() != null
                    ? tradeWriteBuffer.discardSamples(trade.getTradingSymbol(), trade.getId())
                    : 0;
            int deleted = priceSampleJpaRepository.deleteByTradeId(trade.getId());
            log.debug(
                    "Deleted {} price samples for trade {} ({} still queued dropped)",
                    deleted,
                    trade.getTradeIdentifier(),
                    dropped);
        }
    }
}
