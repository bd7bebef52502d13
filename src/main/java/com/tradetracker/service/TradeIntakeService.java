package com.tradetracker.service;

import com.tradetracker.domain.enums.AssetStatus;
import com.tradetracker.domain.enums.TradeStatus;
import com.tradetracker.domain.model.AssetKey;
import com.tradetracker.domain.model.Trade;
import com.tradetracker.entity.TradeEntity;
import com.tradetracker.exception.BusinessException;
import com.tradetracker.exception.ErrorCode;
import com.tradetracker.mapper.TradeMapper;
import com.tradetracker.marketdata.SymbolNormalizer;
import com.tradetracker.repository.jpa.TradeJpaRepository;
import com.tradetracker.risk.CircuitBreakerService;
import com.tradetracker.tracking.TradeTrackingEngine;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for new trades from the signal layer.
 *
 * <p>Refuses trades on keys the circuit breaker has paused or blacklisted, resolves
 * the venue-neutral symbol, persists the trade as ACTIVE and hands it to the
 * {@link TradeTrackingEngine}.
 */
@Service
public class TradeIntakeService {

    private static final Logger log = LoggerFactory.getLogger(TradeIntakeService.class);

    private final CircuitBreakerService circuitBreakerService;
    private final TradeTrackingEngine tradeTrackingEngine;
    private final TradeJpaRepository tradeJpaRepository;
    private final TradeMapper tradeMapper;
    private final Clock clock;

    public TradeIntakeService(
            CircuitBreakerService circuitBreakerService,
            TradeTrackingEngine tradeTrackingEngine,
            TradeJpaRepository tradeJpaRepository,
            TradeMapper tradeMapper,
            Clock clock) {
        this.circuitBreakerService = circuitBreakerService;
        this.tradeTrackingEngine = tradeTrackingEngine;
        this.tradeJpaRepository = tradeJpaRepository;
        this.tradeMapper = tradeMapper;
        this.clock = clock;
    }

    /**
     * Persists and starts tracking a new trade.
     *
     * @return the persisted trade, with its id assigned
     * @throws BusinessException when the key is not tradable or the symbol cannot be parsed
     */
    public Trade acceptTrade(Trade trade) {
        AssetKey key = AssetKey.of(trade);
        AssetStatus status = circuitBreakerService.checkAssetStatus(key);
        if (!status.allowsTrading()) {
            log.warn("Refusing trade {} on {}: asset is {}", trade.getTradeIdentifier(), key, status);
            throw new BusinessException(
                    ErrorCode.ASSET_NOT_TRADABLE,
                    "Asset " + key + " is " + status,
                    Map.of("asset", key.toString(), "status", status.name()));
        }

        if (trade.getTradingSymbol() == null) {
            trade.setTradingSymbol(SymbolNormalizer.normalize(trade.getSymbol()).tradingSymbol());
        }
        LocalDateTime now = LocalDateTime.now(clock);
        trade.setStatus(TradeStatus.ACTIVE);
        if (trade.getCreatedAt() == null) {
            trade.setCreatedAt(now);
        }
        if (trade.getEntryTime() == null) {
            trade.setEntryTime(now);
        }

        TradeEntity saved = tradeJpaRepository.save(tradeMapper.toEntity(trade));
        trade.setId(saved.getId());
        tradeTrackingEngine.addTrade(trade);
        log.info("Accepted trade {} ({} {}) as id {}", trade.getTradeIdentifier(), key, status, trade.getId());
        return trade;
    }
}
