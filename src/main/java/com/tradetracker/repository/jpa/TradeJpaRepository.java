package com.tradetracker.repository.jpa;

import com.tradetracker.domain.enums.TradeDirection;
import com.tradetracker.domain.enums.TradeStatus;
import com.tradetracker.entity.TradeEntity;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trade_setups table.
 * Serves the tracker's active-trade load and the circuit breaker's per-asset history.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, Long> {

    List<TradeEntity> findByStatus(TradeStatus status);

    Optional<TradeEntity> findByTradeIdentifier(String tradeIdentifier);

    /** Most recent trades for an asset key with the given status, newest first. */
    @Query("SELECT t FROM TradeEntity t WHERE t.symbol = :symbol AND t.direction = :direction"
            + " AND t.webhookSource = :source AND t.status = :status ORDER BY t.createdAt DESC")
    List<TradeEntity> findRecentByAsset(
            @Param("symbol") String symbol,
            @Param("direction") TradeDirection direction,
            @Param("source") String source,
            @Param("status") TradeStatus status,
            Pageable pageable);

    /** Trades for an asset key created at or after {@code since}, newest first. */
    @Query("SELECT t FROM TradeEntity t WHERE t.symbol = :symbol AND t.direction = :direction"
            + " AND t.webhookSource = :source AND t.status = :status AND t.createdAt >= :since"
            + " ORDER BY t.createdAt DESC")
    List<TradeEntity> findByAssetSince(
            @Param("symbol") String symbol,
            @Param("direction") TradeDirection direction,
            @Param("source") String source,
            @Param("status") TradeStatus status,
            @Param("since") LocalDateTime since,
            Pageable pageable);
}
