package com.tradetracker.repository.jpa;

import com.tradetracker.entity.PriceSampleEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for trade_price_samples.
 * Rows are written in batches while a trade is open and removed in bulk after close.
 */
@Repository
public interface PriceSampleJpaRepository extends JpaRepository<PriceSampleEntity, Long> {

    List<PriceSampleEntity> findByTradeIdOrderByTimestampAsc(Long tradeId);

    long countByTradeId(Long tradeId);

    @Modifying
    @Transactional
    @Query("DELETE FROM PriceSampleEntity s WHERE s.tradeId = :tradeId")
    int deleteByTradeId(@Param("tradeId") Long tradeId);
}
