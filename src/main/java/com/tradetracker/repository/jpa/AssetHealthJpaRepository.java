package com.tradetracker.repository.jpa;

import com.tradetracker.domain.enums.TradeDirection;
import com.tradetracker.entity.AssetHealthEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AssetHealthJpaRepository extends JpaRepository<AssetHealthEntity, Long> {

    Optional<AssetHealthEntity> findBySymbolAndDirectionAndWebhookSource(
            String symbol, TradeDirection direction, String webhookSource);
}
