package com.tradetracker.repository.jpa;

import com.tradetracker.entity.TradeMilestonesEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TradeMilestonesJpaRepository extends JpaRepository<TradeMilestonesEntity, Long> {

    Optional<TradeMilestonesEntity> findByTradeId(Long tradeId);
}
