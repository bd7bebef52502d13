package com.tradetracker.mapper;

import com.tradetracker.domain.model.TradeMilestones;
import com.tradetracker.entity.TradeMilestonesEntity;
import org.mapstruct.Mapper;

@Mapper
public interface TradeMilestonesMapper {

    TradeMilestonesEntity toEntity(TradeMilestones milestones);

    TradeMilestones toDomain(TradeMilestonesEntity entity);
}
