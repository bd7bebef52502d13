package com.tradetracker.mapper;

import com.tradetracker.domain.model.Trade;
import com.tradetracker.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper between the Trade domain model and TradeEntity. Fields map one to one by name. */
@Mapper
public interface TradeMapper {

    TradeEntity toEntity(Trade trade);

    Trade toDomain(TradeEntity entity);

    List<Trade> toDomainList(List<TradeEntity> entities);
}
