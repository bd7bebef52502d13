package com.tradetracker.mapper;

import com.tradetracker.domain.model.PriceSample;
import com.tradetracker.entity.PriceSampleEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public interface PriceSampleMapper {

    @Mapping(target = "id", ignore = true)
    PriceSampleEntity toEntity(PriceSample sample);

    List<PriceSampleEntity> toEntityList(List<PriceSample> samples);
}
