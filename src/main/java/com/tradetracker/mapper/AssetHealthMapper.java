package com.tradetracker.mapper;

import com.tradetracker.domain.model.AssetHealth;
import com.tradetracker.entity.AssetHealthEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between AssetHealth and AssetHealthEntity. Both sides carry the
 * same flat fields, so a save-then-load preserves status, pause count and metrics.
 */
@Mapper
public interface AssetHealthMapper {

    AssetHealthEntity toEntity(AssetHealth health);

    AssetHealth toDomain(AssetHealthEntity entity);

    List<AssetHealth> toDomainList(List<AssetHealthEntity> entities);
}
