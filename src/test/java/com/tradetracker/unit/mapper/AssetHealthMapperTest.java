package com.tradetracker.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradetracker.domain.enums.AssetStatus;
import com.tradetracker.domain.enums.StrategyProfile;
import com.tradetracker.domain.enums.TradeDirection;
import com.tradetracker.domain.model.AssetHealth;
import com.tradetracker.domain.model.AssetKey;
import com.tradetracker.entity.AssetHealthEntity;
import com.tradetracker.mapper.AssetHealthMapper;
import com.tradetracker.mapper.JsonHelper;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

/**
 * Asset health records must come back unchanged from storage and from their JSON
 * snapshot, otherwise a restart could silently resume a paused key.
 */
class AssetHealthMapperTest {

    private final AssetHealthMapper mapper = Mappers.getMapper(AssetHealthMapper.class);

    private static AssetHealth paused() {
        AssetHealth health = AssetHealth.newRecord(
                new AssetKey("ETHUSDT", TradeDirection.SHORT, "tv"), LocalDateTime.of(2024, 3, 1, 8, 0));
        health.setId(3L);
        health.setStatus(AssetStatus.PAUSED);
        health.setStrategyProfile(StrategyProfile.HIGH_WR);
        health.setPauseReason("Max drawdown: -3.40% (limit: -3.0%)");
        health.setPausedAt(LocalDateTime.of(2024, 3, 2, 14, 5));
        health.setPauseCount(1);
        health.setWinRateLast20(65.0);
        health.setCumulativePnlLast20(-3.4);
        health.setConsecutiveLosses(2);
        health.setTotalTrades(20);
        return health;
    }

    @Test
    @DisplayName("toEntity/toDomain: status, pause state and metrics survive storage")
    void entityRoundTrip() {
        AssetHealth original = paused();

        AssetHealthEntity entity = mapper.toEntity(original);
        AssetHealth restored = mapper.toDomain(entity);

        assertThat(entity.getWebhookSource()).isEqualTo("tv");
        assertThat(restored).isEqualTo(original);
        assertThat(restored.key()).isEqualTo(original.key());
    }

    @Test
    @DisplayName("JsonHelper: snapshot uses ISO dates and reads back equal")
    void jsonRoundTrip() {
        AssetHealth original = paused();

        String json = JsonHelper.toJson(original);
        AssetHealth restored = JsonHelper.fromJson(json, AssetHealth.class);

        assertThat(json).contains("\"pausedAt\":\"2024-03-02T14:05");
        assertThat(restored).isEqualTo(original);
    }

    @Test
    void fromJson_blankIsNull() {
        assertThat(JsonHelper.fromJson(" ", AssetHealth.class)).isNull();
    }

    @Test
    void readTree_malformedInputFails() {
        assertThatThrownBy(() -> JsonHelper.readTree("{not json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("Malformed JSON");
    }
}
