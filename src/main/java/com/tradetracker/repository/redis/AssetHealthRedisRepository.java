package com.tradetracker.repository.redis;

import com.tradetracker.config.CircuitBreakerConfig;
import com.tradetracker.config.RedisConfig;
import com.tradetracker.domain.model.AssetHealth;
import com.tradetracker.domain.model.AssetKey;
import java.time.Duration;
import java.util.Optional;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Short-lived Redis copy of asset health records for the trade-acceptance path.
 *
 * <p>H2 (via AssetHealthJpaRepository) is the source of truth. Entries expire after the
 * configured status cache TTL and are overwritten whenever the circuit breaker saves a
 * record, so a stale read is bounded by the TTL.
 */
@Repository
public class AssetHealthRedisRepository {

    private final RedisTemplate<String, Object> redisTemplate;
    private final CircuitBreakerConfig config;

    public AssetHealthRedisRepository(RedisTemplate<String, Object> redisTemplate, CircuitBreakerConfig config) {
        this.redisTemplate = redisTemplate;
        this.config = config;
    }

    public void save(AssetHealth health) {
        redisTemplate
                .opsForValue()
                .set(keyFor(health.key()), health, Duration.ofSeconds(config.getStatusCacheTtlSeconds()));
    }

    public Optional<AssetHealth> findByKey(AssetKey key) {
        Object value = redisTemplate.opsForValue().get(keyFor(key));
        return Optional.ofNullable((AssetHealth) value);
    }

    static String keyFor(AssetKey key) {
        return RedisConfig.KEY_PREFIX_ASSET + key;
    }
}
