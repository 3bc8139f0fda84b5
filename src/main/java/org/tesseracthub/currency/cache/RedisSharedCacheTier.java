package org.tesseracthub.currency.cache;

import java.time.Duration;
import java.util.Collection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Redis backed tier 2. Values are stored as JSON strings with a per-key TTL so expiry is enforced
 * by Redis itself.
 */
public class RedisSharedCacheTier implements SharedCacheTier {

  private static final Logger log = LoggerFactory.getLogger(RedisSharedCacheTier.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  public RedisSharedCacheTier(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public <T> CacheLookup<T> get(String key, TypeReference<T> type) {
    try {
      var json = redisTemplate.opsForValue().get(key);
      if (json == null) {
        return CacheLookup.miss();
      }
      return CacheLookup.sharedHit(objectMapper.readValue(json, type));
    } catch (Exception e) {
      log.warn("Redis read failed for key {}: {}", key, e.getMessage());
      recordError("get");
      return CacheLookup.error();
    }
  }

  @Override
  public void put(String key, Object value, Duration ttl) {
    try {
      redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
    } catch (Exception e) {
      log.warn("Redis write failed for key {}: {}", key, e.getMessage());
      recordError("put");
    }
  }

  @Override
  public void delete(Collection<String> keys) {
    try {
      redisTemplate.delete(keys);
    } catch (Exception e) {
      log.warn("Redis delete failed for keys {}: {}", keys, e.getMessage());
      recordError("delete");
    }
  }

  @Override
  public void deleteByPrefix(String prefix) {
    try {
      // TODO: switch to SCAN once the rate keyspace outgrows a single KEYS call
      var keys = redisTemplate.keys(prefix + "*");
      if (keys != null && !keys.isEmpty()) {
        var deleted = redisTemplate.delete(keys);
        log.debug("Deleted {} Redis keys with prefix {}", deleted, prefix);
      }
    } catch (Exception e) {
      log.warn("Redis delete by prefix failed for {}: {}", prefix, e.getMessage());
      recordError("delete");
    }
  }

  private void recordError(String operation) {
    meterRegistry.counter("currency.cache.shared.errors", "operation", operation).increment();
  }
}
