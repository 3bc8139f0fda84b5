package org.tesseracthub.currency.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;

import org.tesseracthub.currency.cache.DisabledSharedCacheTier;
import org.tesseracthub.currency.cache.RedisSharedCacheTier;
import org.tesseracthub.currency.cache.SharedCacheTier;

/**
 * Wiring for the two-tier rate cache.
 *
 * <p>The in-process tier is built by {@link org.tesseracthub.currency.cache.RateCache} itself from
 * {@code currency-service.cache.*}. This class only picks the shared tier:
 *
 * <ul>
 *   <li>{@code currency-service.cache.shared-enabled=true} (default): Redis through the
 *       auto-configured {@link StringRedisTemplate}, values serialized as JSON with the
 *       application-wide ObjectMapper
 *   <li>{@code currency-service.cache.shared-enabled=false}: a tier that always misses, for
 *       single-instance deployments without Redis
 * </ul>
 */
@Configuration
public class CacheConfig {

  @Bean
  public Ticker cacheTicker() {
    return Ticker.systemTicker();
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "currency-service.cache",
      name = "shared-enabled",
      havingValue = "true",
      matchIfMissing = true)
  public SharedCacheTier redisSharedCacheTier(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
    return new RedisSharedCacheTier(redisTemplate, objectMapper, meterRegistry);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "currency-service.cache",
      name = "shared-enabled",
      havingValue = "false")
  public SharedCacheTier disabledSharedCacheTier() {
    return new DisabledSharedCacheTier();
  }
}
