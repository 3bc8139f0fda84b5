package org.tesseracthub.currency.cache;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.tesseracthub.currency.config.CurrencyServiceProperties;
import org.tesseracthub.currency.domain.CurrencyPair;

/**
 * Two-tier exchange rate cache.
 *
 * <p><b>Tiers:</b>
 *
 * <ul>
 *   <li><b>Tier 1:</b> in-process Caffeine cache, expire-after-write (5 minutes by default). Safe
 *       for concurrent use without external locking.
 *   <li><b>Tier 2:</b> {@link SharedCacheTier}, normally Redis with a 1 hour TTL. Shared across
 *       instances and survives restarts.
 * </ul>
 *
 * <p>Reads go tier 1, then tier 2; a tier 2 hit is promoted into tier 1. Writes go to both tiers.
 * Tier 2 failures never propagate: reads report them as {@link CacheLookup.Outcome#ERROR} and the
 * caller carries on as if it was a miss.
 *
 * <p><b>Redis keys:</b>
 *
 * <ul>
 *   <li>{@code currency:rate:{base}:{target}} - single {@link CachedRate}
 *   <li>{@code currency:rates:all} - map of target to {@link CachedRate} for the configured base
 *   <li>{@code currency:supported} - reserved, cleared by {@link #invalidateAll()}
 * </ul>
 */
@Component
public class RateCache {

  private static final Logger log = LoggerFactory.getLogger(RateCache.class);

  static final String RATE_KEY_PREFIX = "currency:rate:";
  static final String ALL_RATES_KEY = "currency:rates:all";
  static final String SUPPORTED_KEY = "currency:supported";

  private static final TypeReference<CachedRate> CACHED_RATE_TYPE = new TypeReference<>() {};
  private static final TypeReference<Map<String, CachedRate>> ALL_RATES_TYPE =
      new TypeReference<>() {};

  private final Cache<CurrencyPair, CachedRate> localRates;
  private final Cache<String, Map<String, CachedRate>> localAggregate;
  private final SharedCacheTier sharedTier;
  private final CurrencyServiceProperties.Cache cacheProperties;
  private final Clock clock;

  private final Counter localHitCounter;
  private final Counter sharedHitCounter;
  private final Counter missCounter;

  public RateCache(
      CurrencyServiceProperties properties,
      SharedCacheTier sharedTier,
      Ticker cacheTicker,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.cacheProperties = properties.getCache();
    this.sharedTier = sharedTier;
    this.clock = clock;

    this.localRates =
        Caffeine.newBuilder()
            .maximumSize(cacheProperties.getLocalMaximumSize())
            .expireAfterWrite(cacheProperties.getLocalTtl())
            .ticker(cacheTicker)
            .build();
    this.localAggregate =
        Caffeine.newBuilder()
            .maximumSize(1)
            .expireAfterWrite(cacheProperties.getLocalTtl())
            .ticker(cacheTicker)
            .build();

    this.localHitCounter =
        Counter.builder("currency.cache.local.hits")
            .description("Tier 1 cache hits")
            .register(meterRegistry);
    this.sharedHitCounter =
        Counter.builder("currency.cache.shared.hits")
            .description("Tier 2 cache hits")
            .register(meterRegistry);
    this.missCounter =
        Counter.builder("currency.cache.misses")
            .description("Lookups that missed both tiers")
            .register(meterRegistry);
  }

  public CacheLookup<CachedRate> getRate(CurrencyPair pair) {
    var local = localRates.getIfPresent(pair);
    if (local != null) {
      localHitCounter.increment();
      log.debug("Tier 1 cache hit for {}", pair);
      return CacheLookup.localHit(local);
    }

    var shared = sharedTier.get(rateKey(pair), CACHED_RATE_TYPE);
    if (shared.found()) {
      sharedHitCounter.increment();
      localRates.put(pair, shared.value());
      log.debug("Tier 2 cache hit for {}, promoted to tier 1", pair);
      return shared;
    }

    missCounter.increment();
    log.debug("Cache miss for {}", pair);
    return shared;
  }

  public void setRate(CurrencyPair pair, BigDecimal rate, Instant fetchedAt) {
    var entry = new CachedRate(rate, fetchedAt, clock.instant());
    localRates.put(pair, entry);
    sharedTier.put(rateKey(pair), entry, cacheProperties.getSharedTtl());
  }

  /** Reads the aggregate of all rates for the configured base currency. */
  public CacheLookup<Map<String, CachedRate>> getAllRates() {
    var local = localAggregate.getIfPresent(ALL_RATES_KEY);
    if (local != null) {
      localHitCounter.increment();
      return CacheLookup.localHit(local);
    }

    var shared = sharedTier.get(ALL_RATES_KEY, ALL_RATES_TYPE);
    if (shared.found()) {
      sharedHitCounter.increment();
      localAggregate.put(ALL_RATES_KEY, Map.copyOf(shared.value()));
      return shared;
    }

    missCounter.increment();
    return shared;
  }

  public void setAllRates(Map<String, BigDecimal> rates, Instant fetchedAt) {
    var cachedAt = clock.instant();
    var entries =
        rates.entrySet().stream()
            .collect(
                Collectors.toUnmodifiableMap(
                    Map.Entry::getKey, e -> new CachedRate(e.getValue(), fetchedAt, cachedAt)));

    localAggregate.put(ALL_RATES_KEY, entries);
    sharedTier.put(ALL_RATES_KEY, entries, cacheProperties.getSharedTtl());
  }

  /** Clears tier 1 and removes every rate, aggregate and supported-currency key from tier 2. */
  public void invalidateAll() {
    localRates.invalidateAll();
    localAggregate.invalidateAll();

    sharedTier.deleteByPrefix(RATE_KEY_PREFIX);
    sharedTier.delete(List.of(ALL_RATES_KEY, SUPPORTED_KEY));

    log.info("Invalidated all cached exchange rates");
  }

  /**
   * Proactively drops expired tier 1 entries. Caffeine would otherwise only evict them lazily
   * during later reads and writes.
   */
  @Scheduled(fixedDelayString = "${currency-service.cache.cleanup-interval-ms:60000}")
  public void evictExpired() {
    localRates.cleanUp();
    localAggregate.cleanUp();
    log.debug("Tier 1 sweep done, {} rate entries remaining", localRates.estimatedSize());
  }

  long localSize() {
    return localRates.estimatedSize();
  }

  static String rateKey(CurrencyPair pair) {
    return RATE_KEY_PREFIX + pair.base() + ":" + pair.target();
  }
}
