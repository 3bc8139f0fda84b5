package org.tesseracthub.currency.cache;

import java.time.Duration;
import java.util.Collection;

import com.fasterxml.jackson.core.type.TypeReference;

/** Tier 2 used when Redis caching is switched off: every read misses, writes do nothing. */
public class DisabledSharedCacheTier implements SharedCacheTier {

  @Override
  public <T> CacheLookup<T> get(String key, TypeReference<T> type) {
    return CacheLookup.miss();
  }

  @Override
  public void put(String key, Object value, Duration ttl) {}

  @Override
  public void delete(Collection<String> keys) {}

  @Override
  public void deleteByPrefix(String prefix) {}
}
