package org.tesseracthub.currency.cache;

import java.time.Duration;
import java.util.Collection;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Shared remote cache tier (tier 2).
 *
 * <p>Implementations never throw: failures are logged and reported as {@link
 * CacheLookup.Outcome#ERROR} on reads and ignored on writes.
 */
public interface SharedCacheTier {

  /**
   * Reads a value.
   *
   * @return {@code SHARED_HIT} with the value, {@code MISS}, or {@code ERROR} if the tier failed
   */
  <T> CacheLookup<T> get(String key, TypeReference<T> type);

  void put(String key, Object value, Duration ttl);

  void delete(Collection<String> keys);

  /** Deletes every key starting with the given prefix. */
  void deleteByPrefix(String prefix);
}
