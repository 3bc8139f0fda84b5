package org.tesseracthub.currency.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.tesseracthub.currency.domain.CurrencyPair;
import org.tesseracthub.currency.domain.ExchangeRate;

/**
 * Durable store of the latest rate per currency pair. The store is the source of truth; both
 * cache tiers are derived from it.
 *
 * <p>All methods throw {@link org.tesseracthub.currency.service.exception.RatePersistenceException}
 * on data access failures. Soft-deleted rows are invisible to every read.
 */
public interface ExchangeRateStore {

  Optional<ExchangeRate> getRate(CurrencyPair pair);

  /** Live rates quoted against {@code base}, ordered by target currency. */
  List<ExchangeRate> getRatesForBase(String base);

  List<ExchangeRate> getAllRates();

  /** Inserts or overwrites the rate for one pair, reviving it if it had been pruned. */
  void upsertRate(CurrencyPair pair, BigDecimal rate, Instant fetchedAt);

  /**
   * Inserts or overwrites a set of rates in a single transaction. Either every row is written or
   * none is. When the input holds the same pair twice the last one wins.
   *
   * @return number of distinct pairs written
   */
  int bulkUpsertRates(List<ExchangeRate> rates);

  /**
   * Soft-deletes rates whose provider observation is older than {@code olderThan}.
   *
   * @return number of rows pruned
   */
  int deleteOldRates(Instant olderThan);

  /** Most recent {@code fetchedAt} across all live rows, empty when the store has none. */
  Optional<Instant> getLatestFetchTime();
}
