package org.tesseracthub.currency.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.tesseracthub.currency.domain.ExchangeRate;

public interface ExchangeRateRepository extends JpaRepository<ExchangeRate, UUID> {

  Optional<ExchangeRate> findByBaseCurrencyAndTargetCurrencyAndDeletedAtIsNull(
      String baseCurrency, String targetCurrency);

  /** Includes soft-deleted rows so an upsert can revive them instead of violating the key. */
  Optional<ExchangeRate> findByBaseCurrencyAndTargetCurrency(
      String baseCurrency, String targetCurrency);

  List<ExchangeRate> findByBaseCurrencyAndDeletedAtIsNullOrderByTargetCurrencyAsc(
      String baseCurrency);

  List<ExchangeRate> findByDeletedAtIsNullOrderByBaseCurrencyAscTargetCurrencyAsc();

  List<ExchangeRate> findByBaseCurrencyIn(Collection<String> baseCurrencies);

  /**
   * Soft-deletes every live rate whose provider observation is older than the given instant.
   *
   * @param olderThan exclusive upper bound on {@code fetchedAt}
   * @param deletedAt timestamp written to {@code deletedAt}
   * @return number of rows marked as deleted
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE ExchangeRate e SET e.deletedAt = :deletedAt, e.updatedAt = :deletedAt"
          + " WHERE e.fetchedAt < :olderThan AND e.deletedAt IS NULL")
  int softDeleteFetchedBefore(
      @Param("olderThan") Instant olderThan, @Param("deletedAt") Instant deletedAt);

  @Query("SELECT MAX(e.fetchedAt) FROM ExchangeRate e WHERE e.deletedAt IS NULL")
  Optional<Instant> findLatestFetchTime();
}
