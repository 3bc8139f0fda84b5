package org.tesseracthub.currency.service.impl;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import org.tesseracthub.currency.domain.CurrencyPair;
import org.tesseracthub.currency.domain.ExchangeRate;
import org.tesseracthub.currency.repository.ExchangeRateRepository;
import org.tesseracthub.currency.service.ExchangeRateStore;
import org.tesseracthub.currency.service.exception.RatePersistenceException;

/**
 * {@link ExchangeRateStore} over Spring Data JPA.
 *
 * <p>Upserts look up the existing row for the pair (soft-deleted rows included, since the unique
 * constraint still covers them) and update it in place; otherwise a new row is inserted. Bulk
 * writes run inside one {@link TransactionTemplate} transaction and are sent in JDBC batches
 * ({@code hibernate.jdbc.batch_size}).
 */
@Service
public class JpaExchangeRateStore implements ExchangeRateStore {

  private static final Logger log = LoggerFactory.getLogger(JpaExchangeRateStore.class);

  private final ExchangeRateRepository exchangeRateRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public JpaExchangeRateStore(
      ExchangeRateRepository exchangeRateRepository,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.exchangeRateRepository = exchangeRateRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  @Override
  public Optional<ExchangeRate> getRate(CurrencyPair pair) {
    return read(
        "getRate " + pair,
        () ->
            exchangeRateRepository.findByBaseCurrencyAndTargetCurrencyAndDeletedAtIsNull(
                pair.base(), pair.target()));
  }

  @Override
  public List<ExchangeRate> getRatesForBase(String base) {
    return read(
        "getRatesForBase " + base,
        () ->
            exchangeRateRepository.findByBaseCurrencyAndDeletedAtIsNullOrderByTargetCurrencyAsc(
                base));
  }

  @Override
  public List<ExchangeRate> getAllRates() {
    return read(
        "getAllRates",
        exchangeRateRepository::findByDeletedAtIsNullOrderByBaseCurrencyAscTargetCurrencyAsc);
  }

  @Override
  public void upsertRate(CurrencyPair pair, BigDecimal rate, Instant fetchedAt) {
    write(
        "upsertRate " + pair,
        () -> {
          var existing =
              exchangeRateRepository.findByBaseCurrencyAndTargetCurrency(
                  pair.base(), pair.target());

          if (existing.isPresent()) {
            exchangeRateRepository.save(overwrite(existing.get(), rate, fetchedAt));
          } else {
            exchangeRateRepository.save(
                new ExchangeRate(pair.base(), pair.target(), rate, fetchedAt));
          }
          return null;
        });
  }

  @Override
  public int bulkUpsertRates(List<ExchangeRate> rates) {
    if (rates.isEmpty()) {
      return 0;
    }

    return write(
        "bulkUpsertRates",
        () -> {
          var incoming = new LinkedHashMap<CurrencyPair, ExchangeRate>();
          rates.forEach(rate -> incoming.put(rate.getPair(), rate));

          var bases =
              incoming.keySet().stream().map(CurrencyPair::base).collect(Collectors.toSet());
          var existingByPair =
              exchangeRateRepository.findByBaseCurrencyIn(bases).stream()
                  .collect(Collectors.toMap(ExchangeRate::getPair, Function.identity()));

          var toSave = new ArrayList<ExchangeRate>(incoming.size());
          var newCount = 0;
          var updatedCount = 0;

          for (var entry : incoming.entrySet()) {
            var rate = entry.getValue();
            var existing = existingByPair.get(entry.getKey());

            if (existing == null) {
              toSave.add(
                  new ExchangeRate(
                      rate.getBaseCurrency(),
                      rate.getTargetCurrency(),
                      rate.getRate(),
                      rate.getFetchedAt()));
              newCount++;
            } else {
              toSave.add(overwrite(existing, rate.getRate(), rate.getFetchedAt()));
              updatedCount++;
            }
          }

          exchangeRateRepository.saveAll(toSave);

          log.info(
              "Bulk upsert of exchange rates - new: {}, updated: {}, total: {}",
              newCount,
              updatedCount,
              toSave.size());
          return toSave.size();
        });
  }

  @Override
  public int deleteOldRates(Instant olderThan) {
    var deleted =
        write(
            "deleteOldRates",
            () -> exchangeRateRepository.softDeleteFetchedBefore(olderThan, clock.instant()));
    log.debug("Soft-deleted {} exchange rates fetched before {}", deleted, olderThan);
    return deleted;
  }

  @Override
  public Optional<Instant> getLatestFetchTime() {
    return read("getLatestFetchTime", exchangeRateRepository::findLatestFetchTime);
  }

  private ExchangeRate overwrite(ExchangeRate existing, BigDecimal rate, Instant fetchedAt) {
    if (existing.isDeleted()) {
      log.debug("Reviving pruned exchange rate {}", existing.getPair());
    }
    existing.setRate(rate);
    existing.setFetchedAt(fetchedAt);
    existing.setDeletedAt(null);
    return existing;
  }

  private <T> T read(String operation, Supplier<T> query) {
    try {
      return query.get();
    } catch (DataAccessException e) {
      throw new RatePersistenceException(operation, e);
    }
  }

  private <T> T write(String operation, Supplier<T> work) {
    try {
      return transactionTemplate.execute(status -> work.get());
    } catch (DataAccessException | TransactionException e) {
      throw new RatePersistenceException(operation, e);
    }
  }
}
