package org.tesseracthub.currency.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import org.tesseracthub.currency.base.AbstractRepositoryUnitTest;
import org.tesseracthub.currency.domain.CurrencyPair;
import org.tesseracthub.currency.domain.ExchangeRate;
import org.tesseracthub.currency.fixture.ExchangeRateTestBuilder;
import org.tesseracthub.currency.fixture.TestConstants;
import org.tesseracthub.currency.repository.ExchangeRateRepository;
import org.tesseracthub.currency.service.CurrencyServiceError;
import org.tesseracthub.currency.service.exception.RatePersistenceException;

/**
 * Tests for {@link JpaExchangeRateStore} against H2.
 *
 * <p>Covers upsert semantics (insert, overwrite, revive), soft-delete pruning and the queries that
 * hide pruned rows.
 */
@DisplayName("JpaExchangeRateStore Tests")
class JpaExchangeRateStoreTest extends AbstractRepositoryUnitTest {

  private static final CurrencyPair EUR_USD = CurrencyPair.of("EUR", "USD");

  @Autowired private ExchangeRateRepository exchangeRateRepository;

  @Autowired private PlatformTransactionManager transactionManager;

  @Autowired private TestEntityManager entityManager;

  private JpaExchangeRateStore store;

  @BeforeEach
  void setUp() {
    store =
        new JpaExchangeRateStore(
            exchangeRateRepository,
            transactionManager,
            Clock.fixed(TestConstants.NOW, ZoneOffset.UTC));
  }

  // ===========================================================================================
  // Upserts
  // ===========================================================================================

  @Test
  void upsertRate_NewPair_InsertsRow() {
    // Act
    store.upsertRate(EUR_USD, TestConstants.RATE_EUR_USD, TestConstants.ONE_HOUR_AGO);
    flushAndClear();

    // Assert
    var stored = store.getRate(EUR_USD);
    assertThat(stored).isPresent();
    assertThat(stored.get().getRate()).isEqualByComparingTo("1.10");
    assertThat(stored.get().getFetchedAt()).isEqualTo(TestConstants.ONE_HOUR_AGO);
    assertThat(stored.get().getCreatedAt()).isNotNull();
  }

  @Test
  void upsertRate_ExistingPair_OverwritesInPlace() {
    // Arrange
    store.upsertRate(EUR_USD, TestConstants.RATE_EUR_USD, TestConstants.ONE_HOUR_AGO);
    flushAndClear();

    // Act
    store.upsertRate(EUR_USD, new BigDecimal("1.12"), TestConstants.NOW);
    flushAndClear();

    // Assert
    assertThat(exchangeRateRepository.count()).isEqualTo(1);
    var stored = store.getRate(EUR_USD).orElseThrow();
    assertThat(stored.getRate()).isEqualByComparingTo("1.12");
    assertThat(stored.getFetchedAt()).isEqualTo(TestConstants.NOW);
  }

  @Test
  void bulkUpsertRates_MixOfNewAndExisting_WritesEveryDistinctPair() {
    // Arrange
    store.upsertRate(EUR_USD, new BigDecimal("1.05"), TestConstants.ONE_HOUR_AGO);
    flushAndClear();

    var rows =
        List.of(
            ExchangeRateTestBuilder.pair("EUR", "USD").withRate("1.10").build(),
            ExchangeRateTestBuilder.pair("USD", "EUR").withRate("0.9090909091").build(),
            ExchangeRateTestBuilder.pair("EUR", "JPY").withRate("158").build(),
            ExchangeRateTestBuilder.pair("EUR", "JPY").withRate("160").build());

    // Act
    var written = store.bulkUpsertRates(rows);
    flushAndClear();

    // Assert: duplicate EUR/JPY collapses, last value wins
    assertThat(written).isEqualTo(3);
    assertThat(exchangeRateRepository.count()).isEqualTo(3);
    assertThat(store.getRate(EUR_USD).orElseThrow().getRate()).isEqualByComparingTo("1.10");
    assertThat(store.getRate(CurrencyPair.of("EUR", "JPY")).orElseThrow().getRate())
        .isEqualByComparingTo("160");
  }

  @Test
  void bulkUpsertRates_EmptyInput_WritesNothing() {
    assertThat(store.bulkUpsertRates(List.of())).isZero();
    assertThat(exchangeRateRepository.count()).isZero();
  }

  // ===========================================================================================
  // Reads
  // ===========================================================================================

  @Test
  void getRatesForBase_ReturnsLiveRowsOrderedByTarget() {
    // Arrange
    store.bulkUpsertRates(
        List.of(
            ExchangeRateTestBuilder.pair("EUR", "USD").build(),
            ExchangeRateTestBuilder.pair("EUR", "GBP").withRate("0.85").build(),
            ExchangeRateTestBuilder.pair("EUR", "JPY").withRate("160").build(),
            ExchangeRateTestBuilder.pair("USD", "EUR").withRate("0.92").build()));
    flushAndClear();

    // Act
    var rates = store.getRatesForBase("EUR");

    // Assert
    assertThat(rates)
        .extracting(ExchangeRate::getTargetCurrency)
        .containsExactly("GBP", "JPY", "USD");
  }

  @Test
  void getAllRates_ReturnsLiveRowsOrderedByBaseThenTarget() {
    store.bulkUpsertRates(
        List.of(
            ExchangeRateTestBuilder.pair("USD", "EUR").withRate("0.92").build(),
            ExchangeRateTestBuilder.pair("EUR", "USD").build(),
            ExchangeRateTestBuilder.pair("EUR", "GBP").withRate("0.85").build()));
    flushAndClear();

    var rates = store.getAllRates();

    assertThat(rates)
        .extracting(rate -> rate.getBaseCurrency() + "/" + rate.getTargetCurrency())
        .containsExactly("EUR/GBP", "EUR/USD", "USD/EUR");
  }

  @Test
  void getLatestFetchTime_ReturnsMostRecentLiveFetch() {
    // Arrange
    store.bulkUpsertRates(
        List.of(
            ExchangeRateTestBuilder.pair("EUR", "USD")
                .withFetchedAt(TestConstants.NOW.minus(Duration.ofDays(2)))
                .build(),
            ExchangeRateTestBuilder.pair("EUR", "JPY").withFetchedAt(TestConstants.NOW).build()));
    flushAndClear();

    // Act & Assert
    assertThat(store.getLatestFetchTime()).contains(TestConstants.NOW);
  }

  @Test
  void getLatestFetchTime_EmptyStore_ReturnsEmpty() {
    assertThat(store.getLatestFetchTime()).isEmpty();
  }

  // ===========================================================================================
  // Pruning
  // ===========================================================================================

  @Test
  void deleteOldRates_SoftDeletesOnlyRowsFetchedBeforeCutoff() {
    // Arrange
    store.bulkUpsertRates(
        List.of(
            ExchangeRateTestBuilder.pair("EUR", "USD")
                .withFetchedAt(TestConstants.NOW.minus(Duration.ofDays(40)))
                .build(),
            ExchangeRateTestBuilder.pair("EUR", "JPY")
                .withRate("160")
                .withFetchedAt(TestConstants.NOW.minus(Duration.ofDays(1)))
                .build()));
    flushAndClear();

    // Act
    var pruned = store.deleteOldRates(TestConstants.NOW.minus(Duration.ofDays(30)));

    // Assert
    assertThat(pruned).isEqualTo(1);
    assertThat(store.getRate(EUR_USD)).isEmpty();
    assertThat(store.getRate(CurrencyPair.of("EUR", "JPY"))).isPresent();
    assertThat(store.getAllRates()).hasSize(1);

    var deleted =
        exchangeRateRepository.findByBaseCurrencyAndTargetCurrency("EUR", "USD").orElseThrow();
    assertThat(deleted.getDeletedAt()).isEqualTo(TestConstants.NOW);
  }

  @Test
  void upsertRate_AfterPruning_RevivesRow() {
    // Arrange
    var fetchedLongAgo = TestConstants.NOW.minus(Duration.ofDays(40));
    store.upsertRate(EUR_USD, TestConstants.RATE_EUR_USD, fetchedLongAgo);
    flushAndClear();
    store.deleteOldRates(TestConstants.NOW.minus(Duration.ofDays(30)));
    flushAndClear();

    // Act
    store.upsertRate(EUR_USD, new BigDecimal("1.11"), TestConstants.NOW);
    flushAndClear();

    // Assert
    assertThat(exchangeRateRepository.count()).isEqualTo(1);
    var revived = store.getRate(EUR_USD).orElseThrow();
    assertThat(revived.isDeleted()).isFalse();
    assertThat(revived.getRate()).isEqualByComparingTo("1.11");
  }

  // ===========================================================================================
  // Failures
  // ===========================================================================================

  @Test
  void getRate_WhenDatabaseFails_ThrowsRatePersistenceException() {
    // Arrange
    var failingRepository = mock(ExchangeRateRepository.class);
    when(failingRepository.findByBaseCurrencyAndTargetCurrencyAndDeletedAtIsNull("EUR", "USD"))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));
    var failingStore =
        new JpaExchangeRateStore(
            failingRepository, transactionManager, Clock.fixed(TestConstants.NOW, ZoneOffset.UTC));

    // Act & Assert
    assertThatThrownBy(() -> failingStore.getRate(EUR_USD))
        .isInstanceOf(RatePersistenceException.class)
        .hasMessageContaining("getRate EUR/USD")
        .hasMessageContaining("connection refused")
        .extracting(e -> ((RatePersistenceException) e).getError())
        .isEqualTo(CurrencyServiceError.PERSISTENCE_FAILURE);
  }

  private void flushAndClear() {
    entityManager.flush();
    entityManager.clear();
  }
}
