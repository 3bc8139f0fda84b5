package org.tesseracthub.currency.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotNull;

/**
 * Latest known exchange rate for one (base, target) currency pair.
 *
 * <p>There is at most one row per pair. Refreshes and provider fetches overwrite the row in place
 * rather than appending history, so the table always holds the current rate table for every pair
 * that has been observed.
 *
 * <p><b>Lifecycle:</b>
 *
 * <ul>
 *   <li>Written by the bulk refresh (forward and inverse rows for every quoted currency)
 *   <li>Written lazily when a single pair had to be fetched from the provider
 *   <li>Soft-deleted ({@code deletedAt} set) by the retention job once {@code fetchedAt} is older
 *       than the retention window; the next upsert for the pair revives the row
 * </ul>
 *
 * <p>Readers never modify rows. The rate is stored with ten decimal places, which keeps inverse
 * rates of strong currencies (JPY/EUR = 0.00625) exact enough for conversion.
 */
@Entity
@Table(
    name = "exchange_rates",
    uniqueConstraints =
        @UniqueConstraint(
            name = "exchange_rates_unique_pair",
            columnNames = {"base_currency", "target_currency"}))
public class ExchangeRate extends AuditableEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @NotNull
  @Column(name = "base_currency", length = 3, nullable = false)
  private String baseCurrency;

  @NotNull
  @Column(name = "target_currency", length = 3, nullable = false)
  private String targetCurrency;

  @NotNull
  @Column(precision = 20, scale = 10, nullable = false)
  private BigDecimal rate;

  /** Time the provider observation was fetched, not the time the row was written. */
  @NotNull
  @Column(name = "fetched_at", nullable = false)
  private Instant fetchedAt;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  public ExchangeRate() {}

  public ExchangeRate(
      String baseCurrency, String targetCurrency, BigDecimal rate, Instant fetchedAt) {
    this.baseCurrency = baseCurrency;
    this.targetCurrency = targetCurrency;
    this.rate = rate;
    this.fetchedAt = fetchedAt;
  }

  public CurrencyPair getPair() {
    return CurrencyPair.of(baseCurrency, targetCurrency);
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  public UUID getId() {
    return id;
  }

  public void setId(UUID id) {
    this.id = id;
  }

  public String getBaseCurrency() {
    return baseCurrency;
  }

  public void setBaseCurrency(String baseCurrency) {
    this.baseCurrency = baseCurrency;
  }

  public String getTargetCurrency() {
    return targetCurrency;
  }

  public void setTargetCurrency(String targetCurrency) {
    this.targetCurrency = targetCurrency;
  }

  public BigDecimal getRate() {
    return rate;
  }

  public void setRate(BigDecimal rate) {
    this.rate = rate;
  }

  public Instant getFetchedAt() {
    return fetchedAt;
  }

  public void setFetchedAt(Instant fetchedAt) {
    this.fetchedAt = fetchedAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public void setDeletedAt(Instant deletedAt) {
    this.deletedAt = deletedAt;
  }
}
