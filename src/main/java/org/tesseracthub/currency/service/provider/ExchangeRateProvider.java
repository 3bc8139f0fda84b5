package org.tesseracthub.currency.service.provider;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

import org.tesseracthub.currency.service.dto.LatestRates;
import org.tesseracthub.currency.service.dto.SupportedCurrency;
import org.tesseracthub.currency.service.exception.ExchangeRateProviderException;
import org.tesseracthub.currency.service.exception.RateNotQuotedException;

/**
 * Source of exchange rates.
 *
 * <p>Implementations are stateless request/response wrappers. A currency the provider does not
 * quote is thrown as {@link RateNotQuotedException}; any other failure as {@link
 * ExchangeRateProviderException}. Retrying is the caller's concern.
 */
public interface ExchangeRateProvider {

  /** Full latest rate table quoted against {@code base}. */
  LatestRates getLatestRates(String base);

  /** Latest rates for {@code base} restricted to the given targets. */
  LatestRates getLatestRatesForCurrencies(String base, Collection<String> targets);

  /** Currencies the provider quotes; symbol and decimal places are filled from ISO 4217 data. */
  List<SupportedCurrency> getSupportedCurrencies();

  /**
   * Converts an amount at the provider's latest rate.
   *
   * @return rate table for {@code from} whose single entry is the converted amount in {@code to}
   */
  LatestRates convert(BigDecimal amount, String from, String to);

  LatestRates getHistoricalRates(LocalDate date, String base);
}
