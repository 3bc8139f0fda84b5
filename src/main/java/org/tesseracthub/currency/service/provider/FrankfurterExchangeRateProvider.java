package org.tesseracthub.currency.service.provider;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.tesseracthub.currency.client.frankfurter.FrankfurterClient;
import org.tesseracthub.currency.client.frankfurter.response.FrankfurterRatesResponse;
import org.tesseracthub.currency.service.dto.LatestRates;
import org.tesseracthub.currency.service.dto.SupportedCurrency;

/**
 * Frankfurter implementation of ExchangeRateProvider.
 *
 * <p>Frankfurter publishes the European Central Bank reference rates, natively quoted against EUR.
 * Other bases are rebased by Frankfurter itself.
 */
@Service
public class FrankfurterExchangeRateProvider implements ExchangeRateProvider {

  private static final Logger log = LoggerFactory.getLogger(FrankfurterExchangeRateProvider.class);

  private final FrankfurterClient frankfurterClient;

  public FrankfurterExchangeRateProvider(FrankfurterClient frankfurterClient) {
    this.frankfurterClient = frankfurterClient;
  }

  @Override
  public LatestRates getLatestRates(String base) {
    log.info("Fetching latest exchange rates from Frankfurter - base: {}", base);
    return toLatestRates(frankfurterClient.getLatestRates(base), base);
  }

  @Override
  public LatestRates getLatestRatesForCurrencies(String base, Collection<String> targets) {
    if (targets == null || targets.isEmpty()) {
      return getLatestRates(base);
    }

    log.info(
        "Fetching latest exchange rates from Frankfurter - base: {}, targets: {}", base, targets);
    return toLatestRates(frankfurterClient.getLatestRates(base, targets), base);
  }

  @Override
  public List<SupportedCurrency> getSupportedCurrencies() {
    return frankfurterClient.getCurrencies().entrySet().stream()
        .map(entry -> SupportedCurrency.of(entry.getKey(), entry.getValue()))
        .sorted(Comparator.comparing(SupportedCurrency::code))
        .toList();
  }

  @Override
  public LatestRates convert(BigDecimal amount, String from, String to) {
    log.info("Fetching conversion from Frankfurter - {} {} -> {}", amount, from, to);
    return toLatestRates(frankfurterClient.convert(amount, from, to), from);
  }

  @Override
  public LatestRates getHistoricalRates(LocalDate date, String base) {
    log.info(
        "Fetching historical exchange rates from Frankfurter - base: {}, date: {}", base, date);
    return toLatestRates(frankfurterClient.getHistoricalRates(date, base), base);
  }

  private LatestRates toLatestRates(FrankfurterRatesResponse response, String requestedBase) {
    var base = response.base() != null ? response.base() : requestedBase;
    return new LatestRates(base, response.date(), response.rates());
  }
}
