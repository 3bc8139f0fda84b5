package org.tesseracthub.currency.service.dto;

import java.util.Currency;
import java.util.Locale;

/** Currency offered by the provider, enriched with display metadata from the ISO 4217 table. */
public record SupportedCurrency(String code, String name, String symbol, int decimalPlaces) {

  private static final int DEFAULT_DECIMAL_PLACES = 2;

  /**
   * Builds a supported currency, looking up symbol and minor units in {@link Currency}.
   *
   * <p>Codes the JDK does not know keep the code itself as symbol and two decimal places.
   */
  public static SupportedCurrency of(String code, String name) {
    try {
      var currency = Currency.getInstance(code);
      var fractionDigits = currency.getDefaultFractionDigits();
      return new SupportedCurrency(
          code,
          name,
          currency.getSymbol(Locale.ENGLISH),
          fractionDigits < 0 ? DEFAULT_DECIMAL_PLACES : fractionDigits);
    } catch (IllegalArgumentException e) {
      return new SupportedCurrency(code, name, code, DEFAULT_DECIMAL_PLACES);
    }
  }
}
