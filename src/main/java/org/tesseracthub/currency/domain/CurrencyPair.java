package org.tesseracthub.currency.domain;

import java.util.Locale;
import java.util.regex.Pattern;

import org.tesseracthub.currency.service.exception.InvalidCurrencyCodeException;

/**
 * Ordered pair of ISO 4217 style currency codes, used as the key for rates in the store and in
 * both cache tiers.
 *
 * <p>Codes are normalized to uppercase on construction; anything that is not exactly three ASCII
 * letters is rejected with {@link InvalidCurrencyCodeException}.
 */
public record CurrencyPair(String base, String target) {

  private static final Pattern CODE_PATTERN = Pattern.compile("[A-Z]{3}");

  public CurrencyPair {
    base = normalize(base);
    target = normalize(target);
  }

  public static CurrencyPair of(String base, String target) {
    return new CurrencyPair(base, target);
  }

  /**
   * Normalizes a currency code to uppercase and validates its shape.
   *
   * @param code raw currency code, possibly lowercase or padded with whitespace
   * @return the uppercase three-letter code
   * @throws InvalidCurrencyCodeException if the code is null or not three letters
   */
  public static String normalize(String code) {
    if (code == null) {
      throw new InvalidCurrencyCodeException(null);
    }

    var normalized = code.trim().toUpperCase(Locale.ROOT);
    if (!CODE_PATTERN.matcher(normalized).matches()) {
      throw new InvalidCurrencyCodeException(code);
    }
    return normalized;
  }

  public boolean isIdentity() {
    return base.equals(target);
  }

  public CurrencyPair inverse() {
    return new CurrencyPair(target, base);
  }

  @Override
  public String toString() {
    return base + "/" + target;
  }
}
