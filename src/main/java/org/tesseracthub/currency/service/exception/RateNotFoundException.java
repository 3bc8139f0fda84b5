package org.tesseracthub.currency.service.exception;

import org.tesseracthub.currency.domain.CurrencyPair;
import org.tesseracthub.currency.service.CurrencyServiceError;

/** Raised when a rate cannot be resolved after cache, store, cross rate and provider lookups. */
public class RateNotFoundException extends CurrencyServiceException {

  private final CurrencyPair pair;

  public RateNotFoundException(CurrencyPair pair) {
    super("No exchange rate available for " + pair, CurrencyServiceError.RATE_NOT_FOUND);
    this.pair = pair;
  }

  public RateNotFoundException(CurrencyPair pair, Throwable cause) {
    super(
        "No exchange rate available for " + pair + ": " + cause.getMessage(),
        CurrencyServiceError.RATE_NOT_FOUND,
        cause);
    this.pair = pair;
  }

  public CurrencyPair getPair() {
    return pair;
  }
}
