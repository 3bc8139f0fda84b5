package org.tesseracthub.currency.service.exception;

import org.tesseracthub.currency.service.CurrencyServiceError;

/**
 * The provider answered, but does not quote the requested currency. Unlike {@link
 * ExchangeRateProviderException} this is terminal: retrying will not produce a rate.
 */
public class RateNotQuotedException extends CurrencyServiceException {

  public RateNotQuotedException(String message) {
    super(message, CurrencyServiceError.RATE_NOT_FOUND);
  }
}
