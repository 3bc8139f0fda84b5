package org.tesseracthub.currency.service.exception;

import org.tesseracthub.currency.service.CurrencyServiceError;

/** Transport, HTTP or decoding failure from the external exchange rate provider. */
public class ExchangeRateProviderException extends CurrencyServiceException {

  public ExchangeRateProviderException(String message) {
    super(message, CurrencyServiceError.PROVIDER_UNAVAILABLE);
  }

  public ExchangeRateProviderException(String message, Throwable cause) {
    super(message, CurrencyServiceError.PROVIDER_UNAVAILABLE, cause);
  }
}
