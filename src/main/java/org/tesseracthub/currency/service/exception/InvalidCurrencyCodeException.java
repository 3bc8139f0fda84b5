package org.tesseracthub.currency.service.exception;

import org.tesseracthub.currency.service.CurrencyServiceError;

public class InvalidCurrencyCodeException extends CurrencyServiceException {

  public InvalidCurrencyCodeException(String code) {
    super(
        "Invalid currency code: '" + code + "' (expected 3 letters)",
        CurrencyServiceError.INVALID_CURRENCY_CODE);
  }
}
