package org.tesseracthub.currency.service.exception;

import org.tesseracthub.currency.service.CurrencyServiceError;

public class RatePersistenceException extends CurrencyServiceException {

  public RatePersistenceException(String operation, Throwable cause) {
    super(
        "Exchange rate store failed during " + operation + ": " + cause.getMessage(),
        CurrencyServiceError.PERSISTENCE_FAILURE,
        cause);
  }
}
