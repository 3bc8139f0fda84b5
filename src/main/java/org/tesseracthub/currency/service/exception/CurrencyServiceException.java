package org.tesseracthub.currency.service.exception;

import org.tesseracthub.currency.service.CurrencyServiceError;

/** Base class for all errors raised by the currency service, each tagged with an error code. */
public abstract class CurrencyServiceException extends RuntimeException {

  private final CurrencyServiceError error;

  protected CurrencyServiceException(String message, CurrencyServiceError error) {
    super(message);
    this.error = error;
  }

  protected CurrencyServiceException(String message, CurrencyServiceError error, Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  public CurrencyServiceError getError() {
    return error;
  }

  public String getCode() {
    return error.name();
  }
}
