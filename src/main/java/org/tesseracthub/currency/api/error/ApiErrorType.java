package org.tesseracthub.currency.api.error;

/** Coarse category of an error returned by the HTTP API. */
public enum ApiErrorType {
  /** Malformed request: bad currency code, missing parameter, unreadable body. */
  INVALID_REQUEST,

  /** Request body failed bean validation. */
  VALIDATION_ERROR,

  /** Request was well formed but could not be satisfied, for example no rate exists. */
  APPLICATION_ERROR,

  /** A downstream dependency (provider or store) is failing. */
  SERVICE_UNAVAILABLE,

  INTERNAL_ERROR,
}
