package org.tesseracthub.currency.service;

/** Error codes for currency service exceptions. */
public enum CurrencyServiceError {
  /** Currency code is not three ASCII letters. */
  INVALID_CURRENCY_CODE,

  /** No direct, cross, inverse or provider rate could be resolved for a pair. */
  RATE_NOT_FOUND,

  /** The external exchange rate provider failed or returned an unreadable response. */
  PROVIDER_UNAVAILABLE,

  /** The rate store could not be read or written. */
  PERSISTENCE_FAILURE,
}
