package org.tesseracthub.currency.service.dto;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Outcome of one refresh cycle.
 *
 * @param baseCurrency currency the provider quoted against
 * @param providerDate quote date reported by the provider
 * @param ratesStored forward plus inverse rows written to the store
 * @param fetchedAt time the provider table was fetched
 */
public record RateRefreshResult(
    String baseCurrency, LocalDate providerDate, int ratesStored, Instant fetchedAt) {}
