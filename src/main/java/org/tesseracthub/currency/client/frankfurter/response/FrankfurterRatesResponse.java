package org.tesseracthub.currency.client.frankfurter.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Rate table returned by the Frankfurter {@code /latest}, {@code /{date}} and conversion
 * endpoints.
 *
 * <p>For conversions {@code rates} holds the converted amount per target, which equals the rate
 * when {@code amount} is 1.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FrankfurterRatesResponse(
    BigDecimal amount, String base, LocalDate date, Map<String, BigDecimal> rates) {}
