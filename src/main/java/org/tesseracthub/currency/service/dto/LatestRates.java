package org.tesseracthub.currency.service.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rate table quoted against a single base currency.
 *
 * @param base base currency code
 * @param date provider quote date
 * @param rates target currency code to rate (one unit of base in target), sorted by code
 */
public record LatestRates(String base, LocalDate date, Map<String, BigDecimal> rates) {

  public LatestRates {
    rates = rates == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(rates));
  }
}
