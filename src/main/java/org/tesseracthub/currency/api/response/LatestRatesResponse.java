package org.tesseracthub.currency.api.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;

import org.tesseracthub.currency.service.dto.LatestRates;

@Schema(description = "Rates quoted against one base currency")
public record LatestRatesResponse(
    @Schema(
            description = "Base currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        String base,
    @Schema(
            description = "Quote date",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-11-03")
        LocalDate date,
    @Schema(
            description = "Target currency code to rate, sorted by code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "{\"GBP\": 0.8765, \"USD\": 1.1012}")
        Map<String, BigDecimal> rates) {

  public static LatestRatesResponse from(LatestRates latestRates) {
    return new LatestRatesResponse(latestRates.base(), latestRates.date(), latestRates.rates());
  }
}
