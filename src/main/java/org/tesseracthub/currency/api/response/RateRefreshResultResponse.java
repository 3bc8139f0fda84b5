package org.tesseracthub.currency.api.response;

import java.time.Instant;
import java.time.LocalDate;

import io.swagger.v3.oas.annotations.media.Schema;

import org.tesseracthub.currency.service.dto.RateRefreshResult;

@Schema(description = "Outcome of a forced rate refresh")
public record RateRefreshResultResponse(
    @Schema(
            description = "Currency the provider quoted against",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        String baseCurrency,
    @Schema(
            description = "Quote date reported by the provider",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-11-03")
        LocalDate providerDate,
    @Schema(
            description = "Forward and inverse rates written to the store",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "60")
        int ratesStored,
    @Schema(
            description = "Time the rate table was fetched",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-11-03T15:30:00Z")
        Instant fetchedAt) {

  public static RateRefreshResultResponse from(RateRefreshResult result) {
    return new RateRefreshResultResponse(
        result.baseCurrency(), result.providerDate(), result.ratesStored(), result.fetchedAt());
  }
}
