package org.tesseracthub.currency.api.response;

import java.math.BigDecimal;
import java.time.LocalDate;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Exchange rate for a single currency pair")
public record RateResponse(
    @Schema(
            description = "Base currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        String from,
    @Schema(
            description = "Target currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "JPY")
        String to,
    @Schema(
            description = "One unit of the base currency expressed in the target currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "160.25")
        BigDecimal rate,
    @Schema(
            description = "Date of the most recent stored rate",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2025-11-03")
        LocalDate date) {}
