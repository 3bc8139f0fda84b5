package org.tesseracthub.currency.api.response;

import java.math.BigDecimal;
import java.time.LocalDate;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of converting one amount")
public record ConversionResponse(
    @Schema(description = "Source currency", example = "USD") String from,
    @Schema(description = "Target currency", example = "EUR") String to,
    @Schema(description = "Amount in the source currency", example = "100") BigDecimal amount,
    @Schema(description = "Amount in the target currency", example = "90.9090909100")
        BigDecimal result,
    @Schema(description = "Rate applied, one unit of source in target", example = "0.9090909091")
        BigDecimal rate,
    @Schema(description = "Date of the most recent stored rate", example = "2025-11-03")
        LocalDate date) {}
