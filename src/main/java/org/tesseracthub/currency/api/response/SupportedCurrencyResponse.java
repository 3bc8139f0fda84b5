package org.tesseracthub.currency.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.tesseracthub.currency.service.dto.SupportedCurrency;

@Schema(description = "Currency offered by the rate provider")
public record SupportedCurrencyResponse(
    @Schema(
            description = "ISO 4217 currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "JPY")
        String code,
    @Schema(
            description = "Display name reported by the provider",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Japanese Yen")
        String name,
    @Schema(
            description = "Currency symbol, or the code itself when unknown",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "¥")
        String symbol,
    @Schema(
            description = "Number of minor unit digits",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "0")
        int decimalPlaces) {

  public static SupportedCurrencyResponse from(SupportedCurrency currency) {
    return new SupportedCurrencyResponse(
        currency.code(), currency.name(), currency.symbol(), currency.decimalPlaces());
  }
}
