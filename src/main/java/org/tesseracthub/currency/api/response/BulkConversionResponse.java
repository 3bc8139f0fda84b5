package org.tesseracthub.currency.api.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;

import org.tesseracthub.currency.service.dto.BulkConversion;
import org.tesseracthub.currency.service.dto.BulkConvertResult;

@Schema(description = "Result of a bulk conversion")
public record BulkConversionResponse(
    @Schema(description = "Per-item results, in request order") List<Item> results,
    @Schema(description = "Target currency", example = "GBP") String to,
    @Schema(description = "Sum of all converted amounts", example = "129.40") BigDecimal total,
    @Schema(description = "Date of the most recent stored rate", example = "2025-11-03")
        LocalDate date) {

  public record Item(
      @Schema(description = "Amount in the source currency", example = "100") BigDecimal amount,
      @Schema(description = "Source currency", example = "USD") String from,
      @Schema(description = "Amount in the target currency", example = "79.20") BigDecimal result,
      @Schema(description = "Rate applied", example = "0.792") BigDecimal rate) {

    static Item from(BulkConvertResult result) {
      return new Item(
          result.originalAmount(), result.fromCurrency(), result.convertedAmount(), result.rate());
    }
  }

  public static BulkConversionResponse from(BulkConversion conversion) {
    return new BulkConversionResponse(
        conversion.results().stream().map(Item::from).toList(),
        conversion.targetCurrency(),
        conversion.totalAmount(),
        conversion.rateDate());
  }
}
