package org.tesseracthub.currency.api.request;

import java.math.BigDecimal;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

import org.tesseracthub.currency.service.dto.BulkConvertItem;

@Schema(description = "Request to convert several amounts into one target currency")
public record BulkConvertRequest(
    @Schema(description = "Amounts to convert", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotEmpty(message = "At least one item is required")
        @Size(max = 1000, message = "At most 1000 items can be converted at once")
        List<@Valid @NotNull Item> items,
    @Schema(
            description = "ISO 4217 code of the target currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "GBP")
        @NotBlank(message = "Target currency is required")
        String to) {

  @Schema(description = "Single amount in a source currency")
  public record Item(
      @Schema(
              description = "Amount in the source currency",
              requiredMode = Schema.RequiredMode.REQUIRED,
              example = "100.00")
          @NotNull(message = "Amount is required")
          BigDecimal amount,
      @Schema(
              description = "ISO 4217 code of the source currency",
              requiredMode = Schema.RequiredMode.REQUIRED,
              example = "USD")
          @NotBlank(message = "Source currency is required")
          String from) {

    public BulkConvertItem toItem() {
      return new BulkConvertItem(amount, from);
    }
  }

  public List<BulkConvertItem> toItems() {
    return items.stream().map(Item::toItem).toList();
  }
}
