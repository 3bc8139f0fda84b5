package org.tesseracthub.currency.api;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.tesseracthub.currency.api.error.ApiErrorResponse;
import org.tesseracthub.currency.api.request.BulkConvertRequest;
import org.tesseracthub.currency.api.response.BulkConversionResponse;
import org.tesseracthub.currency.api.response.ConversionResponse;
import org.tesseracthub.currency.api.response.LatestRatesResponse;
import org.tesseracthub.currency.api.response.RateResponse;
import org.tesseracthub.currency.api.response.SupportedCurrencyResponse;
import org.tesseracthub.currency.domain.CurrencyPair;
import org.tesseracthub.currency.service.CurrencyConversionService;

@Tag(name = "Currency Handler", description = "Endpoints for converting amounts and querying rates")
@RestController
@RequestMapping(path = "/v1/currency")
public class CurrencyController {

  private static final Logger log = LoggerFactory.getLogger(CurrencyController.class);

  private final CurrencyConversionService conversionService;

  public CurrencyController(CurrencyConversionService conversionService) {
    this.conversionService = conversionService;
  }

  @Operation(
      summary = "Convert an amount",
      description = "Convert an amount between two currencies")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ConversionResponse.class))),
        @ApiResponse(
            responseCode = "422",
            description = "No rate could be resolved for the pair",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples =
                        @ExampleObject(
                            name = "Rate Not Found",
                            value =
                                """
                                {
                                  "type": "APPLICATION_ERROR",
                                  "message": "No exchange rate available for USD/XYZ",
                                  "code": "RATE_NOT_FOUND"
                                }
                                """)))
      })
  @GetMapping(path = "/convert", produces = "application/json")
  public ConversionResponse convert(
      @Parameter(description = "Amount in the source currency", example = "100")
          @RequestParam
          BigDecimal amount,
      @Parameter(description = "Source currency", example = "USD") @RequestParam String from,
      @Parameter(description = "Target currency", example = "EUR") @RequestParam String to) {
    var pair = CurrencyPair.of(from, to);
    log.info("Received convert request - amount: {}, pair: {}", amount, pair);

    var rate = conversionService.getRate(pair);
    var result = amount.multiply(rate);

    return new ConversionResponse(
        pair.base(), pair.target(), amount, result, rate, conversionService.getRateDate());
  }

  @Operation(
      summary = "Convert several amounts",
      description =
          "Convert amounts in any source currencies into one target currency. Fails as a whole"
              + " when any item cannot be converted")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = BulkConversionResponse.class))),
        @ApiResponse(
            responseCode = "422",
            description = "No rate could be resolved for one of the items",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @PostMapping(path = "/bulk-convert", consumes = "application/json", produces = "application/json")
  public BulkConversionResponse bulkConvert(@Valid @RequestBody BulkConvertRequest request) {
    log.info(
        "Received bulkConvert request - items: {}, to: {}", request.items().size(), request.to());

    var conversion = conversionService.bulkConvert(request.toItems(), request.to());
    return BulkConversionResponse.from(conversion);
  }

  @Operation(
      summary = "Get latest rates",
      description =
          "Get the latest rates quoted against a base currency, optionally restricted to some"
              + " target currencies")
  @GetMapping(path = "/rates", produces = "application/json")
  public LatestRatesResponse getRates(
      @Parameter(description = "Base currency, defaults to the service base", example = "EUR")
          @RequestParam
          Optional<String> base,
      @Parameter(description = "Comma separated target currencies", example = "USD,GBP")
          @RequestParam(required = false)
          List<String> symbols) {
    var resolvedBase = base.orElse(conversionService.getBaseCurrency());
    log.info("Received getRates request - base: {}, symbols: {}", resolvedBase, symbols);

    var rates =
        conversionService.getAllRates(resolvedBase, symbols == null ? List.of() : symbols);
    return LatestRatesResponse.from(rates);
  }

  @Operation(
      summary = "Get historical rates",
      description = "Get the provider's rates for a past date. Not cached")
  @GetMapping(path = "/rates/historical", produces = "application/json")
  public LatestRatesResponse getHistoricalRates(
      @Parameter(description = "Quote date in ISO format", example = "2024-01-02")
          @RequestParam
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate date,
      @Parameter(description = "Base currency, defaults to the service base", example = "EUR")
          @RequestParam
          Optional<String> base) {
    var resolvedBase = base.orElse(conversionService.getBaseCurrency());
    log.info("Received getHistoricalRates request - date: {}, base: {}", date, resolvedBase);

    return LatestRatesResponse.from(conversionService.getHistoricalRates(date, resolvedBase));
  }

  @Operation(summary = "Get a single rate", description = "Get the rate for one currency pair")
  @GetMapping(path = "/rate", produces = "application/json")
  public RateResponse getRate(
      @Parameter(description = "Base currency", example = "EUR") @RequestParam String from,
      @Parameter(description = "Target currency", example = "JPY") @RequestParam String to) {
    var pair = CurrencyPair.of(from, to);
    log.info("Received getRate request - pair: {}", pair);

    var rate = conversionService.getRate(pair);
    return new RateResponse(pair.base(), pair.target(), rate, conversionService.getRateDate());
  }

  @Operation(
      summary = "Get supported currencies",
      description = "Currencies the rate provider quotes, sorted by code")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(
                            schema = @Schema(implementation = SupportedCurrencyResponse.class))))
      })
  @GetMapping(path = "/supported", produces = "application/json")
  public List<SupportedCurrencyResponse> getSupportedCurrencies() {
    log.info("Received getSupportedCurrencies request");

    return conversionService.getSupportedCurrencies().stream()
        .map(SupportedCurrencyResponse::from)
        .toList();
  }
}
