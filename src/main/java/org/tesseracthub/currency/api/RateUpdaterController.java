package org.tesseracthub.currency.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.tesseracthub.currency.api.response.RateRefreshResultResponse;
import org.tesseracthub.currency.api.response.UpdaterStatusResponse;
import org.tesseracthub.currency.scheduler.ExchangeRateUpdater;

/** Operational endpoints for the background rate updater. */
@Tag(
    name = "Rate Updater Handler",
    description = "Endpoints for forcing a rate refresh and inspecting the updater")
@RestController
@RequestMapping(path = "/v1/currency")
public class RateUpdaterController {

  private static final Logger log = LoggerFactory.getLogger(RateUpdaterController.class);

  private final ExchangeRateUpdater exchangeRateUpdater;

  public RateUpdaterController(ExchangeRateUpdater exchangeRateUpdater) {
    this.exchangeRateUpdater = exchangeRateUpdater;
  }

  @Operation(
      summary = "Refresh rates now",
      description =
          "Fetch the latest rate table from the provider and persist it, independently of the"
              + " regular schedule")
  @PostMapping(path = "/refresh", produces = "application/json")
  public RateRefreshResultResponse refresh() {
    log.info("Received refresh request");

    return RateRefreshResultResponse.from(exchangeRateUpdater.forceUpdate());
  }

  @Operation(summary = "Get updater status")
  @GetMapping(path = "/status", produces = "application/json")
  public UpdaterStatusResponse getStatus() {
    return UpdaterStatusResponse.from(exchangeRateUpdater.status());
  }
}
