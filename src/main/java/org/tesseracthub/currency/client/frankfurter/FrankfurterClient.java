package org.tesseracthub.currency.client.frankfurter;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import reactor.core.publisher.Mono;

import org.tesseracthub.currency.client.frankfurter.response.FrankfurterErrorResponse;
import org.tesseracthub.currency.client.frankfurter.response.FrankfurterRatesResponse;
import org.tesseracthub.currency.config.CurrencyServiceProperties;
import org.tesseracthub.currency.service.exception.ExchangeRateProviderException;
import org.tesseracthub.currency.service.exception.RateNotQuotedException;

/**
 * HTTP client for the Frankfurter API (ECB reference rates).
 *
 * <p>Every call blocks for at most the configured timeout. Non-2xx responses, empty bodies and
 * decoding failures all surface as {@link ExchangeRateProviderException}; nothing is retried here.
 * A 404 or 422 means the currency is not quoted and is raised as {@link RateNotQuotedException}.
 */
@Component
public class FrankfurterClient {

  private static final Logger log = LoggerFactory.getLogger(FrankfurterClient.class);

  private static final String USER_AGENT = "CurrencyRateServiceClient/1.0";
  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private static final ParameterizedTypeReference<FrankfurterRatesResponse> RATES_TYPE =
      new ParameterizedTypeReference<>() {};
  private static final ParameterizedTypeReference<Map<String, String>> CURRENCIES_TYPE =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final Duration timeout;

  public FrankfurterClient(
      WebClient.Builder webClientBuilder,
      CurrencyServiceProperties properties,
      ObjectMapper objectMapper) {
    var frankfurterConfig = properties.getProvider().getFrankfurter();

    this.webClient =
        webClientBuilder
            .baseUrl(frankfurterConfig.getBaseUrl())
            .defaultHeader("User-Agent", USER_AGENT)
            .build();
    this.objectMapper = objectMapper;
    this.timeout = Duration.ofSeconds(frankfurterConfig.getTimeoutSeconds());

    log.info("FrankfurterClient initialized with base URL: {}", frankfurterConfig.getBaseUrl());
  }

  public FrankfurterRatesResponse getLatestRates(String base) {
    return getRates(uri -> uri.path("/latest").queryParam("from", base).build(), "latest " + base);
  }

  public FrankfurterRatesResponse getLatestRates(String base, Collection<String> targets) {
    var symbols = String.join(",", targets);
    return getRates(
        uri -> uri.path("/latest").queryParam("from", base).queryParam("to", symbols).build(),
        "latest " + base + " -> " + symbols);
  }

  public FrankfurterRatesResponse convert(BigDecimal amount, String from, String to) {
    return getRates(
        uri ->
            uri.path("/latest")
                .queryParam("amount", amount.toPlainString())
                .queryParam("from", from)
                .queryParam("to", to)
                .build(),
        "convert " + from + "/" + to);
  }

  public FrankfurterRatesResponse getHistoricalRates(LocalDate date, String base) {
    return getRates(
        uri -> uri.path("/{date}").queryParam("from", base).build(date.toString()),
        "historical " + base + " on " + date);
  }

  /**
   * Lists the currencies Frankfurter quotes.
   *
   * @return map of currency code to English name
   */
  public Map<String, String> getCurrencies() {
    return execute(uri -> uri.path("/currencies").build(), CURRENCIES_TYPE, "currencies");
  }

  private FrankfurterRatesResponse getRates(
      Function<UriBuilder, URI> uriFunction, String description) {
    var response = execute(uriFunction, RATES_TYPE, description);
    if (response.rates() == null) {
      throw new ExchangeRateProviderException(
          "Frankfurter response for " + description + " has no rates");
    }
    return response;
  }

  private <T> T execute(
      Function<UriBuilder, URI> uriFunction,
      ParameterizedTypeReference<T> responseType,
      String description) {
    log.debug("Requesting Frankfurter {}", description);

    try {
      var response =
          webClient
              .get()
              .uri(uriFunction)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .onStatus(HttpStatusCode::isError, this::handleErrorResponse)
              .bodyToMono(responseType)
              .timeout(timeout)
              .block();

      if (response == null) {
        throw new ExchangeRateProviderException(
            "Received empty response from Frankfurter for " + description);
      }
      return response;
    } catch (ExchangeRateProviderException | RateNotQuotedException e) {
      throw e;
    } catch (Exception e) {
      log.warn("Unexpected error fetching Frankfurter {}: {}", description, e.getMessage());
      throw new ExchangeRateProviderException(
          "Failed to fetch Frankfurter " + description + ": " + e.getMessage(), e);
    }
  }

  private Mono<? extends Throwable> handleErrorResponse(ClientResponse response) {
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("No response body")
        .map(body -> parseErrorAndCreateException(response, body));
  }

  private Throwable parseErrorAndCreateException(ClientResponse response, String body) {
    var errorMessage = body;

    try {
      var errorResponse = objectMapper.readValue(body, FrankfurterErrorResponse.class);
      if (errorResponse.message() != null) {
        errorMessage = errorResponse.message();
      }
    } catch (JsonProcessingException e) {
      log.debug("Could not parse Frankfurter error response as JSON: {}", e.getMessage());
      if (body.length() > MAX_ERROR_BODY_LENGTH) {
        errorMessage = body.substring(0, MAX_ERROR_BODY_LENGTH) + "... (truncated)";
      }
    }

    log.warn("Frankfurter API error: HTTP {} - Message: {}", response.statusCode(), errorMessage);

    var message =
        "Frankfurter API error: HTTP " + response.statusCode().value() + " - " + errorMessage;
    if (isNotQuoted(response.statusCode())) {
      return new RateNotQuotedException(message);
    }
    return new ExchangeRateProviderException(message);
  }

  // Frankfurter answers 404 (422 on older deployments) for well-formed codes it does not quote
  private static boolean isNotQuoted(HttpStatusCode status) {
    return status.value() == 404 || status.value() == 422;
  }
}
