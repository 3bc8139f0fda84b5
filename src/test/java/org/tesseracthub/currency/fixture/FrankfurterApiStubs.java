package org.tesseracthub.currency.fixture;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;

/**
 * WireMock stub templates for Frankfurter API responses.
 *
 * <pre>{@code
 * FrankfurterApiStubs.stubLatest(wireMockServer, "EUR", Map.of("USD", new BigDecimal("1.10")));
 * }</pre>
 */
public final class FrankfurterApiStubs {

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private FrankfurterApiStubs() {
    throw new UnsupportedOperationException("Utility class - do not instantiate");
  }

  // ===========================================================================================
  // Success Responses
  // ===========================================================================================

  /** Stubs {@code GET /latest?from={base}} with the given rate table. */
  public static void stubLatest(
      WireMockServer server, String base, Map<String, BigDecimal> rates) {
    server.stubFor(
        get(urlPathEqualTo("/latest"))
            .withQueryParam("from", equalTo(base))
            .willReturn(okJson(ratesBody(BigDecimal.ONE, base, TestConstants.TODAY, rates))));
  }

  /** Stubs the standard EUR table: USD 1.10, JPY 160, GBP 0.85. */
  public static void stubLatestEur(WireMockServer server) {
    var rates = new LinkedHashMap<String, BigDecimal>();
    rates.put(TestConstants.USD, TestConstants.RATE_EUR_USD);
    rates.put(TestConstants.JPY, TestConstants.RATE_EUR_JPY);
    rates.put(TestConstants.GBP, TestConstants.RATE_EUR_GBP);
    stubLatest(server, TestConstants.EUR, rates);
  }

  /** Stubs {@code GET /latest?amount=1&from={from}&to={to}}. */
  public static void stubConvert(WireMockServer server, String from, String to, BigDecimal rate) {
    server.stubFor(
        get(urlPathEqualTo("/latest"))
            .withQueryParam("amount", equalTo("1"))
            .withQueryParam("from", equalTo(from))
            .withQueryParam("to", equalTo(to))
            .willReturn(
                okJson(ratesBody(BigDecimal.ONE, from, TestConstants.TODAY, Map.of(to, rate)))));
  }

  /** Stubs {@code GET /{date}?from={base}}. */
  public static void stubHistorical(
      WireMockServer server, LocalDate date, String base, Map<String, BigDecimal> rates) {
    server.stubFor(
        get(urlPathEqualTo("/" + date))
            .withQueryParam("from", equalTo(base))
            .willReturn(okJson(ratesBody(BigDecimal.ONE, base, date, rates))));
  }

  /** Stubs {@code GET /currencies}. */
  public static void stubCurrencies(WireMockServer server, Map<String, String> currencies) {
    server.stubFor(get(urlPathEqualTo("/currencies")).willReturn(okJson(toJson(currencies))));
  }

  // ===========================================================================================
  // Error Responses
  // ===========================================================================================

  /** Stubs any {@code /latest} request with a server error carrying a Frankfurter message. */
  public static void stubLatestServerError(WireMockServer server) {
    server.stubFor(
        get(urlPathEqualTo("/latest"))
            .willReturn(
                aResponse()
                    .withStatus(503)
                    .withHeader("Content-Type", "application/json")
                    .withBody("{\"message\":\"service unavailable\"}")));
  }

  /** Stubs any {@code /latest} request with a 404 and a plain text body. */
  public static void stubLatestNotFound(WireMockServer server) {
    server.stubFor(
        get(urlPathEqualTo("/latest"))
            .willReturn(aResponse().withStatus(404).withBody("not found")));
  }

  /** Stubs any {@code /latest} request with a 422 carrying a Frankfurter message. */
  public static void stubLatestUnprocessable(WireMockServer server) {
    server.stubFor(
        get(urlPathEqualTo("/latest"))
            .willReturn(
                aResponse()
                    .withStatus(422)
                    .withHeader("Content-Type", "application/json")
                    .withBody("{\"message\":\"invalid currency\"}")));
  }

  /** Stubs {@code /latest} with a 200 whose body is not JSON. */
  public static void stubLatestMalformed(WireMockServer server) {
    server.stubFor(
        get(urlPathEqualTo("/latest"))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withHeader("Content-Type", "application/json")
                    .withBody("{not json")));
  }

  // ===========================================================================================
  // Helpers
  // ===========================================================================================

  public static String ratesBody(
      BigDecimal amount, String base, LocalDate date, Map<String, BigDecimal> rates) {
    var body = new LinkedHashMap<String, Object>();
    body.put("amount", amount);
    body.put("base", base);
    body.put("date", date.toString());
    body.put("rates", rates);
    return toJson(body);
  }

  private static String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize stub body", e);
    }
  }
}
