package org.tesseracthub.currency.client.frankfurter;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

import org.tesseracthub.currency.config.CurrencyServiceProperties;
import org.tesseracthub.currency.fixture.FrankfurterApiStubs;
import org.tesseracthub.currency.fixture.TestConstants;
import org.tesseracthub.currency.service.exception.ExchangeRateProviderException;
import org.tesseracthub.currency.service.exception.RateNotQuotedException;

/** Tests for {@link FrankfurterClient} against a WireMock Frankfurter API. */
@DisplayName("FrankfurterClient Tests")
class FrankfurterClientTest {

  private static WireMockServer wireMockServer;

  private FrankfurterClient client;

  @BeforeAll
  static void startServer() {
    wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
    wireMockServer.start();
  }

  @AfterAll
  static void stopServer() {
    wireMockServer.stop();
  }

  @BeforeEach
  void setUp() {
    wireMockServer.resetAll();

    var properties = new CurrencyServiceProperties();
    var frankfurter = properties.getProvider().getFrankfurter();
    frankfurter.setBaseUrl("http://localhost:" + wireMockServer.port());
    frankfurter.setTimeoutSeconds(2);

    client = new FrankfurterClient(WebClient.builder(), properties, new ObjectMapper());
  }

  // ===========================================================================================
  // Success Responses
  // ===========================================================================================

  @Test
  void getLatestRates_ParsesRateTable() {
    // Arrange
    FrankfurterApiStubs.stubLatestEur(wireMockServer);

    // Act
    var response = client.getLatestRates("EUR");

    // Assert
    assertThat(response.base()).isEqualTo("EUR");
    assertThat(response.date()).isEqualTo(TestConstants.TODAY);
    assertThat(response.rates()).containsOnlyKeys("USD", "JPY", "GBP");
    assertThat(response.rates().get("JPY")).isEqualByComparingTo("160");
  }

  @Test
  void getLatestRatesWithTargets_SendsCommaSeparatedSymbols() {
    // Arrange
    wireMockServer.stubFor(
        get(urlPathEqualTo("/latest"))
            .withQueryParam("from", equalTo("EUR"))
            .withQueryParam("to", equalTo("GBP,USD"))
            .willReturn(
                okJson(
                    FrankfurterApiStubs.ratesBody(
                        BigDecimal.ONE,
                        "EUR",
                        TestConstants.TODAY,
                        Map.of("GBP", TestConstants.RATE_EUR_GBP)))));

    // Act
    var response = client.getLatestRates("EUR", List.of("GBP", "USD"));

    // Assert
    assertThat(response.rates()).containsOnlyKeys("GBP");
  }

  @Test
  void convert_SendsAmountFromAndTo() {
    // Arrange
    FrankfurterApiStubs.stubConvert(wireMockServer, "GBP", "CHF", new BigDecimal("1.12"));

    // Act
    var response = client.convert(BigDecimal.ONE, "GBP", "CHF");

    // Assert
    assertThat(response.rates().get("CHF")).isEqualByComparingTo("1.12");
    wireMockServer.verify(
        getRequestedFor(urlPathEqualTo("/latest"))
            .withQueryParam("amount", equalTo("1"))
            .withHeader("User-Agent", equalTo("CurrencyRateServiceClient/1.0")));
  }

  @Test
  void getHistoricalRates_UsesDateAsPath() {
    // Arrange
    var date = LocalDate.of(2024, 1, 2);
    FrankfurterApiStubs.stubHistorical(
        wireMockServer, date, "EUR", Map.of("USD", new BigDecimal("1.0956")));

    // Act
    var response = client.getHistoricalRates(date, "EUR");

    // Assert
    assertThat(response.date()).isEqualTo(date);
    assertThat(response.rates().get("USD")).isEqualByComparingTo("1.0956");
  }

  @Test
  void getCurrencies_ReturnsCodeToName() {
    FrankfurterApiStubs.stubCurrencies(
        wireMockServer, Map.of("EUR", "Euro", "JPY", "Japanese Yen"));

    var currencies = client.getCurrencies();

    assertThat(currencies).containsEntry("JPY", "Japanese Yen").hasSize(2);
  }

  // ===========================================================================================
  // Error Responses
  // ===========================================================================================

  @Test
  void getLatestRates_ServerErrorWithJsonMessage_ThrowsWithProviderMessage() {
    FrankfurterApiStubs.stubLatestServerError(wireMockServer);

    assertThatThrownBy(() -> client.getLatestRates("EUR"))
        .isInstanceOf(ExchangeRateProviderException.class)
        .hasMessageContaining("HTTP 503")
        .hasMessageContaining("service unavailable");
  }

  @Test
  void getLatestRates_NotFoundWithPlainBody_ThrowsNotQuotedWithRawBody() {
    FrankfurterApiStubs.stubLatestNotFound(wireMockServer);

    assertThatThrownBy(() -> client.getLatestRates("XYZ"))
        .isInstanceOf(RateNotQuotedException.class)
        .hasMessageContaining("HTTP 404")
        .hasMessageContaining("not found");
  }

  @Test
  void convert_UnprocessableCurrency_ThrowsNotQuoted() {
    FrankfurterApiStubs.stubLatestUnprocessable(wireMockServer);

    assertThatThrownBy(() -> client.convert(BigDecimal.ONE, "USD", "XYZ"))
        .isInstanceOf(RateNotQuotedException.class)
        .hasMessageContaining("HTTP 422")
        .hasMessageContaining("invalid currency");
  }

  @Test
  void getLatestRates_MalformedBody_ThrowsProviderException() {
    FrankfurterApiStubs.stubLatestMalformed(wireMockServer);

    assertThatThrownBy(() -> client.getLatestRates("EUR"))
        .isInstanceOf(ExchangeRateProviderException.class)
        .hasMessageContaining("latest EUR");
  }

  @Test
  void getLatestRates_ResponseWithoutRates_ThrowsProviderException() {
    wireMockServer.stubFor(
        get(urlPathEqualTo("/latest"))
            .willReturn(okJson("{\"amount\":1.0,\"base\":\"EUR\",\"date\":\"2025-11-03\"}")));

    assertThatThrownBy(() -> client.getLatestRates("EUR"))
        .isInstanceOf(ExchangeRateProviderException.class)
        .hasMessageContaining("has no rates");
  }

  @Test
  void getLatestRates_SlowResponse_TimesOut() {
    wireMockServer.stubFor(
        get(urlPathEqualTo("/latest"))
            .willReturn(aResponse().withFixedDelay(3_000).withStatus(200).withBody("{}")));

    assertThatThrownBy(() -> client.getLatestRates("EUR"))
        .isInstanceOf(ExchangeRateProviderException.class);
  }
}
