package org.tesseracthub.currency.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Main configuration class for the Currency Rate Service.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml. JavaTimeModule is automatically registered when jackson-datatype-jsr310 is on
 * the classpath, which the cache tier relies on for {@code Instant} fields.
 */
@Configuration
@EnableConfigurationProperties(CurrencyServiceProperties.class)
public class CurrencyServiceConfig {

  /** UTC clock for fetch timestamps, cache insertion times and rate dates. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
