package org.tesseracthub.currency.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import org.tesseracthub.currency.scheduler.ExchangeRateUpdater;

@Component
public class CurrencyServiceStartupConfig {

  private static final Logger log = LoggerFactory.getLogger(CurrencyServiceStartupConfig.class);

  private final CurrencyServiceProperties properties;
  private final ExchangeRateUpdater exchangeRateUpdater;

  public CurrencyServiceStartupConfig(
      CurrencyServiceProperties properties, ExchangeRateUpdater exchangeRateUpdater) {
    this.properties = properties;
    this.exchangeRateUpdater = exchangeRateUpdater;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    logConfiguration();
    startUpdaterIfEnabled();
  }

  private void startUpdaterIfEnabled() {
    if (!properties.getRateUpdater().isEnabled()) {
      log.info("Rate updater is disabled, rates are only fetched on demand");
      return;
    }

    exchangeRateUpdater.start();
  }

  private void logConfiguration() {
    var cache = properties.getCache();
    var updater = properties.getRateUpdater();
    var retention = properties.getRetention();

    log.info(
        "Currency Service Configuration: baseCurrency={}, provider={} (timeout {}s)",
        properties.getBaseCurrency(),
        properties.getProvider().getFrankfurter().getBaseUrl(),
        properties.getProvider().getFrankfurter().getTimeoutSeconds());
    log.info(
        "Cache Configuration: localTtl={}, sharedTtl={}, sharedEnabled={}, localMaximumSize={}",
        cache.getLocalTtl(),
        cache.getSharedTtl(),
        cache.isSharedEnabled(),
        cache.getLocalMaximumSize());
    log.info(
        "Rate Updater Configuration: enabled={}, interval={}, maxAttempts={}, retryDelay={}m,"
            + " retentionCron='{}', maxAgeDays={}",
        updater.isEnabled(),
        updater.getInterval(),
        updater.getRetry().getMaxAttempts(),
        updater.getRetry().getDelayMinutes(),
        retention.getCron(),
        retention.getMaxAgeDays());
  }
}
