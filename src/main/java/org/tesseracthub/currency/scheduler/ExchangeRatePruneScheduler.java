package org.tesseracthub.currency.scheduler;

import java.time.Clock;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.MeterRegistry;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;

import org.tesseracthub.currency.config.CurrencyServiceProperties;
import org.tesseracthub.currency.service.ExchangeRateStore;
import org.tesseracthub.currency.service.exception.RatePersistenceException;

/** Daily job that soft-deletes rates the provider has not re-quoted within the retention window. */
@Component
public class ExchangeRatePruneScheduler {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRatePruneScheduler.class);

  private final ExchangeRateStore exchangeRateStore;
  private final CurrencyServiceProperties.Retention retention;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public ExchangeRatePruneScheduler(
      ExchangeRateStore exchangeRateStore,
      CurrencyServiceProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.exchangeRateStore = exchangeRateStore;
    this.retention = properties.getRetention();
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Scheduled(cron = "${currency-service.retention.cron:0 30 3 * * ?}", zone = "UTC")
  @SchedulerLock(name = "exchangeRatePrune", lockAtMostFor = "10m", lockAtLeastFor = "1m")
  public void pruneOldRates() {
    var cutoff = clock.instant().minus(Duration.ofDays(retention.getMaxAgeDays()));
    log.info("Pruning exchange rates fetched before {}", cutoff);

    try {
      var pruned = exchangeRateStore.deleteOldRates(cutoff);
      log.info("Pruned {} exchange rates older than {} days", pruned, retention.getMaxAgeDays());
      meterRegistry.counter("exchange.rate.prune.executions", "status", "success").increment();
      meterRegistry.counter("exchange.rate.prune.rows").increment(pruned);
    } catch (RatePersistenceException e) {
      log.error("Failed to prune exchange rates fetched before {}", cutoff, e);
      meterRegistry.counter("exchange.rate.prune.executions", "status", "failure").increment();
    }
  }
}
