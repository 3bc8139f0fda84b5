package org.tesseracthub.currency.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

import jakarta.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.javacrumbs.shedlock.core.DefaultLockingTaskExecutor;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import net.javacrumbs.shedlock.core.LockingTaskExecutor.TaskWithResult;

import org.tesseracthub.currency.config.CurrencyServiceProperties;
import org.tesseracthub.currency.service.CurrencyConversionService;
import org.tesseracthub.currency.service.dto.RateRefreshResult;

/**
 * Background refresher of the exchange rate table.
 *
 * <p><b>Lifecycle:</b> {@link #start()} schedules a fixed-rate tick whose first run is immediate,
 * so the cache is warm as soon as the application is ready. {@link #stop()} cancels the tick and
 * any pending retry, then blocks until an in-flight refresh has finished.
 *
 * <p><b>Retries:</b> a failed tick is retried after a fixed delay, up to {@code max-attempts}
 * attempts in total. When the budget is exhausted the updater waits for the next regular tick and
 * the retry counter goes back to zero. A regular tick replaces any retry still pending.
 *
 * <p><b>Serialization:</b> every refresh (tick, retry or {@link #forceUpdate()}) runs under one
 * in-process lock. Scheduled attempts additionally take the {@value #REFRESH_LOCK_NAME} ShedLock
 * lock; an instance that cannot get it skips the attempt, which counts as neither success nor
 * failure. A scheduled attempt that gets the in-process lock only after {@link #stop()} does
 * nothing.
 */
@Component
public class ExchangeRateUpdater {

  private static final Logger log = LoggerFactory.getLogger(ExchangeRateUpdater.class);

  static final String REFRESH_LOCK_NAME = "exchangeRateRefresh";

  private static final Duration LOCK_AT_MOST_FOR = Duration.ofMinutes(15);
  private static final Duration LOCK_AT_LEAST_FOR = Duration.ofMinutes(1);

  private final TaskScheduler taskScheduler;
  private final MeterRegistry meterRegistry;
  private final CurrencyServiceProperties.RateUpdater config;
  private final CurrencyConversionService conversionService;
  private final LockingTaskExecutor lockingTaskExecutor;
  private final Clock clock;

  private final ReentrantLock refreshLock = new ReentrantLock();
  private final Object stateLock = new Object();

  // guarded by stateLock
  private boolean running;
  private Instant lastUpdate;
  private String lastError;
  private int retryCount;
  private ScheduledFuture<?> tickFuture;
  private ScheduledFuture<?> retryFuture;

  public ExchangeRateUpdater(
      TaskScheduler taskScheduler,
      MeterRegistry meterRegistry,
      CurrencyServiceProperties properties,
      CurrencyConversionService conversionService,
      LockProvider lockProvider,
      Clock clock) {
    this.taskScheduler = taskScheduler;
    this.meterRegistry = meterRegistry;
    this.config = properties.getRateUpdater();
    this.conversionService = conversionService;
    this.lockingTaskExecutor = new DefaultLockingTaskExecutor(lockProvider);
    this.clock = clock;
  }

  public void start() {
    synchronized (stateLock) {
      if (running) {
        return;
      }
      running = true;
      tickFuture =
          taskScheduler.scheduleAtFixedRate(
              this::runScheduledTick, clock.instant(), config.getInterval());
    }

    log.info(
        "Exchange rate updater started (interval: {}, max attempts: {}, retry delay: {} minutes)",
        config.getInterval(),
        config.getRetry().getMaxAttempts(),
        config.getRetry().getDelayMinutes());
  }

  @PreDestroy
  public void stop() {
    synchronized (stateLock) {
      if (!running) {
        return;
      }
      running = false;
      cancel(tickFuture);
      cancel(retryFuture);
      tickFuture = null;
      retryFuture = null;
      retryCount = 0;
    }

    // wait for a refresh that is already running
    refreshLock.lock();
    refreshLock.unlock();

    log.info("Exchange rate updater stopped");
  }

  /**
   * Refreshes rates synchronously on the calling thread, regardless of whether the updater is
   * running. Waits for any refresh already in progress. Failures are recorded in the status and
   * rethrown; they do not schedule retries.
   *
   * @return the refresh outcome
   */
  public RateRefreshResult forceUpdate() {
    log.info("Forced exchange rate update requested");
    return refresh(false);
  }

  public UpdaterStatus status() {
    synchronized (stateLock) {
      return new UpdaterStatus(running, lastUpdate, lastError, config.getInterval(), retryCount);
    }
  }

  void runScheduledTick() {
    synchronized (stateLock) {
      if (!running) {
        return;
      }
      if (retryFuture != null) {
        log.info("Regular tick supersedes pending retry");
        cancel(retryFuture);
        retryFuture = null;
      }
      retryCount = 0;
    }

    executeAttempt(1);
  }

  private void executeAttempt(int attemptNumber) {
    var sample = Timer.start(meterRegistry);
    var lockConfiguration =
        new LockConfiguration(
            clock.instant(), REFRESH_LOCK_NAME, LOCK_AT_MOST_FOR, LOCK_AT_LEAST_FOR);
    TaskWithResult<RateRefreshResult> task = () -> refresh(true);

    try {
      var result = lockingTaskExecutor.executeWithLock(task, lockConfiguration);
      if (result.wasExecuted() && result.getResult() == null) {
        log.info("Updater stopped while attempt {} waited for the refresh lock", attemptNumber);
      } else if (result.wasExecuted()) {
        log.info(
            "Successfully refreshed {} exchange rates on attempt {}",
            result.getResult().ratesStored(),
            attemptNumber);
        recordSuccess(sample, attemptNumber);
      } else {
        log.info("Skipped exchange rate refresh, lock {} held elsewhere", REFRESH_LOCK_NAME);
        meterRegistry.counter("exchange.rate.refresh.skipped").increment();
      }
    } catch (Error e) {
      throw e;
    } catch (Throwable e) {
      handleFailure(attemptNumber, e, sample);
    }
  }

  /**
   * Runs one refresh under the in-process lock.
   *
   * @param scheduled whether the call comes from a tick or retry; such calls are dropped when the
   *     updater was stopped while they waited for the lock
   * @return the outcome, or {@code null} for a dropped scheduled call
   */
  private RateRefreshResult refresh(boolean scheduled) {
    refreshLock.lock();
    try {
      if (scheduled && !isRunning()) {
        return null;
      }
      var result = conversionService.refreshRates();
      synchronized (stateLock) {
        lastUpdate = clock.instant();
        lastError = null;
        retryCount = 0;
        cancel(retryFuture);
        retryFuture = null;
      }
      return result;
    } catch (RuntimeException e) {
      synchronized (stateLock) {
        lastError = e.getMessage();
      }
      throw e;
    } finally {
      refreshLock.unlock();
    }
  }

  private boolean isRunning() {
    synchronized (stateLock) {
      return running;
    }
  }

  private void handleFailure(int attemptNumber, Throwable e, Timer.Sample sample) {
    var maxAttempts = config.getRetry().getMaxAttempts();

    log.error(
        "Failed to refresh exchange rates on attempt {}/{}: {}",
        attemptNumber,
        maxAttempts,
        e.getMessage(),
        e);

    recordFailure(sample, attemptNumber, e);

    if (attemptNumber < maxAttempts) {
      scheduleRetry(attemptNumber + 1);
    } else {
      log.error(
          "All {} refresh attempts failed, will try again at next scheduled interval",
          maxAttempts);
      synchronized (stateLock) {
        retryCount = 0;
      }
      meterRegistry.counter("exchange.rate.refresh.exhausted").increment();
    }
  }

  private void scheduleRetry(int attemptNumber) {
    var delay = Duration.ofMinutes(config.getRetry().getDelayMinutes());
    var retryTime = clock.instant().plus(delay);

    synchronized (stateLock) {
      if (!running) {
        log.info("Updater stopped, not scheduling retry attempt {}", attemptNumber);
        return;
      }
      retryCount = attemptNumber - 1;
      retryFuture = taskScheduler.schedule(() -> runRetry(attemptNumber), retryTime);
    }

    log.info("Scheduling retry attempt {} in {} at {}", attemptNumber, delay, retryTime);

    meterRegistry
        .counter("exchange.rate.refresh.retry.scheduled", "attempt", String.valueOf(attemptNumber))
        .increment();
  }

  private void runRetry(int attemptNumber) {
    synchronized (stateLock) {
      if (!running) {
        return;
      }
      retryFuture = null;
    }

    log.info("Executing retry attempt {} (scheduled retry)", attemptNumber);
    executeAttempt(attemptNumber);
  }

  private void recordSuccess(Timer.Sample sample, int attemptNumber) {
    sample.stop(
        Timer.builder("exchange.rate.refresh.duration")
            .tag("status", "success")
            .tag("attempt", String.valueOf(attemptNumber))
            .register(meterRegistry));

    meterRegistry
        .counter(
            "exchange.rate.refresh.executions",
            "status",
            "success",
            "attempt",
            String.valueOf(attemptNumber))
        .increment();
  }

  private void recordFailure(Timer.Sample sample, int attemptNumber, Throwable e) {
    var error = e.getClass().getSimpleName();

    sample.stop(
        Timer.builder("exchange.rate.refresh.duration")
            .tag("status", "failure")
            .tag("attempt", String.valueOf(attemptNumber))
            .tag("error", error)
            .register(meterRegistry));

    meterRegistry
        .counter(
            "exchange.rate.refresh.executions",
            "status",
            "failure",
            "attempt",
            String.valueOf(attemptNumber),
            "error",
            error)
        .increment();
  }

  private static void cancel(ScheduledFuture<?> future) {
    if (future != null) {
      future.cancel(false);
    }
  }
}
