package org.tesseracthub.currency.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "currency-service")
@Validated
public class CurrencyServiceProperties {

  /** Pivot currency for cross rates and the currency refreshed by the rate updater. */
  @NotBlank
  @Pattern(regexp = "[A-Z]{3}", message = "Base currency must be a 3-letter uppercase code")
  private String baseCurrency = "EUR";

  @Valid private Provider provider = new Provider();
  @Valid private Cache cache = new Cache();
  @Valid private RateUpdater rateUpdater = new RateUpdater();
  @Valid private Retention retention = new Retention();

  public String getBaseCurrency() {
    return baseCurrency;
  }

  public void setBaseCurrency(String baseCurrency) {
    this.baseCurrency = baseCurrency;
  }

  public Provider getProvider() {
    return provider;
  }

  public void setProvider(Provider provider) {
    this.provider = provider;
  }

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public RateUpdater getRateUpdater() {
    return rateUpdater;
  }

  public void setRateUpdater(RateUpdater rateUpdater) {
    this.rateUpdater = rateUpdater;
  }

  public Retention getRetention() {
    return retention;
  }

  public void setRetention(Retention retention) {
    this.retention = retention;
  }

  public static class Provider {

    @Valid private Frankfurter frankfurter = new Frankfurter();

    public Frankfurter getFrankfurter() {
      return frankfurter;
    }

    public void setFrankfurter(Frankfurter frankfurter) {
      this.frankfurter = frankfurter;
    }

    public static class Frankfurter {
      /** Frankfurter API base URL. */
      @NotBlank private String baseUrl = "https://api.frankfurter.app";

      /** Timeout in seconds for Frankfurter API requests. */
      @Min(1)
      @Max(120)
      private int timeoutSeconds = 10;

      public String getBaseUrl() {
        return baseUrl;
      }

      public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
      }

      public int getTimeoutSeconds() {
        return timeoutSeconds;
      }

      public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
      }
    }
  }

  public static class Cache {
    /** Time to live of in-process (tier 1) entries. */
    @NotNull private Duration localTtl = Duration.ofMinutes(5);

    /** Time to live of Redis (tier 2) entries. */
    @NotNull private Duration sharedTtl = Duration.ofHours(1);

    /** Whether the Redis tier is used at all. When false, only the in-process tier caches. */
    private boolean sharedEnabled = true;

    /** Upper bound on in-process rate entries. */
    @Min(1)
    private long localMaximumSize = 10_000;

    /** Interval in milliseconds between sweeps of expired in-process entries. */
    @Min(1000)
    private long cleanupIntervalMs = 60_000;

    public Duration getLocalTtl() {
      return localTtl;
    }

    public void setLocalTtl(Duration localTtl) {
      this.localTtl = localTtl;
    }

    public Duration getSharedTtl() {
      return sharedTtl;
    }

    public void setSharedTtl(Duration sharedTtl) {
      this.sharedTtl = sharedTtl;
    }

    public boolean isSharedEnabled() {
      return sharedEnabled;
    }

    public void setSharedEnabled(boolean sharedEnabled) {
      this.sharedEnabled = sharedEnabled;
    }

    public long getLocalMaximumSize() {
      return localMaximumSize;
    }

    public void setLocalMaximumSize(long localMaximumSize) {
      this.localMaximumSize = localMaximumSize;
    }

    public long getCleanupIntervalMs() {
      return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
      this.cleanupIntervalMs = cleanupIntervalMs;
    }
  }

  public static class RateUpdater {
    /** Whether the updater starts when the application is ready. */
    private boolean enabled = true;

    /** Interval between regular refresh ticks. */
    @NotNull private Duration interval = Duration.ofHours(1);

    @Valid private Retry retry = new Retry();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public Retry getRetry() {
      return retry;
    }

    public void setRetry(Retry retry) {
      this.retry = retry;
    }

    public static class Retry {
      /**
       * Maximum number of attempts per tick (including the tick itself). Example: max-attempts=3
       * means 1 scheduled attempt + 2 retries.
       */
      @Min(1)
      @Max(10)
      private int maxAttempts = 3;

      /** Delay between retries in minutes. */
      @Min(1)
      @Max(60)
      private long delayMinutes = 5;

      public int getMaxAttempts() {
        return maxAttempts;
      }

      public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
      }

      public long getDelayMinutes() {
        return delayMinutes;
      }

      public void setDelayMinutes(long delayMinutes) {
        this.delayMinutes = delayMinutes;
      }
    }
  }

  public static class Retention {
    /** Cron expression for the pruning job (UTC). */
    @NotBlank private String cron = "0 30 3 * * ?";

    /** Rates fetched longer ago than this are soft-deleted. */
    @Min(1)
    private int maxAgeDays = 30;

    public String getCron() {
      return cron;
    }

    public void setCron(String cron) {
      this.cron = cron;
    }

    public int getMaxAgeDays() {
      return maxAgeDays;
    }

    public void setMaxAgeDays(int maxAgeDays) {
      this.maxAgeDays = maxAgeDays;
    }
  }
}
