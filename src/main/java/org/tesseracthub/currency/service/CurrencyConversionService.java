package org.tesseracthub.currency.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import org.tesseracthub.currency.cache.CachedRate;
import org.tesseracthub.currency.cache.RateCache;
import org.tesseracthub.currency.config.CurrencyServiceProperties;
import org.tesseracthub.currency.domain.CurrencyPair;
import org.tesseracthub.currency.domain.ExchangeRate;
import org.tesseracthub.currency.service.dto.BulkConversion;
import org.tesseracthub.currency.service.dto.BulkConvertItem;
import org.tesseracthub.currency.service.dto.BulkConvertResult;
import org.tesseracthub.currency.service.dto.LatestRates;
import org.tesseracthub.currency.service.dto.RateRefreshResult;
import org.tesseracthub.currency.service.dto.SupportedCurrency;
import org.tesseracthub.currency.service.exception.ExchangeRateProviderException;
import org.tesseracthub.currency.service.exception.InvalidCurrencyCodeException;
import org.tesseracthub.currency.service.exception.RateNotFoundException;
import org.tesseracthub.currency.service.exception.RateNotQuotedException;
import org.tesseracthub.currency.service.exception.RatePersistenceException;
import org.tesseracthub.currency.service.provider.ExchangeRateProvider;

/**
 * Currency conversion engine.
 *
 * <p><b>Rate resolution order</b> for a pair that is not an identity:
 *
 * <ol>
 *   <li>Two-tier cache
 *   <li>Store, direct row for the pair
 *   <li>Cross rate through the configured base currency: rate(from, base) x rate(base, to). Each
 *       leg is resolved cache, then store, then from the inverse pair (1 / rate) when that is
 *       present and nonzero, so a pair touching the base currency resolves through its inverse
 *       without a provider call.
 *   <li>Provider, as a last resort; the fetched rate is cached and persisted
 *   </ol>
 *
 * <p>Every step that succeeds writes the result to the cache. Concurrent misses for the same pair
 * share one resolution through {@link SingleFlight}.
 *
 * <p>Derived rates (inverses and cross rates) carry {@value #RATE_SCALE} decimal places, matching
 * the precision of the store column.
 */
@Service
public class CurrencyConversionService {

  private static final Logger log = LoggerFactory.getLogger(CurrencyConversionService.class);

  static final int RATE_SCALE = 10;

  private final RateCache rateCache;
  private final ExchangeRateStore exchangeRateStore;
  private final ExchangeRateProvider exchangeRateProvider;
  private final Clock clock;
  private final String baseCurrency;
  private final SingleFlight<CurrencyPair, BigDecimal> resolutions = new SingleFlight<>();

  public CurrencyConversionService(
      RateCache rateCache,
      ExchangeRateStore exchangeRateStore,
      ExchangeRateProvider exchangeRateProvider,
      CurrencyServiceProperties properties,
      Clock clock) {
    this.rateCache = rateCache;
    this.exchangeRateStore = exchangeRateStore;
    this.exchangeRateProvider = exchangeRateProvider;
    this.clock = clock;
    this.baseCurrency = CurrencyPair.normalize(properties.getBaseCurrency());
  }

  public String getBaseCurrency() {
    return baseCurrency;
  }

  /**
   * Converts an amount between two currencies. Same-currency conversions return the amount
   * untouched, whatever its sign.
   */
  public BigDecimal convert(BigDecimal amount, String from, String to) {
    var pair = CurrencyPair.of(from, to);
    if (pair.isIdentity()) {
      return amount;
    }
    return amount.multiply(getRate(pair));
  }

  public BigDecimal getRate(String from, String to) {
    return getRate(CurrencyPair.of(from, to));
  }

  /**
   * Resolves the rate for a pair.
   *
   * @return one unit of {@code pair.base()} expressed in {@code pair.target()}
   * @throws RateNotFoundException if no step produced a rate
   * @throws ExchangeRateProviderException if the provider had to be called and failed
   */
  public BigDecimal getRate(CurrencyPair pair) {
    if (pair.isIdentity()) {
      return BigDecimal.ONE;
    }

    var cached = rateCache.getRate(pair);
    if (cached.found()) {
      return cached.value().rate();
    }

    return resolutions.execute(pair, () -> resolveUncached(pair));
  }

  private BigDecimal resolveUncached(CurrencyPair pair) {
    var stored = exchangeRateStore.getRate(pair);
    if (stored.isPresent()) {
      var rate = stored.get();
      rateCache.setRate(pair, rate.getRate(), rate.getFetchedAt());
      log.debug("Resolved {} from store", pair);
      return rate.getRate();
    }

    var cross = crossRate(pair);
    if (cross.isPresent()) {
      rateCache.setRate(pair, cross.get().rate(), cross.get().fetchedAt());
      log.debug("Resolved {} as cross rate through {}", pair, baseCurrency);
      return cross.get().rate();
    }

    return fetchFromProvider(pair);
  }

  private Optional<ResolvedRate> crossRate(CurrencyPair pair) {
    var toBase = resolveLeg(CurrencyPair.of(pair.base(), baseCurrency), pair);
    if (toBase.isEmpty()) {
      return Optional.empty();
    }

    var fromBase = resolveLeg(CurrencyPair.of(baseCurrency, pair.target()), pair);
    if (fromBase.isEmpty()) {
      return Optional.empty();
    }

    var rate =
        toBase
            .get()
            .rate()
            .multiply(fromBase.get().rate())
            .setScale(RATE_SCALE, RoundingMode.HALF_UP);
    var fetchedAt = oldest(toBase.get().fetchedAt(), fromBase.get().fetchedAt());
    return Optional.of(new ResolvedRate(rate, fetchedAt));
  }

  /**
   * Resolves one cross-rate leg without calling the provider. A leg equal to the requested pair
   * has already missed cache and store, so only its inverse is tried.
   */
  private Optional<ResolvedRate> resolveLeg(CurrencyPair leg, CurrencyPair requested) {
    if (leg.isIdentity()) {
      return Optional.of(new ResolvedRate(BigDecimal.ONE, clock.instant()));
    }

    if (!leg.equals(requested)) {
      var direct = lookupWithoutProvider(leg);
      if (direct.isPresent()) {
        return direct;
      }
    }

    var inverse = lookupWithoutProvider(leg.inverse());
    if (inverse.isPresent() && inverse.get().rate().signum() != 0) {
      var rate = BigDecimal.ONE.divide(inverse.get().rate(), RATE_SCALE, RoundingMode.HALF_UP);
      rateCache.setRate(leg, rate, inverse.get().fetchedAt());
      log.debug("Derived {} from inverse rate {}", leg, leg.inverse());
      return Optional.of(new ResolvedRate(rate, inverse.get().fetchedAt()));
    }

    return Optional.empty();
  }

  private Optional<ResolvedRate> lookupWithoutProvider(CurrencyPair pair) {
    var cached = rateCache.getRate(pair);
    if (cached.found()) {
      return Optional.of(ResolvedRate.from(cached.value()));
    }

    var stored = exchangeRateStore.getRate(pair);
    if (stored.isPresent()) {
      var rate = stored.get();
      rateCache.setRate(pair, rate.getRate(), rate.getFetchedAt());
      return Optional.of(new ResolvedRate(rate.getRate(), rate.getFetchedAt()));
    }

    return Optional.empty();
  }

  private BigDecimal fetchFromProvider(CurrencyPair pair) {
    log.info("No cached, stored or cross rate for {}, fetching from provider", pair);

    LatestRates conversion;
    try {
      conversion = exchangeRateProvider.convert(BigDecimal.ONE, pair.base(), pair.target());
    } catch (RateNotQuotedException e) {
      throw new RateNotFoundException(pair, e);
    } catch (ExchangeRateProviderException e) {
      throw new ExchangeRateProviderException(
          "Failed to fetch rate for " + pair + ": " + e.getMessage(), e);
    }

    var rate = conversion.rates().get(pair.target());
    if (rate == null || rate.signum() <= 0) {
      throw new RateNotFoundException(pair);
    }

    var fetchedAt = clock.instant();
    rateCache.setRate(pair, rate, fetchedAt);

    try {
      exchangeRateStore.upsertRate(pair, rate, fetchedAt);
    } catch (RuntimeException e) {
      // The rate is valid and already cached; the next refresh rewrites the row anyway
      log.warn("Failed to persist provider rate for {}: {}", pair, e.getMessage());
    }

    return rate;
  }

  /**
   * All rates quoted against {@code base}.
   *
   * @see #getAllRates(String, Collection)
   */
  public LatestRates getAllRates(String base) {
    return getAllRates(base, List.of());
  }

  /**
   * Rates quoted against {@code base}, optionally restricted to some targets.
   *
   * <p>For the configured base currency the cached aggregate is used first. Otherwise, or on a
   * miss, the store is read in bulk; only when it holds no rows for the base is the provider called
   * once. Results for the configured base repopulate the cached aggregate.
   *
   * @param base base currency code
   * @param targets target codes to keep, empty for all
   */
  public LatestRates getAllRates(String base, Collection<String> targets) {
    var normalizedBase = CurrencyPair.normalize(base);
    Set<String> symbols = new TreeSet<>();
    targets.forEach(target -> symbols.add(CurrencyPair.normalize(target)));
    var isConfiguredBase = normalizedBase.equals(baseCurrency);

    if (isConfiguredBase) {
      var cached = rateCache.getAllRates();
      if (cached.found() && !cached.value().isEmpty()) {
        var rates = new TreeMap<String, BigDecimal>();
        cached.value().forEach((target, rate) -> rates.put(target, rate.rate()));
        var fetchedAt =
            cached.value().values().stream()
                .map(CachedRate::fetchedAt)
                .max(Comparator.naturalOrder())
                .orElseGet(clock::instant);
        return filter(new LatestRates(normalizedBase, toDate(fetchedAt), rates), symbols);
      }
    }

    var stored = exchangeRateStore.getRatesForBase(normalizedBase);
    if (!stored.isEmpty()) {
      var rates = new TreeMap<String, BigDecimal>();
      stored.forEach(rate -> rates.put(rate.getTargetCurrency(), rate.getRate()));
      var fetchedAt =
          stored.stream()
              .map(ExchangeRate::getFetchedAt)
              .max(Comparator.naturalOrder())
              .orElseGet(clock::instant);

      if (isConfiguredBase) {
        rateCache.setAllRates(rates, fetchedAt);
      }
      return filter(new LatestRates(normalizedBase, toDate(fetchedAt), rates), symbols);
    }

    log.info("No stored rates for base {}, fetching from provider", normalizedBase);
    try {
      var fetched =
          symbols.isEmpty()
              ? exchangeRateProvider.getLatestRates(normalizedBase)
              : exchangeRateProvider.getLatestRatesForCurrencies(normalizedBase, symbols);

      if (isConfiguredBase && symbols.isEmpty()) {
        rateCache.setAllRates(fetched.rates(), clock.instant());
      }
      return filter(fetched, symbols);
    } catch (ExchangeRateProviderException e) {
      throw new ExchangeRateProviderException(
          "Failed to fetch rates for base " + normalizedBase + ": " + e.getMessage(), e);
    }
  }

  /**
   * Converts every item into {@code to}. The first item whose rate cannot be resolved fails the
   * whole batch; no partial result is returned.
   */
  public BulkConversion bulkConvert(List<BulkConvertItem> items, String to) {
    var target = CurrencyPair.normalize(to);
    var results = new ArrayList<BulkConvertResult>(items.size());
    var total = BigDecimal.ZERO;

    for (var item : items) {
      var pair = CurrencyPair.of(item.from(), target);
      var rate = getRate(pair);
      var converted = item.amount().multiply(rate);

      results.add(new BulkConvertResult(item.amount(), pair.base(), converted, rate));
      total = total.add(converted);
    }

    return new BulkConversion(results, target, total, getRateDate());
  }

  /**
   * Fetches the full rate table for the configured base currency, writes forward and inverse
   * rates to the cache, then persists all of them in one bulk upsert.
   *
   * <p>Non-positive quotes are skipped, so no inverse is ever computed from zero.
   *
   * @throws ExchangeRateProviderException if the provider call fails
   * @throws RatePersistenceException if the bulk upsert fails; the cache keeps the fresh rates but
   *     the refresh is reported as failed
   */
  public RateRefreshResult refreshRates() {
    var fetchedAt = clock.instant();

    LatestRates latest;
    try {
      latest = exchangeRateProvider.getLatestRates(baseCurrency);
    } catch (ExchangeRateProviderException e) {
      throw new ExchangeRateProviderException(
          "Failed to refresh rates for base " + baseCurrency + ": " + e.getMessage(), e);
    }

    var rows = new ArrayList<ExchangeRate>();
    var forwardRates = new LinkedHashMap<String, BigDecimal>();

    for (var entry : new TreeMap<>(latest.rates()).entrySet()) {
      var rate = entry.getValue();

      CurrencyPair pair;
      try {
        pair = CurrencyPair.of(baseCurrency, entry.getKey());
      } catch (InvalidCurrencyCodeException e) {
        log.warn("Skipping provider quote with invalid currency code: {}", entry.getKey());
        continue;
      }

      if (pair.isIdentity()) {
        continue;
      }
      if (rate == null || rate.signum() <= 0) {
        log.warn("Skipping non-positive provider quote for {}: {}", pair, rate);
        continue;
      }

      var inverse = BigDecimal.ONE.divide(rate, RATE_SCALE, RoundingMode.HALF_UP);

      rows.add(new ExchangeRate(pair.base(), pair.target(), rate, fetchedAt));
      rows.add(new ExchangeRate(pair.target(), pair.base(), inverse, fetchedAt));

      rateCache.setRate(pair, rate, fetchedAt);
      rateCache.setRate(pair.inverse(), inverse, fetchedAt);
      forwardRates.put(pair.target(), rate);
    }

    rateCache.setAllRates(forwardRates, fetchedAt);
    var stored = exchangeRateStore.bulkUpsertRates(rows);

    log.info(
        "Refreshed {} exchange rates for base {} (provider date {})",
        stored,
        baseCurrency,
        latest.date());

    return new RateRefreshResult(baseCurrency, latest.date(), stored, fetchedAt);
  }

  public List<SupportedCurrency> getSupportedCurrencies() {
    try {
      return exchangeRateProvider.getSupportedCurrencies().stream()
          .sorted(Comparator.comparing(SupportedCurrency::code))
          .toList();
    } catch (ExchangeRateProviderException e) {
      throw new ExchangeRateProviderException(
          "Failed to fetch supported currencies: " + e.getMessage(), e);
    }
  }

  /** Provider rates for a past date. Not cached and not stored. */
  public LatestRates getHistoricalRates(LocalDate date, String base) {
    var normalizedBase = CurrencyPair.normalize(base);
    try {
      return exchangeRateProvider.getHistoricalRates(date, normalizedBase);
    } catch (ExchangeRateProviderException e) {
      throw new ExchangeRateProviderException(
          "Failed to fetch historical rates for base "
              + normalizedBase
              + " on "
              + date
              + ": "
              + e.getMessage(),
          e);
    }
  }

  /**
   * UTC date of the most recent rate fetch in the store, or today when the store is empty or
   * cannot be read. Rates already resolved are still served when only the date lookup fails.
   */
  public LocalDate getRateDate() {
    try {
      return exchangeRateStore
          .getLatestFetchTime()
          .map(this::toDate)
          .orElseGet(() -> LocalDate.now(clock));
    } catch (RatePersistenceException e) {
      log.warn("Could not read latest fetch time, using today as rate date: {}", e.getMessage());
      return LocalDate.now(clock);
    }
  }

  private LatestRates filter(LatestRates rates, Set<String> symbols) {
    if (symbols.isEmpty()) {
      return rates;
    }

    var filtered = new TreeMap<String, BigDecimal>();
    rates
        .rates()
        .forEach(
            (target, rate) -> {
              if (symbols.contains(target)) {
                filtered.put(target, rate);
              }
            });
    return new LatestRates(rates.base(), rates.date(), filtered);
  }

  private LocalDate toDate(Instant instant) {
    return LocalDate.ofInstant(instant, ZoneOffset.UTC);
  }

  private static Instant oldest(Instant first, Instant second) {
    return first.isBefore(second) ? first : second;
  }

  private record ResolvedRate(BigDecimal rate, Instant fetchedAt) {

    static ResolvedRate from(CachedRate cached) {
      return new ResolvedRate(cached.rate(), cached.fetchedAt());
    }
  }
}
