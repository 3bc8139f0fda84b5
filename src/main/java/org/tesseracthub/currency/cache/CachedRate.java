package org.tesseracthub.currency.cache;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Rate held in either cache tier.
 *
 * @param rate one unit of base expressed in target
 * @param fetchedAt time the provider observation was fetched
 * @param cachedAt time the entry was written to the cache
 */
public record CachedRate(BigDecimal rate, Instant fetchedAt, Instant cachedAt) {}
