package org.tesseracthub.currency.service.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Result of converting a batch of amounts into one target currency.
 *
 * @param results one entry per input item, in input order
 * @param targetCurrency currency every amount was converted into
 * @param totalAmount sum of all converted amounts
 * @param rateDate date of the most recent rate observation in the store
 */
public record BulkConversion(
    List<BulkConvertResult> results,
    String targetCurrency,
    BigDecimal totalAmount,
    LocalDate rateDate) {}
