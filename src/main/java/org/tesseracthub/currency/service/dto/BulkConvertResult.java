package org.tesseracthub.currency.service.dto;

import java.math.BigDecimal;

public record BulkConvertResult(
    BigDecimal originalAmount, String fromCurrency, BigDecimal convertedAmount, BigDecimal rate) {}
