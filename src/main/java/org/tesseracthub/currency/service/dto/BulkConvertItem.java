package org.tesseracthub.currency.service.dto;

import java.math.BigDecimal;

public record BulkConvertItem(BigDecimal amount, String from) {}
