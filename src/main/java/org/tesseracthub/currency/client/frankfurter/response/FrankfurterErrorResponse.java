package org.tesseracthub.currency.client.frankfurter.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FrankfurterErrorResponse(String message) {}
