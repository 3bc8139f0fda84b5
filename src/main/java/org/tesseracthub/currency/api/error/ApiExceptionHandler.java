package org.tesseracthub.currency.api.error;

import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import org.tesseracthub.currency.service.exception.CurrencyServiceException;
import org.tesseracthub.currency.service.exception.ExchangeRateProviderException;
import org.tesseracthub.currency.service.exception.InvalidCurrencyCodeException;
import org.tesseracthub.currency.service.exception.RateNotFoundException;
import org.tesseracthub.currency.service.exception.RateNotQuotedException;
import org.tesseracthub.currency.service.exception.RatePersistenceException;

/** Renders every failure as an {@link ApiErrorResponse}. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidCurrencyCodeException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidCurrencyCode(
      InvalidCurrencyCodeException e) {
    log.info("Rejected request with invalid currency code: {}", e.getMessage());
    return respond(HttpStatus.BAD_REQUEST, ApiErrorType.INVALID_REQUEST, e);
  }

  @ExceptionHandler(RateNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleRateNotFound(RateNotFoundException e) {
    log.warn("No exchange rate for {}: {}", e.getPair(), e.getMessage());
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, ApiErrorType.APPLICATION_ERROR, e);
  }

  @ExceptionHandler(RateNotQuotedException.class)
  public ResponseEntity<ApiErrorResponse> handleRateNotQuoted(RateNotQuotedException e) {
    log.warn("Provider does not quote the requested currency: {}", e.getMessage());
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, ApiErrorType.APPLICATION_ERROR, e);
  }

  @ExceptionHandler({ExchangeRateProviderException.class, RatePersistenceException.class})
  public ResponseEntity<ApiErrorResponse> handleDependencyFailure(CurrencyServiceException e) {
    log.error("Dependency failure [{}]: {}", e.getCode(), e.getMessage(), e);
    return respond(HttpStatus.SERVICE_UNAVAILABLE, ApiErrorType.SERVICE_UNAVAILABLE, e);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    var message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));

    return ResponseEntity.badRequest()
        .body(
            ApiErrorResponse.builder()
                .type(ApiErrorType.VALIDATION_ERROR)
                .message(message.isEmpty() ? "Request validation failed" : message)
                .build());
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiErrorResponse> handleMalformedRequest(Exception e) {
    var message =
        e instanceof MethodArgumentTypeMismatchException mismatch
            ? "Invalid value for parameter '" + mismatch.getName() + "'"
            : e instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : e.getMessage();

    return ResponseEntity.badRequest()
        .body(
            ApiErrorResponse.builder().type(ApiErrorType.INVALID_REQUEST).message(message).build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception e) {
    if (e instanceof ErrorResponse errorResponse) {
      var status = errorResponse.getStatusCode();
      return ResponseEntity.status(status)
          .body(
              ApiErrorResponse.builder()
                  .type(typeOf(status))
                  .message(errorResponse.getBody().getDetail())
                  .build());
    }

    log.error("Unexpected error handling request", e);
    return ResponseEntity.internalServerError()
        .body(
            ApiErrorResponse.builder()
                .type(ApiErrorType.INTERNAL_ERROR)
                .message("Internal server error")
                .build());
  }

  private static ResponseEntity<ApiErrorResponse> respond(
      HttpStatus status, ApiErrorType type, CurrencyServiceException e) {
    return ResponseEntity.status(status)
        .body(
            ApiErrorResponse.builder()
                .type(type)
                .message(e.getMessage())
                .code(e.getCode())
                .build());
  }

  private static ApiErrorType typeOf(HttpStatusCode status) {
    return status.is4xxClientError() ? ApiErrorType.INVALID_REQUEST : ApiErrorType.INTERNAL_ERROR;
  }
}
