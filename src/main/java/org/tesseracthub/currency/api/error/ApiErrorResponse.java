package org.tesseracthub.currency.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Error returned by every endpoint when a request fails")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
    @Schema(
            description = "Error category",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "APPLICATION_ERROR")
        ApiErrorType type,
    @Schema(
            description = "Human readable description of the error",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "No exchange rate available for USD/XYZ")
        String message,
    @Schema(
            description = "Machine readable error code, present for application errors",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "RATE_NOT_FOUND")
        String code) {

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private ApiErrorType type;
    private String message;
    private String code;

    private Builder() {}

    public Builder type(ApiErrorType type) {
      this.type = type;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder code(String code) {
      this.code = code;
      return this;
    }

    public ApiErrorResponse build() {
      return new ApiErrorResponse(type, message, code);
    }
  }
}
