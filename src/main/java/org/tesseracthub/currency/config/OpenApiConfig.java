package org.tesseracthub.currency.config;

import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;

import org.tesseracthub.currency.api.error.ApiErrorResponse;
import org.tesseracthub.currency.api.error.ApiErrorType;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Currency Rate Service",
            version = "1.0",
            description = "Currency conversion and exchange rates backed by ECB reference rates",
            license = @License(name = "MIT", url = "https://opensource.org/licenses/MIT")),
    servers = {
      @Server(url = "http://localhost:8080", description = "Local environment"),
    })
public class OpenApiConfig {

  /** Adds the error responses every endpoint can produce, so controllers only list their own. */
  @Bean
  public OpenApiCustomizer standardErrorResponseCustomizer() {
    return openApi -> {
      if (openApi.getPaths() != null) {
        openApi
            .getPaths()
            .values()
            .forEach(
                pathItem -> pathItem.readOperationsMap().forEach(this::addStandardErrorResponses));
      }
    };
  }

  private void addStandardErrorResponses(PathItem.HttpMethod httpMethod, Operation operation) {
    // codes are validated on every endpoint that takes one
    if (httpMethod == PathItem.HttpMethod.GET || httpMethod == PathItem.HttpMethod.POST) {
      addResponse(operation, HttpStatus.BAD_REQUEST);
    }
    addResponse(operation, HttpStatus.INTERNAL_SERVER_ERROR);
    addResponse(operation, HttpStatus.SERVICE_UNAVAILABLE);
  }

  private void addResponse(Operation operation, HttpStatus httpStatus) {
    var code = String.valueOf(httpStatus.value());
    if (operation.getResponses().containsKey(code)) {
      return;
    }
    operation.getResponses().addApiResponse(code, buildExampleApiErrorResponse(httpStatus));
  }

  private ApiResponse buildExampleApiErrorResponse(HttpStatus httpStatus) {
    var exampleResponse =
        ApiErrorResponse.builder()
            .type(getTypeFromHttpStatus(httpStatus))
            .message(httpStatus.getReasonPhrase())
            .build();

    return new ApiResponse()
        .description(httpStatus.getReasonPhrase())
        .content(
            new Content()
                .addMediaType(
                    "application/json",
                    new MediaType()
                        .schema(new Schema<>().$ref("#/components/schemas/ApiErrorResponse"))
                        .example(exampleResponse)));
  }

  private ApiErrorType getTypeFromHttpStatus(HttpStatus httpStatus) {
    return switch (httpStatus) {
      case BAD_REQUEST -> ApiErrorType.INVALID_REQUEST;
      case SERVICE_UNAVAILABLE -> ApiErrorType.SERVICE_UNAVAILABLE;
      default -> ApiErrorType.INTERNAL_ERROR;
    };
  }
}
