package org.tesseracthub.currency.api.response;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

import org.tesseracthub.currency.scheduler.UpdaterStatus;

@Schema(description = "Current state of the background rate updater")
public record UpdaterStatusResponse(
    @Schema(
            description = "Whether periodic refreshes are scheduled",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "true")
        boolean running,
    @Schema(
            description = "Time of the last successful refresh",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "2025-11-03T15:30:00Z")
        Instant lastUpdate,
    @Schema(
            description = "Message of the most recent failure, cleared by a success",
            requiredMode = Schema.RequiredMode.NOT_REQUIRED,
            example = "Frankfurter API returned 503")
        String lastError,
    @Schema(
            description = "Interval between regular refreshes, ISO-8601 duration",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "PT1H")
        String interval,
    @Schema(
            description = "Retries scheduled in the current failure streak",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "0")
        int retryCount) {

  public static UpdaterStatusResponse from(UpdaterStatus status) {
    return new UpdaterStatusResponse(
        status.running(),
        status.lastUpdate(),
        status.lastError(),
        status.interval().toString(),
        status.retryCount());
  }
}
