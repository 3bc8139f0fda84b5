package org.tesseracthub.currency.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the rate updater.
 *
 * @param running whether the regular refresh ticker is active
 * @param lastUpdate time of the last successful refresh, null before the first one
 * @param lastError message of the most recent failure, null after a success
 * @param interval configured interval between regular refreshes
 * @param retryCount retries scheduled in the current failure streak, 0 when none is pending
 */
public record UpdaterStatus(
    boolean running, Instant lastUpdate, String lastError, Duration interval, int retryCount) {}
