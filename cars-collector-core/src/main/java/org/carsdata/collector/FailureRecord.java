package org.carsdata.collector;

import java.time.Instant;

/**
 * Dead-letter entry for a unit of work that was dropped after its fetch failed.
 *
 * @param stage the stage that dropped the work
 * @param url the URL that could not be fetched or parsed
 * @param reason the failure message
 * @param statusCode HTTP status, or -1 when no response was received or parsing failed
 * @param failedAt when the failure was recorded
 */
public record FailureRecord(WorkStage stage, String url, String reason, int statusCode, Instant failedAt) {
}
