package org.carsdata.collector;

import org.jspecify.annotations.Nullable;

/**
 * Results of a collection run.
 *
 * @param runName store file name of the run
 * @param storePath path of the run store
 * @param stats counters of the run
 * @param failures number of dropped units of work
 * @param failuresPath file listing the dropped work, or null when nothing was dropped
 * @param pending pending work when the run ended; all zero after a complete drain
 * @param unflushedRecords records still in memory when the run ended (non-zero only when
 * the final flush failed)
 */
public record CollectionResult(String runName, String storePath, CollectionStats stats, int failures,
		@Nullable String failuresPath, PendingWork pending, int unflushedRecords) {
}
