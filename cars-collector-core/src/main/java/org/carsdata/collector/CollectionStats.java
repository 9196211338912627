package org.carsdata.collector;

/**
 * Counters of a collection run.
 */
public record CollectionStats(int pagesFetched, int pagesFailed, int detailsFetched, int detailsFailed,
		int recordsPersisted, int flushes, int failedFlushes) {
}
