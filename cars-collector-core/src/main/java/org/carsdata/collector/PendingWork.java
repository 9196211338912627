package org.carsdata.collector;

/**
 * Snapshot of the pending-work counts of the three pipeline queues.
 */
public record PendingWork(int pageRequests, int detailRequests, int results) {

	public boolean isZero() {
		return pageRequests == 0 && detailRequests == 0 && results == 0;
	}

}
