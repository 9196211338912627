package org.carsdata.collector;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live counters shared by the workers of one run.
 */
public class RunCounters {

	private final AtomicInteger pagesFetched = new AtomicInteger();

	private final AtomicInteger pagesFailed = new AtomicInteger();

	private final AtomicInteger detailsFetched = new AtomicInteger();

	private final AtomicInteger detailsFailed = new AtomicInteger();

	private final AtomicInteger recordsPersisted = new AtomicInteger();

	private final AtomicInteger flushes = new AtomicInteger();

	private final AtomicInteger failedFlushes = new AtomicInteger();

	void pageFetched() {
		pagesFetched.incrementAndGet();
	}

	void pageFailed() {
		pagesFailed.incrementAndGet();
	}

	void detailFetched() {
		detailsFetched.incrementAndGet();
	}

	void detailFailed() {
		detailsFailed.incrementAndGet();
	}

	void flushed(int records) {
		flushes.incrementAndGet();
		recordsPersisted.addAndGet(records);
	}

	void flushFailed() {
		failedFlushes.incrementAndGet();
	}

	public CollectionStats snapshot() {
		return new CollectionStats(pagesFetched.get(), pagesFailed.get(), detailsFetched.get(), detailsFailed.get(),
				recordsPersisted.get(), flushes.get(), failedFlushes.get());
	}

}
