package org.carsdata.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Single consumer of the result queue that accumulates records and flushes them to the
 * {@link RecordStore}.
 *
 * <p>
 * A flush is triggered when the batch reaches the size threshold, when a record arrives
 * and the flush timeout has elapsed since the last flush, or when the batch is non-empty
 * and nothing has been flushed for the flush timeout (idle flush). A failed flush keeps
 * the batch for the next trigger. Each record is marked done only after the flush
 * attempt that follows its arrival, i.e. once it is persisted or explicitly retained.
 *
 * <p>
 * This class is not thread-safe: exactly one thread runs {@link #run(CancellationToken)}.
 */
public class BatchPersister {

	private static final Logger logger = LoggerFactory.getLogger(BatchPersister.class);

	/**
	 * Persister states.
	 */
	public enum State {

		ACCUMULATING, FLUSHING

	}

	private final WorkQueue<RawRecord> results;

	private final RecordStore store;

	private final int batchSize;

	private final Duration flushTimeout;

	private final Duration pollInterval;

	private final RunCounters counters;

	private final String prefix;

	private final List<RawRecord> batch = new ArrayList<>();

	private volatile State state = State.ACCUMULATING;

	private volatile int buffered;

	private long lastFlushNanos;

	public BatchPersister(WorkQueue<RawRecord> results, RecordStore store, int batchSize, Duration flushTimeout,
			RunCounters counters) {
		if (batchSize <= 0) {
			throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
		}
		if (flushTimeout.isNegative() || flushTimeout.isZero()) {
			throw new IllegalArgumentException("Flush timeout must be positive: " + flushTimeout);
		}
		this.results = results;
		this.store = store;
		this.batchSize = batchSize;
		this.flushTimeout = flushTimeout;
		this.pollInterval = flushTimeout.compareTo(QueueWorker.DEFAULT_POLL_INTERVAL) < 0 ? flushTimeout
				: QueueWorker.DEFAULT_POLL_INTERVAL;
		this.counters = counters;
		this.prefix = QueueWorker.createLoggerPrefix("RESULTS", 1);
	}

	/**
	 * Consume results until cancelled, then flush whatever is still buffered.
	 * @param token cancellation signal
	 */
	public void run(CancellationToken token) {
		logger.info("{} Starting worker", prefix);
		lastFlushNanos = System.nanoTime();

		while (!token.isCancelled()) {
			RawRecord record;
			try {
				record = results.poll(pollInterval);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			}

			if (record == null) {
				if (!batch.isEmpty() && flushTimeoutElapsed()) {
					flush("idle");
				}
				continue;
			}

			try {
				accept(record);
			}
			finally {
				results.taskDone();
			}
		}

		if (!batch.isEmpty()) {
			flush("shutdown");
		}
		logger.debug("{} Worker stopped with {} records unflushed", prefix, batch.size());
	}

	private void accept(RawRecord record) {
		batch.add(record);
		buffered = batch.size();
		if (batch.size() >= batchSize) {
			flush("size");
		}
		else if (flushTimeoutElapsed()) {
			flush("interval");
		}
	}

	/**
	 * Attempt to persist the current batch. On success the batch is cleared; on failure
	 * it is retained. The last-flush time advances either way.
	 * @param trigger what caused the flush, for logging
	 * @return true if the batch was persisted
	 */
	boolean flush(String trigger) {
		state = State.FLUSHING;
		try {
			store.append(List.copyOf(batch));
			counters.flushed(batch.size());
			logger.info("{} Batch of {} items saved to {} ({} flush)", prefix, batch.size(),
					store.location().getFileName(), trigger);
			batch.clear();
			return true;
		}
		catch (RuntimeException e) {
			counters.flushFailed();
			logger.error("{} Error saving batch of {} items, keeping it for the next attempt: {}", prefix,
					batch.size(), e.getMessage());
			return false;
		}
		finally {
			buffered = batch.size();
			lastFlushNanos = System.nanoTime();
			state = State.ACCUMULATING;
		}
	}

	private boolean flushTimeoutElapsed() {
		return System.nanoTime() - lastFlushNanos >= flushTimeout.toNanos();
	}

	public State state() {
		return state;
	}

	/**
	 * Number of records currently held in memory awaiting a flush.
	 */
	public int bufferedCount() {
		return buffered;
	}

}
