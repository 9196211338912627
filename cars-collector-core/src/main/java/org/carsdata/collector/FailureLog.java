package org.carsdata.collector;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Thread-safe collector of dropped work, written out at the end of a run.
 */
public class FailureLog {

	private final Queue<FailureRecord> failures = new ConcurrentLinkedQueue<>();

	public void record(WorkStage stage, String url, Exception cause) {
		int statusCode = cause instanceof ListingHttpClient.ListingApiException apiException
				? apiException.getStatusCode() : -1;
		String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
		failures.add(new FailureRecord(stage, url, reason, statusCode, Instant.now()));
	}

	public List<FailureRecord> snapshot() {
		return new ArrayList<>(failures);
	}

	public int size() {
		return failures.size();
	}

	public boolean isEmpty() {
		return failures.isEmpty();
	}

}
