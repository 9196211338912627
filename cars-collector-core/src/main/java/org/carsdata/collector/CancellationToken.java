package org.carsdata.collector;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal handed to every worker loop.
 */
public final class CancellationToken {

	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	public void cancel() {
		cancelled.set(true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

}
