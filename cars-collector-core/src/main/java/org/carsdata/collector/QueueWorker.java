package org.carsdata.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Base class for pipeline workers that consume one {@link WorkQueue}.
 *
 * <p>
 * The loop takes an item, hands it to {@link #handle(Object)} and marks it done exactly
 * once, whatever the outcome. Failures are contained per item: an exception escaping
 * {@code handle} is logged and the worker moves on to the next item. The loop polls with
 * a short interval so it notices cancellation without being interrupted.
 *
 * @param <T> the work item type
 */
public abstract class QueueWorker<T> {

	private static final Logger logger = LoggerFactory.getLogger(QueueWorker.class);

	static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);

	protected final WorkQueue<T> queue;

	protected final String prefix;

	private final Duration pollInterval;

	protected QueueWorker(WorkQueue<T> queue, String stageName, int workerId, Duration pollInterval) {
		this.queue = queue;
		this.prefix = createLoggerPrefix(stageName, workerId);
		this.pollInterval = pollInterval;
	}

	/**
	 * Process one unit of work. Implementations log and record their own expected
	 * failures; anything escaping is logged by the loop.
	 * @param item the work item
	 */
	public abstract void handle(T item);

	/**
	 * Run the worker loop until the token is cancelled or the thread is interrupted.
	 * @param token cancellation signal checked between items
	 */
	public void run(CancellationToken token) {
		logger.info("{} Starting worker", prefix);
		while (!token.isCancelled()) {
			T item = nextItem();
			if (item == null) {
				if (Thread.currentThread().isInterrupted()) {
					break;
				}
				continue;
			}
			try {
				handle(item);
			}
			catch (RuntimeException e) {
				logger.error("{} Unexpected failure: {}", prefix, e.getMessage(), e);
			}
			finally {
				queue.taskDone();
			}
		}
		logger.debug("{} Worker stopped", prefix);
	}

	@Nullable
	private T nextItem() {
		try {
			return queue.poll(pollInterval);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return null;
		}
	}

	static String createLoggerPrefix(String name, int workerId) {
		return String.format("[%-20s][%-2d]", name, workerId);
	}

}
