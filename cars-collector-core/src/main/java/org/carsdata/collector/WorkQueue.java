package org.carsdata.collector;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded blocking queue that tracks unfinished work.
 *
 * <p>
 * Every {@link #put} increments the pending count; consumers call {@link #taskDone()}
 * exactly once per item they took, after they have finished handling it (including
 * handing any follow-up work to other queues). The queue is drained when the count
 * reaches zero, which is what {@link #awaitDrained()} waits for.
 *
 * @param <T> the work item type
 */
public class WorkQueue<T> {

	private final String name;

	private final BlockingQueue<T> items = new LinkedBlockingQueue<>();

	private final ReentrantLock lock = new ReentrantLock();

	private final Condition drained = lock.newCondition();

	private int unfinished;

	public WorkQueue(String name) {
		this.name = name;
	}

	public String name() {
		return name;
	}

	/**
	 * Add an item and count it as pending work.
	 * @param item the work item
	 */
	public void put(T item) {
		lock.lock();
		try {
			unfinished++;
		}
		finally {
			lock.unlock();
		}
		items.add(item);
	}

	/**
	 * Take the next item, waiting up to the given timeout.
	 * @param timeout maximum time to wait
	 * @return the item, or null if none arrived in time
	 * @throws InterruptedException if interrupted while waiting
	 */
	@Nullable
	public T poll(Duration timeout) throws InterruptedException {
		return items.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
	}

	/**
	 * Mark one previously taken item as finished.
	 * @throws IllegalStateException if called more times than items were put
	 */
	public void taskDone() {
		lock.lock();
		try {
			if (unfinished <= 0) {
				throw new IllegalStateException("taskDone() called more times than items were put on " + name);
			}
			unfinished--;
			if (unfinished == 0) {
				drained.signalAll();
			}
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Number of items put but not yet marked done (queued plus in progress).
	 */
	public int pending() {
		lock.lock();
		try {
			return unfinished;
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Number of items waiting to be taken.
	 */
	public int queued() {
		return items.size();
	}

	/**
	 * Block until the pending count reaches zero.
	 * @throws InterruptedException if interrupted while waiting
	 */
	public void awaitDrained() throws InterruptedException {
		lock.lock();
		try {
			while (unfinished > 0) {
				drained.await();
			}
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Block until the pending count reaches zero or the deadline passes.
	 * @param deadlineNanos deadline as a {@link System#nanoTime()} value
	 * @return true if drained, false if the deadline passed first
	 * @throws InterruptedException if interrupted while waiting
	 */
	public boolean awaitDrained(long deadlineNanos) throws InterruptedException {
		lock.lock();
		try {
			while (unfinished > 0) {
				long remaining = deadlineNanos - System.nanoTime();
				if (remaining <= 0) {
					return false;
				}
				drained.awaitNanos(remaining);
			}
			return true;
		}
		finally {
			lock.unlock();
		}
	}

}
