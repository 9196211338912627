package org.carsdata.collector;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Carries the logging context of the coordinating thread into worker threads.
 *
 * <p>
 * The coordinator puts {@link #RUN_KEY} (the run name) and {@link #RUN_LOG_KEY} (the path
 * of the run log without extension) into the MDC; a sifting appender can route all log
 * lines of a run into one file keyed on those values.
 */
public final class MdcContext {

	/**
	 * MDC key holding the run name.
	 */
	public static final String RUN_KEY = "run";

	/**
	 * MDC key holding the run log path without the {@code .log} extension.
	 */
	public static final String RUN_LOG_KEY = "runLog";

	private MdcContext() {
	}

	/**
	 * Wrap a task so that it runs with the caller's current MDC.
	 * @param task the task to wrap
	 * @return a task that installs the captured MDC, runs, and clears it
	 */
	public static Runnable wrap(Runnable task) {
		Map<String, String> parentMdc = MDC.getCopyOfContextMap();
		return () -> {
			if (parentMdc != null) {
				MDC.setContextMap(parentMdc);
			}
			try {
				task.run();
			}
			finally {
				MDC.clear();
			}
		};
	}

}
