package org.carsdata.collector.cli;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import org.carsdata.collector.MdcContext;

/**
 * Lets through only events logged while a collection run is in progress, so that the
 * per-run log appender never creates a file for start-up or export logging.
 */
public class RunScopedLogFilter extends Filter<ILoggingEvent> {

	@Override
	public FilterReply decide(ILoggingEvent event) {
		String runLog = event.getMDCPropertyMap().get(MdcContext.RUN_LOG_KEY);
		return runLog == null || runLog.isBlank() ? FilterReply.DENY : FilterReply.NEUTRAL;
	}

}
