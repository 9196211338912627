package org.carsdata.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Fetches the specification resource of one listing and emits the merged
 * {@link RawRecord}. Failed fetches are logged and recorded in the {@link FailureLog};
 * the item is not retried here (retrying belongs to the {@link ListingClient}).
 */
public class DetailFetcher extends QueueWorker<DetailRequest> {

	private static final Logger logger = LoggerFactory.getLogger(DetailFetcher.class);

	private final Pipeline pipeline;

	private final ListingClient client;

	private final ListingResponseParser parser;

	private final FailureLog failureLog;

	private final RunCounters counters;

	public DetailFetcher(Pipeline pipeline, ListingClient client, ListingResponseParser parser, FailureLog failureLog,
			RunCounters counters, int workerId) {
		this(pipeline, client, parser, failureLog, counters, workerId, DEFAULT_POLL_INTERVAL);
	}

	DetailFetcher(Pipeline pipeline, ListingClient client, ListingResponseParser parser, FailureLog failureLog,
			RunCounters counters, int workerId, Duration pollInterval) {
		super(pipeline.detailRequests(), "CAR_DATA_WORKER", workerId, pollInterval);
		this.pipeline = pipeline;
		this.client = client;
		this.parser = parser;
		this.failureLog = failureLog;
		this.counters = counters;
	}

	@Override
	public void handle(DetailRequest request) {
		JsonNode specs;
		try {
			specs = parser.parseDetailPayload(client.get(request.url()));
		}
		catch (RuntimeException e) {
			logger.error("{} {} ({})", prefix, e.getMessage(), request.url());
			failureLog.record(WorkStage.DETAIL, request.url(), e);
			counters.detailFailed();
			return;
		}

		pipeline.submitResult(RawRecord.merge(request, specs));
		counters.detailFetched();
		logger.debug("{} Finished {}", prefix, request.url());
	}

}
