package org.carsdata.collector;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Fetches search pages and turns every listing into a {@link DetailRequest}.
 *
 * <p>
 * After a page's detail requests are queued, its {@code links.next} is submitted back to
 * the page queue, which keeps the queue feeding itself until the chain reaches
 * {@link PageLink#TERMINAL}. A page that fails to fetch or parse is logged, recorded and
 * dropped; no next link is submitted, so that lineage of the chain ends there.
 */
public class PageEnumerator extends QueueWorker<PageLink> {

	private static final Logger logger = LoggerFactory.getLogger(PageEnumerator.class);

	private final Pipeline pipeline;

	private final ListingClient client;

	private final ListingResponseParser parser;

	private final FailureLog failureLog;

	private final RunCounters counters;

	public PageEnumerator(Pipeline pipeline, ListingClient client, ListingResponseParser parser,
			FailureLog failureLog, RunCounters counters, int workerId) {
		this(pipeline, client, parser, failureLog, counters, workerId, DEFAULT_POLL_INTERVAL);
	}

	PageEnumerator(Pipeline pipeline, ListingClient client, ListingResponseParser parser, FailureLog failureLog,
			RunCounters counters, int workerId, Duration pollInterval) {
		super(pipeline.pageRequests(), "SEARCH_PAGE_WORKER", workerId, pollInterval);
		this.pipeline = pipeline;
		this.client = client;
		this.parser = parser;
		this.failureLog = failureLog;
		this.counters = counters;
	}

	@Override
	public void handle(PageLink link) {
		SearchPage page;
		try {
			page = parser.parseSearchPage(client.get(link.url()));
		}
		catch (RuntimeException e) {
			logger.error("{} {} ({})", prefix, e.getMessage(), link.url());
			failureLog.record(WorkStage.PAGE, link.url(), e);
			counters.pageFailed();
			return;
		}

		int queued = 0;
		for (ObjectNode listing : page.listings()) {
			Optional<DetailRequest> request = parser.toDetailRequest(listing);
			if (request.isPresent()) {
				pipeline.submitDetail(request.get());
				queued++;
			}
		}
		if (!pipeline.submitPage(page.links().next())) {
			logger.info("{} No next page after {}, page chain exhausted", prefix, link.url());
		}
		counters.pageFetched();

		logger.debug("{}[{}/{}] Finished {} ({} listings queued)", prefix, page.currentPage(), page.totalPages(),
				link.url(), queued);
	}

}
