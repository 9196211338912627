package org.carsdata.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * The three work queues of a collection run and their completion semantics.
 *
 * <p>
 * Page links flow into {@link #pageRequests()}, the page enumerator feeds both
 * {@link #detailRequests()} and (with the next link) its own queue, detail fetchers feed
 * {@link #results()}, and the batch persister consumes the results. The total amount of
 * work is unknown up front; it ends when the page chain reaches {@link PageLink#TERMINAL}
 * or breaks on a failed page.
 *
 * <p>
 * Producers always put follow-up work before marking their own item done, so once the
 * page queue has drained no further detail requests can appear, and once the detail
 * queue has drained no further results can appear. {@link #drain()} relies on that
 * ordering.
 */
public class Pipeline {

	private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

	private final WorkQueue<PageLink> pageRequests = new WorkQueue<>("page-requests");

	private final WorkQueue<DetailRequest> detailRequests = new WorkQueue<>("detail-requests");

	private final WorkQueue<RawRecord> results = new WorkQueue<>("results");

	public WorkQueue<PageLink> pageRequests() {
		return pageRequests;
	}

	public WorkQueue<DetailRequest> detailRequests() {
		return detailRequests;
	}

	public WorkQueue<RawRecord> results() {
		return results;
	}

	/**
	 * Submit a page link for enumeration.
	 * @param link the link to fetch
	 * @return false if the link is the terminal sentinel, in which case nothing is
	 * submitted
	 */
	public boolean submitPage(PageLink link) {
		if (link.isTerminal()) {
			logger.info("Page chain exhausted, no further pages to fetch");
			return false;
		}
		pageRequests.put(link);
		return true;
	}

	public void submitDetail(DetailRequest request) {
		detailRequests.put(request);
	}

	public void submitResult(RawRecord record) {
		results.put(record);
	}

	/**
	 * Block until page requests, then detail requests, then results have no pending work.
	 * @throws InterruptedException if interrupted while waiting
	 */
	public void drain() throws InterruptedException {
		pageRequests.awaitDrained();
		logger.info("All pages enumerated, waiting for {} detail requests", detailRequests.pending());
		detailRequests.awaitDrained();
		logger.info("All requests done. Waiting for {} results to finish saving", results.pending());
		results.awaitDrained();
	}

	/**
	 * Like {@link #drain()} but gives up once the timeout has elapsed.
	 * @param timeout overall time limit across all three queues
	 * @return true if all queues drained in time
	 * @throws InterruptedException if interrupted while waiting
	 */
	public boolean drain(Duration timeout) throws InterruptedException {
		long deadline = System.nanoTime() + timeout.toNanos();
		return pageRequests.awaitDrained(deadline) && detailRequests.awaitDrained(deadline)
				&& results.awaitDrained(deadline);
	}

	public PendingWork pending() {
		return new PendingWork(pageRequests.pending(), detailRequests.pending(), results.pending());
	}

}
