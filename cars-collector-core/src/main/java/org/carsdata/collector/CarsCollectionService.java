package org.carsdata.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs one vehicle collection end to end.
 *
 * <p>
 * For each run a fresh {@link Pipeline} is created, the page enumerators, detail fetchers
 * and the batch persister are started on their own thread pools, the start link is
 * seeded into the page queue, and the caller blocks until the pipeline has drained. The
 * workers are then cancelled; the persister flushes anything it still holds before it
 * stops.
 *
 * <p>
 * Each worker gets its own {@link ListingClient} from the client factory so that
 * connection state is not shared between threads.
 */
public class CarsCollectionService {

	private static final Logger logger = LoggerFactory.getLogger(CarsCollectionService.class);

	private final Supplier<ListingClient> clientFactory;

	private final ListingResponseParser parser;

	private final RecordStoreFactory storeFactory;

	private final CollectionProperties properties;

	public CarsCollectionService(Supplier<ListingClient> clientFactory, ListingResponseParser parser,
			RecordStoreFactory storeFactory, CollectionProperties properties) {
		this.clientFactory = clientFactory;
		this.parser = parser;
		this.storeFactory = storeFactory;
		this.properties = properties;
	}

	/**
	 * Collect every listing reachable from the start page into the run store.
	 * @param request run parameters
	 * @return counters, failures and pending work of the finished run
	 * @throws IllegalArgumentException if the request or configuration is invalid
	 * @throws RecordStoreException if the output directory cannot be created or the
	 * store cannot be opened
	 */
	public CollectionResult collect(CollectionRequest request) {
		String storeFileName = CollectionRequest.toStoreFileName(request.runName());
		String startUrl = request.startUrl() != null ? request.startUrl() : properties.getStartUrl();
		int batchSize = request.batchSize() > 0 ? request.batchSize() : properties.getBatchSize();
		validateConfiguration();

		Path outputDir = Paths.get(properties.getOutputDirectory());
		try {
			Files.createDirectories(outputDir);
		}
		catch (IOException e) {
			throw new RecordStoreException("Failed to create output directory " + outputDir, e);
		}

		String runName = storeFileName.substring(0, storeFileName.length() - ".json".length());
		MDC.put(MdcContext.RUN_KEY, runName);
		MDC.put(MdcContext.RUN_LOG_KEY, outputDir.resolve(runName).toString());
		try {
			RecordStore store = storeFactory.open(outputDir, storeFileName);
			return runPipeline(storeFileName, store, startUrl, batchSize);
		}
		finally {
			MDC.remove(MdcContext.RUN_KEY);
			MDC.remove(MdcContext.RUN_LOG_KEY);
		}
	}

	private CollectionResult runPipeline(String storeFileName, RecordStore store, String startUrl, int batchSize) {
		Pipeline pipeline = new Pipeline();
		CancellationToken token = new CancellationToken();
		RunCounters counters = new RunCounters();
		FailureLog failures = new FailureLog();
		BatchPersister persister = new BatchPersister(pipeline.results(), store, batchSize,
				properties.getFlushTimeout(), counters);

		ExecutorService pageExecutor = Executors.newFixedThreadPool(properties.getPageWorkers(),
				namedThreads("page-worker"));
		ExecutorService detailExecutor = Executors.newFixedThreadPool(properties.getDetailWorkers(),
				namedThreads("detail-worker"));
		ExecutorService persisterExecutor = Executors.newSingleThreadExecutor(namedThreads("results-worker"));

		for (int i = 1; i <= properties.getPageWorkers(); i++) {
			PageEnumerator worker = new PageEnumerator(pipeline, clientFactory.get(), parser, failures, counters, i);
			pageExecutor.execute(MdcContext.wrap(() -> worker.run(token)));
		}
		for (int i = 1; i <= properties.getDetailWorkers(); i++) {
			DetailFetcher worker = new DetailFetcher(pipeline, clientFactory.get(), parser, failures, counters, i);
			detailExecutor.execute(MdcContext.wrap(() -> worker.run(token)));
		}
		persisterExecutor.execute(MdcContext.wrap(() -> persister.run(token)));

		logger.info("Starting collection into {} ({} page workers, {} detail workers, batch size {}, flush timeout {})",
				store.location(), properties.getPageWorkers(), properties.getDetailWorkers(), batchSize,
				properties.getFlushTimeout());
		pipeline.submitPage(PageLink.of(startUrl));

		boolean interrupted = false;
		try {
			pipeline.drain();
		}
		catch (InterruptedException e) {
			interrupted = true;
			logger.warn("Interrupted while waiting for the pipeline to drain, stopping workers");
		}

		token.cancel();
		stopWorkers(List.of(pageExecutor, detailExecutor, persisterExecutor));

		PendingWork pending = pipeline.pending();
		CollectionStats stats = counters.snapshot();
		Path failuresPath = saveFailures(store, failures);
		logSummary(storeFileName, stats, failures.size(), pending, persister.bufferedCount());

		if (interrupted) {
			Thread.currentThread().interrupt();
		}
		return new CollectionResult(storeFileName, store.location().toString(), stats, failures.size(),
				failuresPath != null ? failuresPath.toString() : null, pending, persister.bufferedCount());
	}

	private void validateConfiguration() {
		if (properties.getPageWorkers() <= 0) {
			throw new IllegalArgumentException("Page workers must be positive: " + properties.getPageWorkers());
		}
		if (properties.getDetailWorkers() <= 0) {
			throw new IllegalArgumentException("Detail workers must be positive: " + properties.getDetailWorkers());
		}
	}

	private void stopWorkers(List<ExecutorService> executors) {
		executors.forEach(ExecutorService::shutdown);
		Duration timeout = properties.getShutdownTimeout();
		try {
			for (ExecutorService executor : executors) {
				if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
					logger.warn("Workers did not stop within {}, interrupting", timeout);
					executor.shutdownNow();
					// Interrupted workers still finish their current flush before the result is read
					if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
						logger.error("Workers ignored the interrupt, abandoning them; unflushed records may be lost");
					}
				}
			}
		}
		catch (InterruptedException e) {
			executors.forEach(ExecutorService::shutdownNow);
			Thread.currentThread().interrupt();
		}
	}

	@Nullable
	private Path saveFailures(RecordStore store, FailureLog failures) {
		if (failures.isEmpty()) {
			return null;
		}
		try {
			return store.saveFailures(failures.snapshot());
		}
		catch (RecordStoreException e) {
			logger.error("Failed to write {} failure entries: {}", failures.size(), e.getMessage());
			return null;
		}
	}

	private void logSummary(String storeFileName, CollectionStats stats, int failureCount, PendingWork pending,
			int unflushed) {
		logger.info("Collection of {} finished", storeFileName);
		logger.info("  Pages fetched: {} (failed: {})", stats.pagesFetched(), stats.pagesFailed());
		logger.info("  Details fetched: {} (failed: {})", stats.detailsFetched(), stats.detailsFailed());
		logger.info("  Records persisted: {} in {} flushes (failed flushes: {})", stats.recordsPersisted(),
				stats.flushes(), stats.failedFlushes());
		if (failureCount > 0) {
			logger.warn("  {} units of work were dropped after retries", failureCount);
		}
		if (!pending.isZero()) {
			logger.warn("  Pipeline did not drain: {}", pending);
		}
		if (unflushed > 0) {
			logger.error("  {} records could not be persisted", unflushed);
		}
	}

	private static ThreadFactory namedThreads(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

}
