package org.carsdata.collector;

import java.time.Duration;

/**
 * Configuration properties for vehicle collection.
 *
 * <p>
 * Properties can be set directly via setters, passed to {@link CarsCollectorBuilder},
 * or bound from {@code application.yaml} under the {@code collector} prefix by the Spring
 * Boot entry point.
 *
 * <p>
 * Defaults match a full crawl of the public cars.co.za API. Lower the batch size and
 * flush timeout for quicker feedback on small runs.
 */
public class CollectionProperties {

	/**
	 * First search page of a run.
	 */
	private String startUrl = "https://api.cars.co.za/fw/public/v3/vehicle?page[offset]=0&page[limit]=20"
			+ "&include_featured=true&sort[date]=desc";

	/**
	 * Base URL of the specification endpoint; {@code /<code>/<year>} is appended.
	 */
	private String detailBaseUrl = "https://api.cars.co.za/fw/public/v2/specs";

	/**
	 * Number of concurrent search page workers.
	 */
	private int pageWorkers = 1;

	/**
	 * Number of concurrent specification workers.
	 */
	private int detailWorkers = 25;

	/**
	 * Number of records that triggers a flush.
	 */
	private int batchSize = 10_000;

	/**
	 * Maximum time records wait in memory before they are flushed.
	 */
	private Duration flushTimeout = Duration.ofSeconds(30);

	/**
	 * Timeout of a single HTTP request.
	 */
	private Duration requestTimeout = Duration.ofSeconds(30);

	/**
	 * Timeout for establishing a connection.
	 */
	private Duration connectTimeout = Duration.ofSeconds(30);

	/**
	 * How long to wait for workers to stop once the pipeline has drained.
	 */
	private Duration shutdownTimeout = Duration.ofMinutes(2);

	/**
	 * Directory holding run stores, failure files and run logs.
	 */
	private String outputDirectory = "runs";

	private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
			+ "Chrome/130.0.0.0 Safari/537.36 OPR/115.0.0.0";

	private String origin = "https://www.cars.co.za";

	private String referer = "https://www.cars.co.za/";

	/**
	 * Maximum number of retry attempts for failed API requests.
	 */
	private int maxRetries = 3;

	/**
	 * Initial delay between retry attempts (doubles on each retry).
	 */
	private Duration retryDelay = Duration.ofSeconds(1);

	/**
	 * What to do when the existing run store cannot be parsed.
	 */
	private CorruptStorePolicy corruptStorePolicy = CorruptStorePolicy.QUARANTINE;

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public String getStartUrl() {
		return startUrl;
	}

	public void setStartUrl(String startUrl) {
		this.startUrl = startUrl;
	}

	public String getDetailBaseUrl() {
		return detailBaseUrl;
	}

	public void setDetailBaseUrl(String detailBaseUrl) {
		this.detailBaseUrl = detailBaseUrl;
	}

	public int getPageWorkers() {
		return pageWorkers;
	}

	public void setPageWorkers(int pageWorkers) {
		this.pageWorkers = pageWorkers;
	}

	public int getDetailWorkers() {
		return detailWorkers;
	}

	public void setDetailWorkers(int detailWorkers) {
		this.detailWorkers = detailWorkers;
	}

	/**
	 * Returns the number of records that triggers a flush.
	 * @return the batch size
	 */
	public int getBatchSize() {
		return batchSize;
	}

	/**
	 * Sets the number of records that triggers a flush.
	 * @param batchSize positive record count
	 */
	public void setBatchSize(int batchSize) {
		this.batchSize = batchSize;
	}

	public Duration getFlushTimeout() {
		return flushTimeout;
	}

	public void setFlushTimeout(Duration flushTimeout) {
		this.flushTimeout = flushTimeout;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public void setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

	public Duration getShutdownTimeout() {
		return shutdownTimeout;
	}

	public void setShutdownTimeout(Duration shutdownTimeout) {
		this.shutdownTimeout = shutdownTimeout;
	}

	public String getOutputDirectory() {
		return outputDirectory;
	}

	public void setOutputDirectory(String outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public String getOrigin() {
		return origin;
	}

	public void setOrigin(String origin) {
		this.origin = origin;
	}

	public String getReferer() {
		return referer;
	}

	public void setReferer(String referer) {
		this.referer = referer;
	}

	/**
	 * Returns the maximum number of retry attempts.
	 * @return the max retries
	 */
	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * Sets the maximum number of retry attempts. Zero disables retrying.
	 * @param maxRetries the max retries
	 */
	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public Duration getRetryDelay() {
		return retryDelay;
	}

	public void setRetryDelay(Duration retryDelay) {
		this.retryDelay = retryDelay;
	}

	public CorruptStorePolicy getCorruptStorePolicy() {
		return corruptStorePolicy;
	}

	public void setCorruptStorePolicy(CorruptStorePolicy corruptStorePolicy) {
		this.corruptStorePolicy = corruptStorePolicy;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
