package org.carsdata.collector;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Run settings
	public @Nullable String runName;

	public String outputDirectory;

	public String startUrl;

	// Concurrency
	public int pageWorkers;

	public int detailWorkers;

	// Batching
	public int batchSize;

	public long flushTimeoutSeconds;

	// Failure handling
	public int maxRetries;

	public CorruptStorePolicy corruptStorePolicy;

	// Export mode: flatten an existing run instead of collecting
	public boolean exportCsv = false;

	public @Nullable String csvOutput = null; // default: data.csv in the output directory

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(CollectionProperties defaultProperties) {
		this.outputDirectory = defaultProperties.getOutputDirectory();
		this.startUrl = defaultProperties.getStartUrl();
		this.pageWorkers = defaultProperties.getPageWorkers();
		this.detailWorkers = defaultProperties.getDetailWorkers();
		this.batchSize = defaultProperties.getBatchSize();
		this.flushTimeoutSeconds = defaultProperties.getFlushTimeout().toSeconds();
		this.maxRetries = defaultProperties.getMaxRetries();
		this.corruptStorePolicy = defaultProperties.getCorruptStorePolicy();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Copy the parsed values onto the properties used to build the services.
	 * @param properties properties to update
	 */
	public void applyTo(CollectionProperties properties) {
		properties.setOutputDirectory(outputDirectory);
		properties.setStartUrl(startUrl);
		properties.setPageWorkers(pageWorkers);
		properties.setDetailWorkers(detailWorkers);
		properties.setBatchSize(batchSize);
		properties.setFlushTimeout(Duration.ofSeconds(flushTimeoutSeconds));
		properties.setMaxRetries(maxRetries);
		properties.setCorruptStorePolicy(corruptStorePolicy);
		properties.setVerbose(verbose);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "runName='" + runName + '\'' + ", outputDirectory='" + outputDirectory + '\''
				+ ", startUrl='" + startUrl + '\'' + ", pageWorkers=" + pageWorkers + ", detailWorkers="
				+ detailWorkers + ", batchSize=" + batchSize + ", flushTimeoutSeconds=" + flushTimeoutSeconds
				+ ", maxRetries=" + maxRetries + ", corruptStorePolicy=" + corruptStorePolicy + ", exportCsv="
				+ exportCsv + ", csvOutput='" + csvOutput + '\'' + ", verbose=" + verbose + ", helpRequested="
				+ helpRequested + '}';
	}

}
