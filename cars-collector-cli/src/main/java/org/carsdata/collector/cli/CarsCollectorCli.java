package org.carsdata.collector.cli;

import ch.qos.logback.classic.Level;
import org.carsdata.collector.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Cars Collector CLI Application
 *
 * Plain Java command-line application that collects vehicle listings and their
 * specifications into a JSON run store, or flattens an existing run into CSV. No Spring
 * dependencies - uses CarsCollectorBuilder for service wiring.
 *
 * Usage: java -jar cars-collector-cli.jar --name NAME [OPTIONS]
 *
 * Environment Variables: CARS_COLLECTOR_START_URL, CARS_COLLECTOR_OUTPUT_DIR
 *
 * Examples: java -jar cars-collector-cli.jar --name january-run java -jar
 * cars-collector-cli.jar --name smoke-test --batch-size 50 --detail-workers 4 java -jar
 * cars-collector-cli.jar --name january-run --export-csv
 */
public class CarsCollectorCli {

	private static final Logger logger = LoggerFactory.getLogger(CarsCollectorCli.class);

	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	/**
	 * Run the collector with the given arguments.
	 * @param args command-line arguments
	 * @return 0 on success, 1 on failure
	 */
	public static int run(String[] args) {
		return run(args, CarsCollectorBuilder.create());
	}

	static int run(String[] args, CarsCollectorBuilder builder) {
		CollectionProperties properties = new CollectionProperties();
		EnvironmentSupport.applyOverrides(properties);
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			System.err.println("Run with --help for usage.");
			return 1;
		}

		config.applyTo(properties);
		if (config.verbose) {
			enableDebugLogging();
		}
		logConfiguration(config);
		builder.properties(properties);

		try {
			if (config.exportCsv) {
				return exportCsv(builder, config);
			}
			CollectionResult result = builder.buildCollectionService()
				.collect(new CollectionRequest(config.runName, config.startUrl, config.batchSize));
			logResults(result, config.verbose);
			return result.pending().isZero() && result.unflushedRecords() == 0 ? 0 : 1;
		}
		catch (RuntimeException e) {
			logger.error("Collection failed: {}", e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}
	}

	private static int exportCsv(CarsCollectorBuilder builder, ParsedConfiguration config) {
		RecordStore store = builder.openStore(config.runName);
		Path csvPath = config.csvOutput != null ? Paths.get(config.csvOutput)
				: Paths.get(config.outputDirectory, CsvExportService.DEFAULT_FILE_NAME);
		ExportResult result = builder.buildCsvExportService().export(store, csvPath);
		logger.info("Export completed: {} rows, {} columns written to {}", result.rows(), result.columns(),
				result.csvPath());
		return 0;
	}

	private static void enableDebugLogging() {
		Logger collectorLogger = LoggerFactory.getLogger("org.carsdata.collector");
		if (collectorLogger instanceof ch.qos.logback.classic.Logger) {
			((ch.qos.logback.classic.Logger) collectorLogger).setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Run name: {}", config.runName);
		logger.info("  Output directory: {}", config.outputDirectory);
		if (config.exportCsv) {
			logger.info("  Mode: CSV export");
			logger.info("  CSV output: {}", config.csvOutput != null ? config.csvOutput : "(default)");
			return;
		}
		logger.info("  Start URL: {}", config.startUrl);
		logger.info("  Page workers: {}", config.pageWorkers);
		logger.info("  Detail workers: {}", config.detailWorkers);
		logger.info("  Batch size: {}", config.batchSize);
		logger.info("  Flush timeout: {}s", config.flushTimeoutSeconds);
		logger.info("  Max retries: {}", config.maxRetries);
		logger.info("  On corrupt store: {}", config.corruptStorePolicy);
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logResults(CollectionResult result, boolean verbose) {
		CollectionStats stats = result.stats();
		logger.info("Collection completed!");
		logger.info("Records persisted: {}", stats.recordsPersisted());
		logger.info("Run store: {}", result.storePath());
		if (result.failuresPath() != null) {
			logger.info("Failed requests ({}): {}", result.failures(), result.failuresPath());
		}
		if (verbose) {
			logger.info("Pages: {} fetched, {} failed", stats.pagesFetched(), stats.pagesFailed());
			logger.info("Details: {} fetched, {} failed", stats.detailsFetched(), stats.detailsFailed());
			logger.info("Flushes: {} ({} failed)", stats.flushes(), stats.failedFlushes());
		}
	}

}
