package org.carsdata.collector.cli;

import org.carsdata.collector.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Cars Collector Spring Boot Application
 *
 * Spring Boot command-line application that collects vehicle listings. Defaults come from
 * {@code application.yaml} ({@code collector.*}); command-line arguments take precedence.
 *
 * Usage: java -cp cars-collector-cli.jar org.carsdata.collector.cli.CarsCollectorApp
 * --name NAME [OPTIONS]
 */
@SpringBootApplication
public class CarsCollectorApp implements CommandLineRunner {

	private static final Logger logger = LoggerFactory.getLogger(CarsCollectorApp.class);

	private final CarsCollectionService collectionService;

	private final CarsCollectorBuilder builder;

	private final CsvExportService csvExportService;

	private final ArgumentParser argumentParser;

	private final CollectionProperties properties;

	public CarsCollectorApp(CarsCollectionService collectionService, CarsCollectorBuilder builder,
			CsvExportService csvExportService, ArgumentParser argumentParser, CollectionProperties properties) {
		this.collectionService = collectionService;
		this.builder = builder;
		this.csvExportService = csvExportService;
		this.argumentParser = argumentParser;
		this.properties = properties;
	}

	public static void main(String[] args) {
		// Configure Spring Boot to run as console application
		SpringApplication app = new SpringApplication(CarsCollectorApp.class);
		app.setWebApplicationType(WebApplicationType.NONE);
		app.run(args);
	}

	@Override
	public void run(String... args) {
		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		// The services read the properties on every run
		config.applyTo(properties);

		if (config.exportCsv) {
			Path csvPath = config.csvOutput != null ? Paths.get(config.csvOutput)
					: Paths.get(config.outputDirectory, CsvExportService.DEFAULT_FILE_NAME);
			ExportResult export = csvExportService.export(builder.openStore(config.runName), csvPath);
			logger.info("Export completed: {} rows written to {}", export.rows(), export.csvPath());
			return;
		}

		CollectionResult result = collectionService
			.collect(new CollectionRequest(config.runName, config.startUrl, config.batchSize));
		logger.info("Collection completed: {} records in {}", result.stats().recordsPersisted(), result.storePath());
		if (!result.pending().isZero() || result.unflushedRecords() > 0) {
			throw new IllegalStateException("Collection did not complete: " + result.pending() + ", "
					+ result.unflushedRecords() + " records not persisted");
		}
	}

}
