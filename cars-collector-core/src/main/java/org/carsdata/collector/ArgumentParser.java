package org.carsdata.collector;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line argument parser for the cars collector. Pure Java implementation with no
 * Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private final CollectionProperties defaultProperties;

	public ArgumentParser(CollectionProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid; all problems found are
	 * reported together
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);
		List<String> errors = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-n", "--name":
					config.runName = getRequiredValue(args, i, "name");
					i++; // Skip next argument since we consumed it
					break;

				case "-o", "--output-dir":
					config.outputDirectory = getRequiredValue(args, i, "output-dir");
					i++;
					break;

				case "--start-url":
					config.startUrl = getRequiredValue(args, i, "start-url");
					i++;
					break;

				case "--page-workers":
					config.pageWorkers = parsePositiveInt(getRequiredValue(args, i, "page-workers"), "page workers",
							errors);
					i++;
					break;

				case "--detail-workers":
					config.detailWorkers = parsePositiveInt(getRequiredValue(args, i, "detail-workers"),
							"detail workers", errors);
					i++;
					break;

				case "-b", "--batch-size":
					config.batchSize = parsePositiveInt(getRequiredValue(args, i, "batch-size"), "batch size", errors);
					i++;
					break;

				case "--flush-timeout":
					config.flushTimeoutSeconds = parsePositiveInt(getRequiredValue(args, i, "flush-timeout"),
							"flush timeout", errors);
					i++;
					break;

				case "--max-retries":
					String retriesStr = getRequiredValue(args, i, "max-retries");
					try {
						config.maxRetries = Integer.parseInt(retriesStr);
						if (config.maxRetries < 0) {
							errors.add("Max retries must not be negative (got: " + config.maxRetries + ")");
						}
					}
					catch (NumberFormatException e) {
						errors.add("Invalid max retries '" + retriesStr + "': must be a non-negative integer");
					}
					i++;
					break;

				case "--on-corrupt":
					String policy = getRequiredValue(args, i, "on-corrupt").toLowerCase(Locale.ROOT);
					if (!List.of("quarantine", "fail").contains(policy)) {
						errors.add("Invalid corrupt store policy '" + policy + "': must be 'quarantine' or 'fail'");
					}
					else {
						config.corruptStorePolicy = CorruptStorePolicy.valueOf(policy.toUpperCase(Locale.ROOT));
					}
					i++;
					break;

				case "--export-csv":
					config.exportCsv = true;
					break;

				case "--csv-output":
					config.csvOutput = getRequiredValue(args, i, "csv-output");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						errors.add("Unknown option: " + arg);
					}
					else {
						errors.add("Unexpected argument: " + arg);
					}
					break;
			}
		}

		// Validate configuration
		validateConfiguration(config, errors);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: cars-collector -n NAME [OPTIONS]\n");
		help.append("\n");
		help.append("Collect vehicle listings and their specifications into a JSON run store.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("    -n, --name NAME           Run name, at least ")
			.append(CollectionRequest.MIN_RUN_NAME_LENGTH)
			.append(" characters; .json is appended (required)\n");
		help.append("    -o, --output-dir DIR      Directory for run stores and logs (default: ")
			.append(defaultProperties.getOutputDirectory())
			.append(")\n");
		help.append("    --start-url URL           First search page to fetch\n");
		help.append("    -v, --verbose             Enable verbose logging\n");
		help.append("\n");
		help.append("CONCURRENCY OPTIONS:\n");
		help.append("    --page-workers N          Search page workers (default: ")
			.append(defaultProperties.getPageWorkers())
			.append(")\n");
		help.append("    --detail-workers N        Specification workers (default: ")
			.append(defaultProperties.getDetailWorkers())
			.append(")\n");
		help.append("\n");
		help.append("PERSISTENCE OPTIONS:\n");
		help.append("    -b, --batch-size SIZE     Records per flush (default: ")
			.append(defaultProperties.getBatchSize())
			.append(")\n");
		help.append("    --flush-timeout SECONDS   Maximum time records stay in memory (default: ")
			.append(defaultProperties.getFlushTimeout().toSeconds())
			.append(")\n");
		help.append("    --on-corrupt POLICY       Existing store unreadable: quarantine, fail (default: ")
			.append(defaultProperties.getCorruptStorePolicy().name().toLowerCase(Locale.ROOT))
			.append(")\n");
		help.append("\n");
		help.append("FAILURE OPTIONS:\n");
		help.append("    --max-retries N           Retries for transient request failures (default: ")
			.append(defaultProperties.getMaxRetries())
			.append(")\n");
		help.append("                              Requests that still fail are listed in NAME.failures.json\n");
		help.append("\n");
		help.append("EXPORT OPTIONS:\n");
		help.append("    --export-csv              Flatten the records of run NAME into a CSV file\n");
		help.append("    --csv-output FILE         CSV file to write (default: ")
			.append(CsvExportService.DEFAULT_FILE_NAME)
			.append(" in the output directory)\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ")
			.append(EnvironmentSupport.START_URL)
			.append("   Default start URL\n");
		help.append("    ")
			.append(EnvironmentSupport.OUTPUT_DIR)
			.append("  Default output directory\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    cars-collector --name january-run\n");
		help.append("    cars-collector --name smoke-test --batch-size 50 --flush-timeout 5 --detail-workers 4\n");
		help.append("    cars-collector --name january-run --export-csv --csv-output january.csv\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parsePositiveInt(String value, String description, List<String> errors) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed <= 0) {
				errors.add(capitalize(description) + " must be positive (got: " + parsed + ")");
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			errors.add("Invalid " + description + " '" + value + "': must be a positive integer");
			return 0;
		}
	}

	private void validateConfiguration(ParsedConfiguration config, List<String> errors) {
		// Help needs no run name
		if (!config.helpRequested) {
			if (config.runName == null || config.runName.isBlank()) {
				errors.add("Run name is required (--name)");
			}
			else {
				try {
					config.runName = CollectionRequest.toStoreFileName(config.runName);
				}
				catch (IllegalArgumentException e) {
					errors.add(e.getMessage());
				}
			}
		}

		if (config.outputDirectory.isBlank()) {
			errors.add("Output directory cannot be empty");
		}

		if (!config.exportCsv && !config.startUrl.startsWith("http://") && !config.startUrl.startsWith("https://")) {
			errors.add("Start URL must be an http(s) URL (got: " + config.startUrl + ")");
		}

		if (config.csvOutput != null && !config.exportCsv) {
			errors.add("--csv-output requires --export-csv");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	private static String capitalize(String text) {
		return Character.toUpperCase(text.charAt(0)) + text.substring(1);
	}

}
