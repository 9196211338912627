package org.carsdata.collector;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves environment variables from the system environment, falling back to a
 * {@code .env} file. The {@code .env} file is loaded once and cached for the
 * lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	private static final Logger logger = LoggerFactory.getLogger(EnvironmentSupport.class);

	/**
	 * Overrides {@link CollectionProperties#getStartUrl()}.
	 */
	public static final String START_URL = "CARS_COLLECTOR_START_URL";

	/**
	 * Overrides {@link CollectionProperties#getOutputDirectory()}.
	 */
	public static final String OUTPUT_DIR = "CARS_COLLECTOR_OUTPUT_DIR";

	private static final Dotenv DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		return DOTENV.get(name);
	}

	/**
	 * Apply the start URL and output directory overrides, where set, to the properties.
	 * @param properties properties to update
	 */
	public static void applyOverrides(CollectionProperties properties) {
		String startUrl = get(START_URL);
		if (startUrl != null && !startUrl.isBlank()) {
			logger.debug("Using start URL from {}", START_URL);
			properties.setStartUrl(startUrl.trim());
		}
		String outputDir = get(OUTPUT_DIR);
		if (outputDir != null && !outputDir.isBlank()) {
			logger.debug("Using output directory from {}", OUTPUT_DIR);
			properties.setOutputDirectory(outputDir.trim());
		}
	}

}
