package org.carsdata.collector;

import org.jspecify.annotations.Nullable;

/**
 * Request parameters for one collection run.
 *
 * @param runName name of the run store file; {@code .json} is appended when missing
 * @param startUrl first search page, or null to use the configured start URL
 * @param batchSize records per flush, or 0 to use the configured batch size
 */
public record CollectionRequest(String runName, @Nullable String startUrl, int batchSize) {

	/**
	 * Minimum length of a run name (before the {@code .json} extension is added).
	 */
	public static final int MIN_RUN_NAME_LENGTH = 5;

	public CollectionRequest(String runName) {
		this(runName, null, 0);
	}

	/**
	 * Normalize a run name into a store file name.
	 * @param name the name given by the user
	 * @return the name with a {@code .json} extension
	 * @throws IllegalArgumentException if the name is shorter than
	 * {@link #MIN_RUN_NAME_LENGTH} or contains a path separator
	 */
	public static String toStoreFileName(@Nullable String name) {
		String trimmed = name == null ? "" : name.trim();
		if (trimmed.length() < MIN_RUN_NAME_LENGTH) {
			throw new IllegalArgumentException(
					"Run name '" + trimmed + "' is too short (at least " + MIN_RUN_NAME_LENGTH + " characters)");
		}
		if (trimmed.contains("/") || trimmed.contains("\\")) {
			throw new IllegalArgumentException("Run name '" + trimmed + "' must not contain path separators");
		}
		return trimmed.endsWith(".json") ? trimmed : trimmed + ".json";
	}

}
