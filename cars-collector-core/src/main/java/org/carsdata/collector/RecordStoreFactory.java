package org.carsdata.collector;

import java.nio.file.Path;

/**
 * Opens the {@link RecordStore} of a named run.
 */
@FunctionalInterface
public interface RecordStoreFactory {

	/**
	 * Open (without creating) the store of a run.
	 * @param outputDirectory directory holding run stores
	 * @param runName file name of the run store, e.g. {@code "weekly-run.json"}
	 * @return the store
	 */
	RecordStore open(Path outputDirectory, String runName);

}
