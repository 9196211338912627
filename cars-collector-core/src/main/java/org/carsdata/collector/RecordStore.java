package org.carsdata.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Repository interface for the persisted records of one collection run.
 *
 * <p>
 * Abstracts file system operations to enable testability and alternative storage
 * implementations.
 */
public interface RecordStore {

	/**
	 * Location of the store.
	 * @return path of the store file
	 */
	Path location();

	/**
	 * Read the full history of persisted records.
	 * @return the records in flush order, empty if the store does not exist yet
	 * @throws RecordStoreException if the store cannot be read
	 */
	List<JsonNode> load();

	/**
	 * Durably append a batch. Readers of the store observe either the state before or
	 * the state after the call, never a partially written store.
	 * @param batch records to append, in order
	 * @throws RecordStoreException if the batch could not be persisted; the store is
	 * then unchanged
	 */
	void append(List<RawRecord> batch);

	/**
	 * Write the dead-letter entries of a run next to the store.
	 * @param failures the failures to write
	 * @return the written file, or null when there was nothing to write
	 */
	@Nullable
	default Path saveFailures(List<FailureRecord> failures) {
		// Default implementation does nothing - subclasses can override
		return null;
	}

}
