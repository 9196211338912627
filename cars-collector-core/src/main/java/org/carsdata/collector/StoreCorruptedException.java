package org.carsdata.collector;

/**
 * Thrown when an existing store file is not a JSON array of records.
 */
public class StoreCorruptedException extends RecordStoreException {

	public StoreCorruptedException(String message) {
		super(message);
	}

	public StoreCorruptedException(String message, Throwable cause) {
		super(message, cause);
	}

}
