package org.carsdata.collector;

/**
 * Thrown when the record store cannot be read or written.
 */
public class RecordStoreException extends RuntimeException {

	public RecordStoreException(String message) {
		super(message);
	}

	public RecordStoreException(String message, Throwable cause) {
		super(message, cause);
	}

}
