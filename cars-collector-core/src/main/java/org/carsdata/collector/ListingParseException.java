package org.carsdata.collector;

/**
 * Thrown when a listing API response does not have the expected shape.
 */
public class ListingParseException extends RuntimeException {

	public ListingParseException(String message) {
		super(message);
	}

	public ListingParseException(String message, Throwable cause) {
		super(message, cause);
	}

}
