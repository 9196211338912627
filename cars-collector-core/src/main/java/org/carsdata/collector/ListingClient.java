package org.carsdata.collector;

/**
 * Interface for outbound calls to the vehicle listing API.
 *
 * <p>
 * Provides abstraction over the search and specification endpoints, enabling
 * testability and decorator implementations (retrying, logging).
 */
public interface ListingClient {

	/**
	 * Execute a GET request against an absolute URL.
	 * @param url full request URL, taken verbatim (e.g. a {@code links.next} value)
	 * @return Response body as String
	 * @throws ListingHttpClient.ListingApiException if the request fails or returns a
	 * non-success status
	 */
	String get(String url);

}
