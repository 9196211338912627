package org.carsdata.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * HTTP client for the listing API using the Java 11+ HttpClient.
 *
 * <p>
 * Sends the browser-like identity headers the public API expects and applies a fixed
 * per-request timeout. Every non-2xx status is raised as a {@link ListingApiException}.
 */
public class ListingHttpClient implements ListingClient {

	private static final Logger logger = LoggerFactory.getLogger(ListingHttpClient.class);

	private final HttpClient httpClient;

	private final CollectionProperties properties;

	public ListingHttpClient(CollectionProperties properties) {
		this.properties = properties;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(properties.getConnectTimeout())
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public String get(String url) {
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(toUri(url))
			.timeout(properties.getRequestTimeout())
			.header("User-Agent", properties.getUserAgent())
			.header("Origin", properties.getOrigin())
			.header("Referer", properties.getReferer())
			.header("Accept", "application/json")
			.GET()
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	/**
	 * Build a URI from a link as the API returns it. Pagination links carry unescaped
	 * brackets ({@code page[offset]=20}), which {@link URI} rejects.
	 */
	static URI toUri(String url) {
		String escaped = url.replace("[", "%5B").replace("]", "%5D").replace(" ", "%20");
		try {
			return URI.create(escaped);
		}
		catch (IllegalArgumentException e) {
			throw new ListingApiException("Invalid URL '" + url + "'", 400, null);
		}
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 404) {
				throw new ListingApiException("Not found: " + request.uri(), statusCode, response.body());
			}
			else if (statusCode == 429) {
				throw new ListingApiException("Too Many Requests (429): " + request.uri(), statusCode,
						response.body());
			}
			else {
				throw new ListingApiException("Listing API error " + statusCode + ": " + request.uri(), statusCode,
						response.body());
			}
		}
		catch (IOException e) {
			throw new ListingApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ListingApiException("HTTP request interrupted", e);
		}
	}

	/**
	 * Exception thrown when listing API calls fail.
	 *
	 * <p>
	 * A status code of {@code -1} means the request never produced a response
	 * (connection refused, timeout, interruption).
	 */
	public static class ListingApiException extends RuntimeException {

		private final int statusCode;

		@Nullable
		private final String responseBody;

		public ListingApiException(String message, int statusCode, @Nullable String responseBody) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
		}

		public ListingApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
		}

		public int getStatusCode() {
			return statusCode;
		}

		@Nullable
		public String getResponseBody() {
			return responseBody;
		}

		/**
		 * Returns true for failures worth another attempt: transport errors, 429 and
		 * 5xx.
		 */
		public boolean isRetryable() {
			return statusCode == -1 || statusCode == 429 || statusCode >= 500;
		}

	}

}
