package org.carsdata.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Decorator that adds bounded retry with exponential backoff to a {@link ListingClient}.
 *
 * <p>
 * Retries transport failures, 429 Too Many Requests and 5xx responses. Other 4xx
 * responses and exceptions that are not {@link ListingHttpClient.ListingApiException}s
 * are rethrown immediately. After the last attempt the final exception
 * propagates to the caller, which records it as a dropped unit of work.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * ListingClient client = RetryingListingClient.builder()
 *     .wrapping(new ListingHttpClient(properties))
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(2))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingListingClient implements ListingClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingListingClient.class);

	private static final long MAX_DELAY_MS = 30_000;

	private final ListingClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private RetryingListingClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String url) {
		ListingHttpClient.ListingApiException lastException = null;
		long delay = initialDelayMs;

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			try {
				return delegate.get(url);
			}
			catch (ListingHttpClient.ListingApiException e) {
				if (!e.isRetryable()) {
					throw e;
				}
				lastException = e;
			}

			if (attempt < maxRetries) {
				logger.warn("GET {} failed (attempt {}/{}): {}. Retrying in {}ms...", url, attempt + 1, maxRetries + 1,
						lastException.getMessage(), delay);
				sleep(delay);
				delay = Math.min(delay * 2, MAX_DELAY_MS);
			}
		}

		logger.debug("GET {} failed after {} attempts", url, maxRetries + 1);
		throw lastException;
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ListingHttpClient.ListingApiException("Retry interrupted", e);
		}
	}

	/**
	 * Builder for {@link RetryingListingClient}.
	 *
	 * <p>
	 * Defaults: 3 retries, 1 second initial delay.
	 */
	public static class Builder {

		private ListingClient delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the ListingClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(ListingClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 3, 0 disables retrying)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Build the RetryingListingClient.
		 * @return configured RetryingListingClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingListingClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A ListingClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingListingClient(this);
		}

	}

}
