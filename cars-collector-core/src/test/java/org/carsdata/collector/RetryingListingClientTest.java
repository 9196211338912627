package org.carsdata.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingListingClient}.
 *
 * Tests retry logic, exponential backoff, and error classification.
 */
@DisplayName("RetryingListingClient Tests")
@ExtendWith(MockitoExtension.class)
class RetryingListingClientTest {

	private static final String URL = "https://api.example.test/vehicle?page[offset]=0";

	@Mock
	private ListingClient mockDelegate;

	private RetryingListingClient retryingClient;

	@BeforeEach
	void setUp() {
		// Use minimal delay for fast tests
		retryingClient = RetryingListingClient.builder().wrapping(mockDelegate).maxRetries(3).initialDelayMs(1).build();
	}

	private static ListingHttpClient.ListingApiException apiError(int status) {
		return new ListingHttpClient.ListingApiException("HTTP " + status, status, "body");
	}

	@Nested
	@DisplayName("Retry Behavior Tests")
	class RetryBehaviorTest {

		@Test
		@DisplayName("Should return immediately on first success")
		void shouldReturnImmediatelyOnSuccess() {
			when(mockDelegate.get(URL)).thenReturn("{\"data\":[]}");

			String result = retryingClient.get(URL);

			assertThat(result).isEqualTo("{\"data\":[]}");
			verify(mockDelegate, times(1)).get(URL);
		}

		@Test
		@DisplayName("Should retry on server error (5xx)")
		void shouldRetryOnServerError() {
			when(mockDelegate.get(URL)).thenThrow(apiError(502)).thenThrow(apiError(503)).thenReturn("success");

			String result = retryingClient.get(URL);

			assertThat(result).isEqualTo("success");
			verify(mockDelegate, times(3)).get(URL);
		}

		@Test
		@DisplayName("Should retry on rate limit error (429)")
		void shouldRetryOnRateLimitError() {
			when(mockDelegate.get(URL)).thenThrow(apiError(429)).thenReturn("success");

			assertThat(retryingClient.get(URL)).isEqualTo("success");
			verify(mockDelegate, times(2)).get(URL);
		}

		@Test
		@DisplayName("Should retry on transport failure")
		void shouldRetryOnTransportFailure() {
			when(mockDelegate.get(URL))
				.thenThrow(new ListingHttpClient.ListingApiException("Connection reset", new java.io.IOException()))
				.thenReturn("success");

			assertThat(retryingClient.get(URL)).isEqualTo("success");
			verify(mockDelegate, times(2)).get(URL);
		}

		@Test
		@DisplayName("Should NOT retry on 404 Not Found")
		void shouldNotRetryOnNotFound() {
			when(mockDelegate.get(URL)).thenThrow(apiError(404));

			assertThatThrownBy(() -> retryingClient.get(URL))
				.isInstanceOf(ListingHttpClient.ListingApiException.class)
				.hasMessageContaining("404");

			verify(mockDelegate, times(1)).get(URL);
		}

		@Test
		@DisplayName("Should NOT retry exceptions that are not API errors")
		void shouldNotRetryOtherExceptions() {
			when(mockDelegate.get(URL)).thenThrow(new IllegalStateException("bug"));

			assertThatThrownBy(() -> retryingClient.get(URL)).isInstanceOf(IllegalStateException.class);

			verify(mockDelegate, times(1)).get(URL);
		}

	}

	@Nested
	@DisplayName("Max Retries Tests")
	class MaxRetriesTest {

		@Test
		@DisplayName("Should stop after max retries and throw the last exception")
		void shouldStopAfterMaxRetries() {
			ListingHttpClient.ListingApiException last = apiError(500);
			when(mockDelegate.get(URL)).thenThrow(apiError(503)).thenThrow(apiError(503)).thenThrow(apiError(503))
				.thenThrow(last);

			assertThatThrownBy(() -> retryingClient.get(URL)).isSameAs(last);

			// Initial attempt + 3 retries = 4 total attempts
			verify(mockDelegate, times(4)).get(URL);
		}

		@Test
		@DisplayName("Should work with zero retries")
		void shouldWorkWithZeroRetries() {
			RetryingListingClient noRetryClient = RetryingListingClient.builder()
				.wrapping(mockDelegate)
				.maxRetries(0)
				.initialDelayMs(1)
				.build();
			when(mockDelegate.get(URL)).thenThrow(apiError(500));

			assertThatThrownBy(() -> noRetryClient.get(URL))
				.isInstanceOf(ListingHttpClient.ListingApiException.class);

			verify(mockDelegate, times(1)).get(URL);
		}

	}

	@Nested
	@DisplayName("Builder Tests")
	class BuilderTest {

		@Test
		@DisplayName("Should accept Duration for initial delay")
		void shouldAcceptDurationForInitialDelay() {
			RetryingListingClient client = RetryingListingClient.builder()
				.wrapping(mockDelegate)
				.initialDelay(Duration.ofMillis(1))
				.build();
			when(mockDelegate.get(URL)).thenReturn("success");

			assertThat(client.get(URL)).isEqualTo("success");
		}

		@Test
		@DisplayName("Should reject missing delegate")
		void shouldRejectMissingDelegate() {
			assertThatThrownBy(() -> RetryingListingClient.builder().build()).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("wrapping");
		}

		@Test
		@DisplayName("Should reject negative max retries")
		void shouldRejectNegativeMaxRetries() {
			assertThatThrownBy(() -> RetryingListingClient.builder().wrapping(mockDelegate).maxRetries(-1).build())
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("non-negative");
		}

		@Test
		@DisplayName("Should reject non-positive initial delay")
		void shouldRejectNonPositiveInitialDelay() {
			assertThatThrownBy(() -> RetryingListingClient.builder().wrapping(mockDelegate).initialDelayMs(0).build())
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("positive");
		}

	}

}
