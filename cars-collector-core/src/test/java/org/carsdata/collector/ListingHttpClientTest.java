package org.carsdata.collector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ListingHttpClient Tests")
class ListingHttpClientTest {

	@Test
	@DisplayName("Should escape the brackets of pagination links")
	void shouldEscapePaginationBrackets() {
		URI uri = ListingHttpClient.toUri(ListingFixtures.START_URL);

		assertThat(uri.getRawQuery()).isEqualTo("page%5Boffset%5D=0&page%5Blimit%5D=20");
		assertThat(uri.getHost()).isEqualTo("api.example.test");
	}

	@Test
	@DisplayName("Should reject links that are not URLs")
	void shouldRejectInvalidUrl() {
		assertThatThrownBy(() -> ListingHttpClient.toUri("http://exa mple.test/%zz"))
			.isInstanceOf(ListingHttpClient.ListingApiException.class)
			.satisfies(e -> assertThat(((ListingHttpClient.ListingApiException) e).isRetryable()).isFalse());
	}

	@Test
	@DisplayName("Should classify retryable failures")
	void shouldClassifyRetryableFailures() {
		assertThat(new ListingHttpClient.ListingApiException("x", 503, null).isRetryable()).isTrue();
		assertThat(new ListingHttpClient.ListingApiException("x", 429, null).isRetryable()).isTrue();
		assertThat(new ListingHttpClient.ListingApiException("x", new java.io.IOException()).isRetryable()).isTrue();
		assertThat(new ListingHttpClient.ListingApiException("x", 404, null).isRetryable()).isFalse();
	}

}
