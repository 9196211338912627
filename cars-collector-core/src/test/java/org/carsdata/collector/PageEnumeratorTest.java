package org.carsdata.collector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.carsdata.collector.ListingFixtures.*;
import static org.mockito.Mockito.*;

@DisplayName("PageEnumerator Tests")
@ExtendWith(MockitoExtension.class)
class PageEnumeratorTest {

	@Mock
	private ListingClient client;

	private Pipeline pipeline;

	private FailureLog failureLog;

	private RunCounters counters;

	private PageEnumerator enumerator;

	@BeforeEach
	void setUp() {
		pipeline = new Pipeline();
		failureLog = new FailureLog();
		counters = new RunCounters();
		ListingResponseParser parser = new ListingResponseParser(ObjectMapperFactory.create(), DETAIL_BASE);
		enumerator = new PageEnumerator(pipeline, client, parser, failureLog, counters, 1, Duration.ofMillis(10));
	}

	private List<DetailRequest> takeDetails() throws InterruptedException {
		List<DetailRequest> requests = new ArrayList<>();
		DetailRequest request;
		while ((request = pipeline.detailRequests().poll(Duration.ofMillis(10))) != null) {
			requests.add(request);
			pipeline.detailRequests().taskDone();
		}
		return requests;
	}

	@Nested
	@DisplayName("Page Handling")
	class PageHandlingTest {

		@Test
		@DisplayName("Should queue one detail request per listing and the next page")
		void shouldQueueDetailsAndNextPage() throws InterruptedException {
			when(client.get(START_URL)).thenReturn(searchPage("https://api.example.test/vehicle?page=2", "ABC:2020",
					"XYZ:2019"));

			enumerator.handle(PageLink.of(START_URL));

			assertThat(takeDetails()).extracting(DetailRequest::url)
				.containsExactly(detailUrl("ABC", 2020), detailUrl("XYZ", 2019));
			assertThat(pipeline.pageRequests().poll(Duration.ofMillis(10)))
				.isEqualTo(PageLink.of("https://api.example.test/vehicle?page=2"));
			assertThat(counters.snapshot().pagesFetched()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should carry the listing attributes as seed")
		void shouldCarrySeedAttributes() throws InterruptedException {
			when(client.get(START_URL)).thenReturn(searchPage("", "ABC:2020"));

			enumerator.handle(PageLink.of(START_URL));

			DetailRequest request = takeDetails().get(0);
			assertThat(request.seedAttributes().path("code").asText()).isEqualTo("ABC");
			assertThat(request.seedAttributes().path("year").asInt()).isEqualTo(2020);
		}

		@Test
		@DisplayName("Should skip listings without code or year")
		void shouldSkipListingsWithoutCode() throws InterruptedException {
			when(client.get(START_URL)).thenReturn("{\"links\":{\"next\":\"\"},\"data\":["
					+ "{\"attributes\":{\"year\":2020}},{\"attributes\":{\"code\":\"OK\",\"year\":2021}}]}");

			enumerator.handle(PageLink.of(START_URL));

			assertThat(takeDetails()).extracting(DetailRequest::url).containsExactly(detailUrl("OK", 2021));
		}

	}

	@Nested
	@DisplayName("Chain Termination")
	class ChainTerminationTest {

		@Test
		@DisplayName("Should stop the chain at an empty next link and drain all queues")
		void shouldStopAtEmptyNextLink() throws InterruptedException {
			when(client.get(START_URL)).thenReturn(searchPage("", "ABC:2020", "XYZ:2019"));
			CancellationToken token = new CancellationToken();
			Thread worker = new Thread(() -> enumerator.run(token));
			worker.start();

			pipeline.submitPage(PageLink.of(START_URL));
			assertThat(pipeline.pageRequests().awaitDrained(System.nanoTime() + Duration.ofSeconds(2).toNanos()))
				.isTrue();
			assertThat(takeDetails()).hasSize(2);

			token.cancel();
			worker.join(1000);

			assertThat(pipeline.pending().isZero()).isTrue();
			verify(client, times(1)).get(anyString());
		}

		@Test
		@DisplayName("Should end the lineage when a page fails")
		void shouldEndLineageOnFailure() {
			when(client.get(START_URL)).thenThrow(new ListingHttpClient.ListingApiException("Listing API error 500",
					500, "oops"));

			enumerator.handle(PageLink.of(START_URL));

			assertThat(pipeline.pending().isZero()).isTrue();
			assertThat(counters.snapshot().pagesFailed()).isEqualTo(1);
			assertThat(failureLog.snapshot()).singleElement().satisfies(failure -> {
				assertThat(failure.stage()).isEqualTo(WorkStage.PAGE);
				assertThat(failure.url()).isEqualTo(START_URL);
				assertThat(failure.statusCode()).isEqualTo(500);
			});
		}

		@Test
		@DisplayName("Should treat an unparseable page as a failed page")
		void shouldTreatUnparseablePageAsFailure() {
			when(client.get(START_URL)).thenReturn("<html>maintenance</html>");

			enumerator.handle(PageLink.of(START_URL));

			assertThat(pipeline.pending().isZero()).isTrue();
			assertThat(failureLog.snapshot()).singleElement()
				.satisfies(failure -> assertThat(failure.statusCode()).isEqualTo(-1));
		}

	}

}
