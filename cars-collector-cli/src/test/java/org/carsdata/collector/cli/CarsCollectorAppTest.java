package org.carsdata.collector.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.carsdata.collector.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Runs {@link CarsCollectorApp} inside a Spring context with a mocked listing client.
 *
 * The app bean is declared by hand so the CommandLineRunner is only invoked by the tests.
 */
@SpringJUnitConfig(CarsCollectorAppTest.AppTestConfig.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@DisplayName("CarsCollectorApp Tests")
class CarsCollectorAppTest {

	private static final String START_URL = "https://api.example.test/vehicle?page[offset]=0";

	private static final String DETAIL_BASE = "https://api.cars.co.za/fw/public/v2/specs";

	@Configuration
	@Import(CarsCollectorConfig.class)
	static class AppTestConfig {

		@Bean
		@Primary
		CarsCollectorBuilder mockedClientBuilder(CollectionProperties properties, ObjectMapper objectMapper,
				ListingClient listingClient) {
			return CarsCollectorBuilder.create().properties(properties).objectMapper(objectMapper).client(listingClient);
		}

		@Bean
		CarsCollectorApp carsCollectorApp(CarsCollectionService collectionService, CarsCollectorBuilder builder,
				CsvExportService csvExportService, ArgumentParser argumentParser, CollectionProperties properties) {
			return new CarsCollectorApp(collectionService, builder, csvExportService, argumentParser, properties);
		}

	}

	@MockBean
	private ListingClient listingClient;

	@Autowired
	private CarsCollectorApp app;

	@Autowired
	private CollectionProperties properties;

	@TempDir
	Path tempDir;

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private void stubSinglePage() {
		when(listingClient.get(START_URL)).thenReturn("{\"links\":{\"next\":\"\"},\"data\":["
				+ "{\"attributes\":{\"code\":\"ABC\",\"year\":2020}},{\"attributes\":{\"code\":\"XYZ\",\"year\":2019}}]}");
		when(listingClient.get(DETAIL_BASE + "/ABC/2020")).thenReturn("{\"data\":[[]]}");
		when(listingClient.get(DETAIL_BASE + "/XYZ/2019")).thenReturn("{\"data\":[[]]}");
	}

	@Test
	@DisplayName("Should collect into the output directory given on the command line")
	void shouldApplyCommandLineOptions() throws Exception {
		stubSinglePage();

		app.run("-n", "app-run", "-o", tempDir.toString(), "--start-url", START_URL, "--batch-size", "1",
				"--flush-timeout", "600", "--detail-workers", "2");

		assertThat(objectMapper.readTree(tempDir.resolve("app-run.json").toFile())).hasSize(2);
		assertThat(properties.getOutputDirectory()).isEqualTo(tempDir.toString());
		assertThat(properties.getBatchSize()).isEqualTo(1);
		assertThat(properties.getFlushTimeout()).isEqualTo(Duration.ofSeconds(600));
		assertThat(properties.getDetailWorkers()).isEqualTo(2);
	}

	@Test
	@DisplayName("Should leave a corrupt store untouched and fail when the policy is fail")
	void shouldHonourFailPolicy() throws Exception {
		Files.writeString(tempDir.resolve("app-run.json"), "not json");
		stubSinglePage();

		assertThatThrownBy(() -> app.run("-n", "app-run", "-o", tempDir.toString(), "--start-url", START_URL,
				"--on-corrupt", "fail"))
			.isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("records not persisted");

		assertThat(Files.readString(tempDir.resolve("app-run.json"))).isEqualTo("not json");
		assertThat(properties.getCorruptStorePolicy()).isEqualTo(CorruptStorePolicy.FAIL);
	}

	@Test
	@DisplayName("Should reject invalid arguments before collecting")
	void shouldRejectInvalidArguments() {
		assertThatThrownBy(() -> app.run("-n", "app-run", "--batch-size", "0"))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("batch size");
		verifyNoInteractions(listingClient);
	}

}
