package org.carsdata.collector.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.carsdata.collector.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the plain Java entry point. The listing client is mocked; nothing leaves the
 * machine.
 */
@DisplayName("CarsCollectorCli Tests")
class CarsCollectorCliTest {

	private static final String START_URL = "https://api.example.test/vehicle?page[offset]=0";

	private static final String DETAIL_URL = "https://api.cars.co.za/fw/public/v2/specs/ABC/2020";

	@TempDir
	Path tempDir;

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	@Nested
	@DisplayName("Argument Handling")
	class ArgumentHandlingTest {

		@Test
		@DisplayName("Should print help and succeed")
		void shouldPrintHelp() {
			assertThat(CarsCollectorCli.run(new String[] { "--help" })).isZero();
		}

		@Test
		@DisplayName("Should fail on invalid arguments")
		void shouldFailOnInvalidArguments() {
			assertThat(CarsCollectorCli.run(new String[] { "--name", "abc" })).isEqualTo(1);
			assertThat(CarsCollectorCli.run(new String[] { "--batch-size", "0" })).isEqualTo(1);
		}

	}

	@Nested
	@DisplayName("Collection")
	class CollectionTest {

		@Test
		@DisplayName("Should collect into the output directory and exit with 0")
		void shouldCollect() throws Exception {
			ListingClient client = mock(ListingClient.class);
			when(client.get(START_URL)).thenReturn("{\"links\":{\"next\":\"\"},\"data\":["
					+ "{\"attributes\":{\"code\":\"ABC\",\"year\":2020}}]}");
			when(client.get(DETAIL_URL)).thenReturn("{\"data\":[[{\"title\":\"Engine\",\"attrs\":[]}]]}");

			int exitCode = CarsCollectorCli.run(new String[] { "-n", "cli-run", "-o", tempDir.toString(),
					"--start-url", START_URL, "--detail-workers", "2", "--flush-timeout", "1" },
					CarsCollectorBuilder.create().client(client));

			assertThat(exitCode).isZero();
			assertThat(objectMapper.readTree(tempDir.resolve("cli-run.json").toFile())).hasSize(1);
		}

		@Test
		@DisplayName("Should exit with 1 when the store is corrupt and the policy is fail")
		void shouldFailOnCorruptStore() throws Exception {
			Files.writeString(tempDir.resolve("cli-run.json"), "not json");
			ListingClient client = mock(ListingClient.class);
			when(client.get(START_URL)).thenReturn("{\"links\":{\"next\":\"\"},\"data\":["
					+ "{\"attributes\":{\"code\":\"ABC\",\"year\":2020}}]}");
			when(client.get(DETAIL_URL)).thenReturn("{\"data\":[[]]}");

			int exitCode = CarsCollectorCli.run(new String[] { "-n", "cli-run", "-o", tempDir.toString(),
					"--start-url", START_URL, "--on-corrupt", "fail" }, CarsCollectorBuilder.create().client(client));

			assertThat(exitCode).isEqualTo(1);
			assertThat(Files.readString(tempDir.resolve("cli-run.json"))).isEqualTo("not json");
		}

	}

	@Nested
	@DisplayName("CSV Export")
	class CsvExportTest {

		@Test
		@DisplayName("Should export an existing run to data.csv in the output directory")
		void shouldExportToDefaultCsv() throws Exception {
			Files.writeString(tempDir.resolve("old-run.json"),
					"[{\"car_attrs\":{\"code\":\"ABC\",\"year\":2020},\"car_specs\":[]}]");

			int exitCode = CarsCollectorCli
				.run(new String[] { "-n", "old-run", "-o", tempDir.toString(), "--export-csv" });

			assertThat(exitCode).isZero();
			assertThat(Files.readAllLines(tempDir.resolve("data.csv"))).containsExactly("code,year", "ABC,2020");
		}

		@Test
		@DisplayName("Should exit with 1 when the run does not parse")
		void shouldFailOnBrokenRun() throws Exception {
			Files.writeString(tempDir.resolve("old-run.json"), "{");

			assertThat(CarsCollectorCli.run(new String[] { "-n", "old-run", "-o", tempDir.toString(), "--export-csv" }))
				.isEqualTo(1);
		}

	}

}
