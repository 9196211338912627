package org.carsdata.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Builder for creating collector services without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults: full crawl of the public API into ./runs
 * CarsCollectionService collector = CarsCollectorBuilder.create().buildCollectionService();
 *
 * // With custom configuration
 * CollectionProperties props = new CollectionProperties();
 * props.setBatchSize(500);
 * props.setDetailWorkers(10);
 *
 * CarsCollectionService collector = CarsCollectorBuilder.create()
 *     .properties(props)
 *     .buildCollectionService();
 *
 * CollectionResult result = collector.collect(new CollectionRequest("january-run"));
 *
 * // For testing with a mock client
 * ListingClient mockClient = mock(ListingClient.class);
 * CarsCollectionService testCollector = CarsCollectorBuilder.create()
 *     .client(mockClient)
 *     .buildCollectionService();
 * }
 * </pre>
 */
public class CarsCollectorBuilder {

	private CollectionProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable Supplier<ListingClient> clientFactory;

	private @Nullable RecordStoreFactory storeFactory;

	private CarsCollectorBuilder() {
		this.properties = new CollectionProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new CarsCollectorBuilder
	 */
	public static CarsCollectorBuilder create() {
		return new CarsCollectorBuilder();
	}

	/**
	 * Set collection properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public CarsCollectorBuilder properties(@Nullable CollectionProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Apply start URL and output directory overrides from {@code .env} or the
	 * environment ({@code CARS_COLLECTOR_START_URL}, {@code CARS_COLLECTOR_OUTPUT_DIR}).
	 * @return this builder
	 */
	public CarsCollectorBuilder environmentOverrides() {
		EnvironmentSupport.applyOverrides(properties);
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public CarsCollectorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Use one client instance for every worker. Useful for testing with mocks.
	 * @param client the client (null to use default)
	 * @return this builder
	 */
	public CarsCollectorBuilder client(@Nullable ListingClient client) {
		this.clientFactory = client != null ? () -> client : null;
		return this;
	}

	/**
	 * Set a factory that creates one client per worker. Useful for adding decorators
	 * (caching, logging, rate limiting).
	 * @param clientFactory client factory (null to use default)
	 * @return this builder
	 */
	public CarsCollectorBuilder clientFactory(@Nullable Supplier<ListingClient> clientFactory) {
		this.clientFactory = clientFactory;
		return this;
	}

	/**
	 * Set a custom RecordStoreFactory. Useful for testing with mocks or for alternative
	 * storage backends.
	 * @param storeFactory custom store factory (null to use default)
	 * @return this builder
	 */
	public CarsCollectorBuilder storeFactory(@Nullable RecordStoreFactory storeFactory) {
		this.storeFactory = storeFactory;
		return this;
	}

	/**
	 * Build a CarsCollectionService.
	 * @return configured CarsCollectionService
	 */
	public CarsCollectionService buildCollectionService() {
		ObjectMapper mapper = resolveObjectMapper();
		Supplier<ListingClient> clients = this.clientFactory != null ? this.clientFactory : this::createDefaultClient;
		ListingResponseParser parser = new ListingResponseParser(mapper, properties::getDetailBaseUrl);
		return new CarsCollectionService(clients, parser, resolveStoreFactory(mapper), properties);
	}

	/**
	 * Build a CsvExportService.
	 * @return configured CsvExportService
	 */
	public CsvExportService buildCsvExportService() {
		return new CsvExportService(new RecordFlattener());
	}

	/**
	 * Open the store of an existing run in the configured output directory.
	 * @param runName run name, {@code .json} is appended when missing
	 * @return the run store
	 */
	public RecordStore openStore(String runName) {
		return resolveStoreFactory(resolveObjectMapper()).open(Path.of(properties.getOutputDirectory()),
				CollectionRequest.toStoreFileName(runName));
	}

	private ObjectMapper resolveObjectMapper() {
		return this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
	}

	private RecordStoreFactory resolveStoreFactory(ObjectMapper mapper) {
		if (this.storeFactory != null) {
			return this.storeFactory;
		}
		CollectionProperties settings = this.properties;
		// Policy is read when the store is opened, after any command-line override
		return (outputDirectory, storeFileName) -> new FileSystemRecordStore(mapper,
				outputDirectory.resolve(storeFileName), settings.getCorruptStorePolicy());
	}

	private ListingClient createDefaultClient() {
		return RetryingListingClient.builder()
			.wrapping(new ListingHttpClient(properties))
			.maxRetries(properties.getMaxRetries())
			.initialDelay(properties.getRetryDelay())
			.build();
	}

}
