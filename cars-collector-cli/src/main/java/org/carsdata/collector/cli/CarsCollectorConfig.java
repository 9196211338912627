package org.carsdata.collector.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.carsdata.collector.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the collector services. Properties are bound from
 * {@code application.yaml} under the {@code collector} prefix.
 */
@Configuration
@EnableConfigurationProperties
public class CarsCollectorConfig {

	@Bean
	@ConfigurationProperties(prefix = "collector")
	public CollectionProperties collectionProperties() {
		CollectionProperties properties = new CollectionProperties();
		EnvironmentSupport.applyOverrides(properties);
		return properties;
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public CarsCollectorBuilder carsCollectorBuilder(CollectionProperties properties, ObjectMapper objectMapper) {
		return CarsCollectorBuilder.create().properties(properties).objectMapper(objectMapper);
	}

	@Bean
	public CarsCollectionService carsCollectionService(CarsCollectorBuilder builder) {
		return builder.buildCollectionService();
	}

	@Bean
	public CsvExportService csvExportService(CarsCollectorBuilder builder) {
		return builder.buildCsvExportService();
	}

	@Bean
	public ArgumentParser argumentParser(CollectionProperties properties) {
		return new ArgumentParser(properties);
	}

}
