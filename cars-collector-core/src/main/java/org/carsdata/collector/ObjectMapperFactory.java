package org.carsdata.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Jackson setup shared by the run store, the failures file and the response parser.
 *
 * <p>
 * Record components are written in snake_case, which gives stored records their
 * {@code car_attrs}/{@code car_specs} keys and failure entries their
 * {@code status_code}/{@code failed_at} keys. {@link java.time.Instant} values are written
 * as ISO-8601 strings.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create the mapper used across a collection run.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		return new ObjectMapper().registerModule(new JavaTimeModule())
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
	}

	/**
	 * Writer for files meant to be opened by people: the run store and the failures file
	 * are pretty-printed.
	 * @param mapper the run's mapper
	 * @return an indenting writer
	 */
	public static ObjectWriter fileWriter(ObjectMapper mapper) {
		return mapper.writerWithDefaultPrettyPrinter();
	}

}
