package org.carsdata.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RecordFlattener Tests")
class RecordFlattenerTest {

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private final RecordFlattener flattener = new RecordFlattener();

	@Test
	@DisplayName("Should flatten seed attributes, then image columns, then specification groups")
	void shouldFlattenRecord() throws Exception {
		String record = """
				{"car_attrs": {"code": "ABC", "image": {"path": "/img/1.jpg", "width": 640},
				               "year": 2020, "seller_types": ["dealer", "private"]},
				 "car_specs": [{"title": "Engine Details", "attrs": [{"label": "Power Output", "value": "100kW"},
				                                                     {"label": "Fuel", "value": "Petrol"}]},
				               {"title": "Size", "attrs": [{"label": "Doors", "value": 5}]}]}
				""";

		Map<String, String> row = flattener.flatten(objectMapper.readTree(record));

		assertThat(row).containsExactly(entry("code", "ABC"), entry("year", "2020"),
				entry("seller_types", "dealer,private"), entry("image_path", "/img/1.jpg"),
				entry("image_width", "640"), entry("engine_details_power_output", "100kW"),
				entry("engine_details_fuel", "Petrol"), entry("size_doors", "5"));
	}

	@Test
	@DisplayName("Should read specification groups nested under specs")
	void shouldReadNestedSpecs() throws Exception {
		String record = """
				{"car_attrs": {"code": "ABC"},
				 "car_specs": {"specs": [{"title": "Engine", "attrs": [{"label": "Power", "value": "100kW"}]}]}}
				""";

		assertThat(flattener.flatten(objectMapper.readTree(record))).containsEntry("engine_power", "100kW");
	}

	@Test
	@DisplayName("Should tolerate records without image, seller types or specs")
	void shouldTolerateSparseRecords() throws Exception {
		Map<String, String> row = flattener.flatten(objectMapper.readTree("{\"car_attrs\":{\"code\":\"X\",\"note\":null}}"));

		assertThat(row).containsExactly(entry("code", "X"), entry("note", ""));
	}

}
