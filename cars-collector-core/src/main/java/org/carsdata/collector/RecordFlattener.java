package org.carsdata.collector;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a stored record into a single flat row for tabular export.
 *
 * <p>
 * Seed attributes are kept as columns. A list-valued {@code seller_types} is joined with
 * commas, the {@code image} object becomes {@code image_<key>} columns placed after the
 * other seed attributes, and every
 * specification attribute becomes a {@code <group title>_<label>} column, lower-cased
 * with spaces replaced by underscores. Specification columns overwrite seed columns of
 * the same name.
 */
public class RecordFlattener {

	private final JsonNodeUtils jsonUtils = new JsonNodeUtils();

	/**
	 * Flatten one record.
	 * @param record a stored record with {@code car_attrs} and {@code car_specs}
	 * @return the columns of the row in insertion order
	 */
	public Map<String, String> flatten(JsonNode record) {
		Map<String, String> row = new LinkedHashMap<>();

		JsonNode image = null;
		Iterator<Map.Entry<String, JsonNode>> fields = record.path("car_attrs").fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			String name = field.getKey();
			JsonNode value = field.getValue();
			if ("seller_types".equals(name) && value.isArray()) {
				row.put(name, joinValues(value));
			}
			else if ("image".equals(name) && value.isObject()) {
				image = value;
			}
			else {
				row.put(name, text(value));
			}
		}
		// Image columns follow the other seed attributes
		if (image != null) {
			image.fields().forEachRemaining(entry -> row.put("image_" + entry.getKey(), text(entry.getValue())));
		}

		for (JsonNode group : specGroups(record.path("car_specs"))) {
			String groupName = columnName(jsonUtils.getString(group, "title").orElse(""));
			for (JsonNode attribute : jsonUtils.getArray(group, "attrs")) {
				String label = columnName(jsonUtils.getString(attribute, "label").orElse(""));
				row.put(groupName + "_" + label, text(attribute.path("value")));
			}
		}
		return row;
	}

	// The specs payload is either the list of groups or an object holding it under "specs".
	private List<JsonNode> specGroups(JsonNode specs) {
		if (specs.isArray()) {
			List<JsonNode> groups = new ArrayList<>();
			specs.forEach(groups::add);
			return groups;
		}
		return jsonUtils.getArray(specs, "specs");
	}

	static String columnName(String title) {
		return title.replace(" ", "_").toLowerCase(Locale.ROOT);
	}

	private static String joinValues(JsonNode array) {
		List<String> values = new ArrayList<>();
		array.forEach(value -> values.add(text(value)));
		return String.join(",", values);
	}

	private static String text(JsonNode value) {
		if (value.isMissingNode() || value.isNull()) {
			return "";
		}
		return value.isValueNode() ? value.asText() : value.toString();
	}

}
