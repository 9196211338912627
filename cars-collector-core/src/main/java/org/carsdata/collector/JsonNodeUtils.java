package org.carsdata.collector;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Utility for JsonNode navigation.
 */
public class JsonNodeUtils {

	public Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target.asText());
	}

	public Optional<Integer> getInt(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target.asInt());
	}

	public List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);

		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}

		return List.of();
	}

	private JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
