package org.carsdata.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Parses search page and specification responses of the listing API.
 */
public class ListingResponseParser {

	private static final Logger logger = LoggerFactory.getLogger(ListingResponseParser.class);

	private final ObjectMapper objectMapper;

	private final JsonNodeUtils jsonUtils;

	private final Supplier<String> detailBaseUrl;

	public ListingResponseParser(ObjectMapper objectMapper, String detailBaseUrl) {
		this(objectMapper, () -> detailBaseUrl);
	}

	/**
	 * Create a parser whose specification base URL is looked up for every request, so a
	 * changed configuration applies to the next run.
	 * @param objectMapper mapper used to read responses
	 * @param detailBaseUrl supplier of the specification base URL
	 */
	public ListingResponseParser(ObjectMapper objectMapper, Supplier<String> detailBaseUrl) {
		this.objectMapper = objectMapper;
		this.jsonUtils = new JsonNodeUtils();
		this.detailBaseUrl = detailBaseUrl;
	}

	/**
	 * Parse one search page.
	 * @param body raw response body
	 * @return the parsed page
	 * @throws ListingParseException if the body is not JSON or has no {@code links} or
	 * {@code data} block
	 */
	public SearchPage parseSearchPage(String body) {
		JsonNode root = readTree(body);
		if (!root.path("links").isObject()) {
			throw new ListingParseException("Search page has no 'links' object");
		}
		if (!root.path("data").isArray()) {
			throw new ListingParseException("Search page has no 'data' array");
		}

		PageLinks links = new PageLinks(link(root, "self"), link(root, "first"), link(root, "next"),
				link(root, "prev"), link(root, "last"));

		List<ObjectNode> listings = new ArrayList<>();
		for (JsonNode item : jsonUtils.getArray(root, "data")) {
			JsonNode attributes = item.path("attributes");
			if (attributes.isObject()) {
				listings.add((ObjectNode) attributes);
			}
			else {
				logger.warn("Skipping search result without attributes: {}", item);
			}
		}

		int currentPage = jsonUtils.getInt(root, "meta", "currentPage").orElse(0);
		int totalPages = jsonUtils.getInt(root, "meta", "totalPages").orElse(0);
		return new SearchPage(links, listings, currentPage, totalPages);
	}

	/**
	 * Build the specification request for one listing.
	 * @param attributes the listing's attributes
	 * @return the request, or empty when the listing has no {@code code} or {@code year},
	 * or either is blank
	 */
	public Optional<DetailRequest> toDetailRequest(ObjectNode attributes) {
		Optional<String> code = jsonUtils.getString(attributes, "code").filter(value -> !value.isBlank());
		Optional<String> year = jsonUtils.getString(attributes, "year").filter(value -> !value.isBlank());
		if (code.isEmpty() || year.isEmpty()) {
			logger.warn("Listing without code/year cannot be fetched: {}", attributes);
			return Optional.empty();
		}
		return Optional.of(new DetailRequest(baseUrl() + "/" + code.get() + "/" + year.get(), attributes));
	}

	/**
	 * Extract the specification payload ({@code data[0]}) of a detail response.
	 * @param body raw response body
	 * @return the payload node
	 * @throws ListingParseException if the body is not JSON or {@code data} is empty
	 */
	public JsonNode parseDetailPayload(String body) {
		JsonNode root = readTree(body);
		List<JsonNode> data = jsonUtils.getArray(root, "data");
		if (data.isEmpty()) {
			throw new ListingParseException("Specification response has no 'data' entries");
		}
		return data.get(0);
	}

	private String baseUrl() {
		String url = detailBaseUrl.get();
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

	private PageLink link(JsonNode root, String name) {
		return PageLink.of(jsonUtils.getString(root, "links", name).orElse(null));
	}

	private JsonNode readTree(String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new ListingParseException("Response is not valid JSON: " + e.getOriginalMessage(), e);
		}
	}

}
