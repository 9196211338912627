package org.carsdata.collector;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One collected vehicle: the seed attributes from discovery together with the payload of
 * its specification fetch.
 *
 * <p>
 * Seed attributes and specification payload are kept under separate keys, so the fetched
 * payload never replaces a seed value. Both are defensive copies; a record never changes
 * after construction.
 *
 * @param carAttrs the listing attributes from the search page
 * @param carSpecs the specification payload ({@code data[0]} of the detail response)
 */
public record RawRecord(@JsonProperty("car_attrs") ObjectNode carAttrs, @JsonProperty("car_specs") JsonNode carSpecs) {

	public RawRecord {
		carAttrs = carAttrs.deepCopy();
		carSpecs = carSpecs.deepCopy();
	}

	/**
	 * Combine a detail request's seed attributes with the fetched payload.
	 * @param request the request that was fetched
	 * @param specs the fetched specification payload
	 * @return the merged record
	 */
	public static RawRecord merge(DetailRequest request, JsonNode specs) {
		return new RawRecord(request.seedAttributes(), specs);
	}

}
