package org.carsdata.collector;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Request to fetch the specification resource of one discovered listing.
 *
 * <p>
 * The seed attributes are the listing's {@code attributes} object from the search page.
 * They are copied on construction and carried through to the {@link RawRecord}
 * unchanged.
 *
 * @param url specification URL ({@code <detailBaseUrl>/<code>/<year>})
 * @param seedAttributes listing attributes captured at discovery time
 */
public record DetailRequest(String url, ObjectNode seedAttributes) {

	public DetailRequest {
		seedAttributes = seedAttributes.deepCopy();
	}

}
