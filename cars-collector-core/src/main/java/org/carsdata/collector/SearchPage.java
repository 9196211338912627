package org.carsdata.collector;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * One parsed response of the paginated vehicle search endpoint.
 *
 * @param links pagination links; {@code links.next()} drives the page chain
 * @param listings the {@code attributes} object of every listing on the page
 * @param currentPage {@code meta.currentPage}, or 0 when absent
 * @param totalPages {@code meta.totalPages}, or 0 when absent
 */
public record SearchPage(PageLinks links, List<ObjectNode> listings, int currentPage, int totalPages) {

	public SearchPage {
		listings = List.copyOf(listings);
	}

}
