package org.carsdata.collector;

/**
 * Pagination links block of a search page response.
 */
public record PageLinks(PageLink self, PageLink first, PageLink next, PageLink prev, PageLink last) {
}
