package org.carsdata.collector;

import org.jspecify.annotations.Nullable;

/**
 * Link to the next search page to fetch.
 *
 * <p>
 * The empty link is the terminal sentinel: a page whose {@code links.next} is empty
 * (or missing) ends the pagination chain and nothing further is submitted.
 *
 * @param url the page URL, taken verbatim from the API response
 */
public record PageLink(String url) {

	/**
	 * The sentinel meaning "no further pages".
	 */
	public static final PageLink TERMINAL = new PageLink("");

	public PageLink {
		url = url == null ? "" : url.trim();
	}

	/**
	 * Create a link from a raw {@code links.next} value.
	 * @param url raw value, may be null
	 * @return the link, or {@link #TERMINAL} when the value is null or blank
	 */
	public static PageLink of(@Nullable String url) {
		if (url == null || url.isBlank()) {
			return TERMINAL;
		}
		return new PageLink(url);
	}

	public boolean isTerminal() {
		return url.isEmpty();
	}

}
