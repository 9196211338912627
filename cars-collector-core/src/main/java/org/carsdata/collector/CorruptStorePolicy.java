package org.carsdata.collector;

/**
 * What a flush does when the existing store file cannot be parsed.
 */
public enum CorruptStorePolicy {

	/**
	 * Move the unreadable file aside ({@code <name>.corrupt-<epochMillis>}) and continue
	 * with an empty store. The old bytes stay on disk for manual recovery.
	 */
	QUARANTINE,

	/**
	 * Fail the flush. The batch stays in memory and the flush is retried at the next
	 * trigger, failing again until the file is repaired or removed.
	 */
	FAIL

}
