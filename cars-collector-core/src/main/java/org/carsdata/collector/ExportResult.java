package org.carsdata.collector;

/**
 * Outcome of a CSV export.
 *
 * @param csvPath the written file
 * @param rows number of data rows
 * @param columns number of columns in the header
 */
public record ExportResult(String csvPath, int rows, int columns) {
}
