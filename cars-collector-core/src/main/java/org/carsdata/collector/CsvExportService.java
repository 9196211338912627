package org.carsdata.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exports the records of a run store as a CSV file, one row per record.
 *
 * <p>
 * The header is the union of all flattened columns in the order they are first seen;
 * cells of columns a record does not have are left empty.
 */
public class CsvExportService {

	private static final Logger logger = LoggerFactory.getLogger(CsvExportService.class);

	/**
	 * File name used when no explicit CSV path is given.
	 */
	public static final String DEFAULT_FILE_NAME = "data.csv";

	private final RecordFlattener flattener;

	private final CsvMapper csvMapper = new CsvMapper();

	public CsvExportService(RecordFlattener flattener) {
		this.flattener = flattener;
	}

	/**
	 * Flatten every record of the store and write them to a CSV file.
	 * @param store the run store to read
	 * @param csvPath target file, replaced if it exists
	 * @return what was written
	 * @throws RecordStoreException if the store cannot be read or the CSV cannot be
	 * written
	 */
	public ExportResult export(RecordStore store, Path csvPath) {
		List<JsonNode> records = store.load();
		logger.debug("Data loaded with {} cars from {}", records.size(), store.location());

		List<Map<String, String>> rows = new ArrayList<>(records.size());
		Set<String> columns = new LinkedHashSet<>();
		for (JsonNode record : records) {
			Map<String, String> row = flattener.flatten(record);
			columns.addAll(row.keySet());
			rows.add(row);
		}

		CsvSchema.Builder schemaBuilder = CsvSchema.builder().setUseHeader(true);
		columns.forEach(schemaBuilder::addColumn);
		CsvSchema schema = schemaBuilder.build();

		try {
			Path parent = csvPath.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			try (SequenceWriter writer = csvMapper.writer(schema).writeValues(csvPath.toFile())) {
				for (Map<String, String> row : rows) {
					List<String> cells = new ArrayList<>(columns.size());
					for (String column : columns) {
						cells.add(row.getOrDefault(column, ""));
					}
					writer.write(cells);
				}
			}
		}
		catch (IOException e) {
			throw new RecordStoreException("Failed to write CSV export " + csvPath + ": " + e.getMessage(), e);
		}

		logger.info("Exported {} records with {} columns to {}", rows.size(), columns.size(), csvPath);
		return new ExportResult(csvPath.toString(), rows.size(), columns.size());
	}

}
