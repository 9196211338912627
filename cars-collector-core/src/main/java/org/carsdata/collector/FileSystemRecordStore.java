package org.carsdata.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * File system implementation of {@link RecordStore}: one pretty-printed JSON array per
 * run.
 *
 * <p>
 * Every append reads the current file, appends the batch, writes the merged array to a
 * temporary sibling ({@code _<name>}) and moves it over the store file. The move is
 * atomic where the file system supports it, so external readers see either the old or
 * the new array.
 */
public class FileSystemRecordStore implements RecordStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemRecordStore.class);

	private final ObjectMapper objectMapper;

	private final Path storePath;

	private final Path tempPath;

	private final CorruptStorePolicy corruptStorePolicy;

	public FileSystemRecordStore(ObjectMapper objectMapper, Path storePath, CorruptStorePolicy corruptStorePolicy) {
		this.objectMapper = objectMapper;
		this.storePath = storePath;
		this.tempPath = storePath.resolveSibling("_" + storePath.getFileName());
		this.corruptStorePolicy = corruptStorePolicy;
	}

	@Override
	public Path location() {
		return storePath;
	}

	@Override
	public List<JsonNode> load() {
		List<JsonNode> records = new ArrayList<>();
		readStore().forEach(records::add);
		return records;
	}

	@Override
	public void append(List<RawRecord> batch) {
		if (batch.isEmpty()) {
			return;
		}

		ArrayNode merged;
		try {
			merged = readStore();
		}
		catch (StoreCorruptedException e) {
			if (corruptStorePolicy == CorruptStorePolicy.FAIL) {
				throw e;
			}
			quarantine(e);
			merged = objectMapper.createArrayNode();
		}

		for (RawRecord record : batch) {
			merged.add(objectMapper.valueToTree(record));
		}

		try {
			Files.createDirectories(storePath.toAbsolutePath().getParent());
			ObjectMapperFactory.fileWriter(objectMapper).writeValue(tempPath.toFile(), merged);
			moveIntoPlace(tempPath, storePath);
		}
		catch (IOException e) {
			deleteTempQuietly();
			throw new RecordStoreException("Failed to write " + storePath + ": " + e.getMessage(), e);
		}

		logger.debug("Batch of {} records saved to {} (total: {})", batch.size(), storePath.getFileName(),
				merged.size());
	}

	@Override
	@Nullable
	public Path saveFailures(List<FailureRecord> failures) {
		if (failures.isEmpty()) {
			return null;
		}

		String name = storePath.getFileName().toString();
		String base = name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
		Path failuresPath = storePath.resolveSibling(base + ".failures.json");
		try {
			ObjectMapperFactory.fileWriter(objectMapper).writeValue(failuresPath.toFile(), failures);
			logger.info("Wrote {} failed requests to {}", failures.size(), failuresPath);
			return failuresPath;
		}
		catch (IOException e) {
			throw new RecordStoreException("Failed to write failures file " + failuresPath, e);
		}
	}

	/**
	 * Replace the store file with the freshly written temporary file.
	 * @param source the temporary file
	 * @param target the store file
	 * @throws IOException if the move fails; the target is then left as it was
	 */
	protected void moveIntoPlace(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		}
		catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move not supported for {}, falling back to replace", target);
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private ArrayNode readStore() {
		if (!Files.exists(storePath)) {
			return objectMapper.createArrayNode();
		}

		JsonNode root;
		try {
			root = objectMapper.readTree(storePath.toFile());
		}
		catch (JsonProcessingException e) {
			throw new StoreCorruptedException("Invalid JSON in " + storePath + ": " + e.getOriginalMessage(), e);
		}
		catch (IOException e) {
			throw new RecordStoreException("Failed to read " + storePath + ": " + e.getMessage(), e);
		}

		if (root == null || !root.isArray()) {
			throw new StoreCorruptedException("Store " + storePath + " does not contain a JSON array");
		}
		return (ArrayNode) root;
	}

	private void quarantine(StoreCorruptedException cause) {
		Path quarantined = storePath.resolveSibling(storePath.getFileName() + ".corrupt-" + System.currentTimeMillis());
		try {
			Files.move(storePath, quarantined);
		}
		catch (IOException e) {
			throw new RecordStoreException("Failed to quarantine corrupt store " + storePath, e);
		}
		logger.error("{}. Moved it to {} and starting a new store", cause.getMessage(), quarantined.getFileName());
	}

	private void deleteTempQuietly() {
		try {
			Files.deleteIfExists(tempPath);
		}
		catch (IOException e) {
			logger.warn("Failed to delete temporary file {}: {}", tempPath, e.getMessage());
		}
	}

}
