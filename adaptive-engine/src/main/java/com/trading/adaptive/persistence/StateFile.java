package com.trading.adaptive.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trading.adaptive.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Versioned JSON state file with atomic replacement.
 *
 * <p>Layout: {@code {"schemaVersion": n, "savedAt": "...", "state": {...}}}. Writes go to
 * {@code <name>.json.tmp} and are then moved over {@code <name>.json}, so a crash leaves either the old
 * or the new file, never a partial one. Reads treat a missing, unparsable or differently-versioned file
 * as "no prior state".
 *
 * @param <T> state record type
 */
public final class StateFile<T> {
    private static final Logger logger = LoggerFactory.getLogger(StateFile.class);

    private final Path file;
    private final Path tempFile;
    private final int schemaVersion;
    private final Class<T> type;
    private final Clock clock;
    private final ObjectMapper mapper = Json.mapper();

    public StateFile(Path directory, String name, int schemaVersion, Class<T> type, Clock clock) {
        this.file = directory.resolve(name + ".json");
        this.tempFile = directory.resolve(name + ".json.tmp");
        this.schemaVersion = schemaVersion;
        this.type = type;
        this.clock = clock;
    }

    public void write(T state) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ObjectNode envelope = mapper.createObjectNode();
            envelope.put("schemaVersion", schemaVersion);
            envelope.put("savedAt", Instant.now(clock).toString());
            envelope.set("state", mapper.valueToTree(state));

            mapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), envelope);
            try {
                Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move unsupported for {}, falling back to replace", file);
                Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("State written to {}", file);
        } catch (IOException | IllegalArgumentException e) {
            throw new StorageException("Failed to write state file " + file, e);
        }
    }

    public Optional<T> read() {
        if (!Files.isRegularFile(file)) {
            logger.debug("No state file at {}", file);
            return Optional.empty();
        }
        try {
            JsonNode envelope = mapper.readTree(file.toFile());
            int version = envelope.path("schemaVersion").asInt(-1);
            if (version != schemaVersion) {
                logger.warn("⚠️ Ignoring {}: schema version {} (expected {})", file, version, schemaVersion);
                return Optional.empty();
            }
            JsonNode state = envelope.get("state");
            if (state == null || state.isNull()) {
                logger.warn("⚠️ Ignoring {}: no state payload", file);
                return Optional.empty();
            }
            return Optional.ofNullable(mapper.treeToValue(state, type));
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("⚠️ Corrupt state file {}, starting fresh: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public Path path() {
        return file;
    }
}
