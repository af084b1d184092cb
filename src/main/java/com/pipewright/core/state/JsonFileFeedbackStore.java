package com.pipewright.core.state;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Feedback store persisted to a single JSON document.
 * <p>
 * Every mutation rewrites the document through a temp file and an atomic move, so a reader
 * never sees a half-written file. The document is loaded once at construction. Write failures
 * are logged; the in-memory state stays authoritative.
 */
public class JsonFileFeedbackStore extends FeedbackStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileFeedbackStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileFeedbackStore(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper()
                .findAndRegisterModules()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        load();
    }

    public Path file() {
        return file;
    }

    @Override
    protected synchronized void changed() {
        var snapshot = new StoreSnapshot(snapshotActive(), history());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            mapper.writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to persist feedback state to {}: {}", file, e.getMessage(), e);
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("No persisted feedback state at {}; starting empty", file);
            return;
        }
        try {
            StoreSnapshot snapshot = mapper.readValue(file.toFile(), StoreSnapshot.class);
            restore(snapshot.active(), snapshot.history());
            log.info("Loaded {} active feedback loops and {} history entries from {}",
                    snapshot.active().size(), snapshot.history().size(), file);
        } catch (IOException e) {
            log.error("Failed to load feedback state from {}; starting empty: {}", file, e.getMessage(), e);
        }
    }
}
