package io.notelite.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notelite.core.Entity;
import io.notelite.core.EntityChecksums;
import io.notelite.storage.dto.EntityDto;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entity store persisted as a single JSON document.
 * <p>
 * Responsibilities:
 *  - Keep the working state in memory (inherited from {@link InMemoryEntityStore}).
 *  - On save(), serialize all entities and replace the file atomically.
 *  - On startup, load the file if present and check its checksum.
 * <p>
 * File layout: { "checksum": "...", "entities": [ ... ] }.
 */
public final class JsonFileEntityStore extends InMemoryEntityStore {
    private static final Logger log = Logger.getLogger(JsonFileEntityStore.class.getName());

    /** JSON root of the store file. */
    public static class StoreFile {
        public String checksum;
        public List<EntityDto> entities = new ArrayList<>();
    }

    private final Path file;
    private final ObjectMapper json = new ObjectMapper();

    public JsonFileEntityStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        recover();
    }

    @Override
    public synchronized void save() {
        StoreFile out = new StoreFile();
        List<Entity> all = findAll();
        out.entities = EntityDto.fromAll(all);
        out.checksum = EntityChecksums.of(all);
        try {
            AtomicFiles.write(file, json.writeValueAsBytes(out));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize entity store", e);
        }
        super.save();
    }

    public Path file() {
        return file;
    }

    private void recover() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            StoreFile in = json.readValue(file.toFile(), StoreFile.class);
            List<Entity> entities = EntityDto.toEntities(in.entities);
            String actual = EntityChecksums.of(entities);
            if (in.checksum != null && !in.checksum.equals(actual)) {
                // Still load: the integrity monitor reports and repairs from here.
                log.log(Level.WARNING, "Entity store checksum mismatch in " + file
                        + " (expected " + in.checksum + ", got " + actual + ")");
            }
            load(entities);
            log.info("Loaded " + entities.size() + " entities from " + file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load entity store from " + file, e);
        }
    }
}
