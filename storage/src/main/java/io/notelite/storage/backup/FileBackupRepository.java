package io.notelite.storage.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notelite.core.Entity;
import io.notelite.core.EntityChecksums;
import io.notelite.storage.AtomicFiles;
import io.notelite.storage.dto.BackupFileDto;
import io.notelite.storage.dto.EntityDto;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * One JSON file per backup, named {@code <id>.backup}.
 * <p>
 * Format: { id, createdAtMillis, type, trigger, checksum, size, entityCount, entities }.
 * checksum and size describe the serialized entity export, so a load can recompute both.
 * <p>
 * Atomicity:
 *   - files are written through {@link AtomicFiles} (temp file, force, rename),
 *   - a load that cannot parse or verify the file fails closed.
 */
public final class FileBackupRepository implements BackupRepository {
    private static final Logger log = Logger.getLogger(FileBackupRepository.class.getName());

    public static final String SUFFIX = ".backup";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final Path dir;
    private final ObjectMapper json = new ObjectMapper();

    public FileBackupRepository(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create backup directory " + dir, e);
        }
    }

    public Path dir() {
        return dir;
    }

    @Override
    public BackupHeader write(String id, Instant createdAt, BackupTrigger trigger, List<Entity> entities) {
        Path file = fileFor(id);
        BackupFileDto dto = new BackupFileDto();
        dto.id = id;
        dto.createdAtMillis = createdAt.toEpochMilli();
        dto.trigger = trigger.name();
        dto.entities = EntityDto.fromAll(entities);
        dto.entityCount = entities.size();
        dto.checksum = EntityChecksums.of(entities);
        try {
            dto.size = json.writeValueAsBytes(dto.entities).length;
            AtomicFiles.write(file, json.writeValueAsBytes(dto));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize backup " + id, e);
        }
        return header(dto);
    }

    @Override
    public StoredBackup load(String id) {
        Path file = fileFor(id);
        if (!Files.exists(file)) {
            throw new BackupVerificationException(id, BackupVerificationException.Reason.NOT_FOUND,
                    "Backup " + id + " not found", null);
        }
        BackupFileDto dto;
        List<Entity> entities;
        long size;
        try {
            dto = json.readValue(file.toFile(), BackupFileDto.class);
            entities = EntityDto.toEntities(dto.entities);
            size = json.writeValueAsBytes(dto.entities).length;
        } catch (IOException | RuntimeException e) {
            throw mismatch(id, "unreadable backup file: " + e.getMessage(), e);
        }
        if (!id.equals(dto.id) || !"full".equals(dto.type)) {
            throw mismatch(id, "backup header does not belong to " + id, null);
        }
        if (dto.entityCount != entities.size() || dto.size != size) {
            throw mismatch(id, "expected " + dto.entityCount + " entities / " + dto.size
                    + " bytes, found " + entities.size() + " / " + size, null);
        }
        String actual = EntityChecksums.of(entities);
        if (!actual.equals(dto.checksum)) {
            throw mismatch(id, "checksum " + dto.checksum + " does not match content " + actual, null);
        }
        BackupHeader header;
        try {
            header = header(dto);
        } catch (RuntimeException e) {
            throw mismatch(id, "invalid backup header: " + e.getMessage(), e);
        }
        return new StoredBackup(header, entities);
    }

    @Override
    public List<BackupHeader> list() {
        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            files = s.filter(f -> f.getFileName().toString().endsWith(SUFFIX)).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list backups in " + dir, e);
        }
        List<BackupHeader> out = new ArrayList<>(files.size());
        for (Path p : files) {
            try {
                out.add(header(json.readValue(p.toFile(), BackupFileDto.class)));
            } catch (IOException | RuntimeException e) {
                log.log(Level.WARNING, "Skipping unreadable backup " + p, e);
            }
        }
        out.sort(Comparator.comparing(BackupHeader::createdAt).thenComparing(BackupHeader::id).reversed());
        return out;
    }

    @Override
    public boolean delete(String id) {
        try {
            return Files.deleteIfExists(fileFor(id));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete backup " + id, e);
        }
    }

    private Path fileFor(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("invalid backup id: " + id);
        }
        return dir.resolve(id + SUFFIX);
    }

    private static BackupHeader header(BackupFileDto dto) {
        return new BackupHeader(dto.id, Instant.ofEpochMilli(dto.createdAtMillis),
                BackupTrigger.valueOf(dto.trigger), dto.checksum, dto.size, dto.entityCount);
    }

    private static BackupVerificationException mismatch(String id, String detail, Throwable cause) {
        return new BackupVerificationException(id, BackupVerificationException.Reason.CHECKSUM_MISMATCH,
                "Backup " + id + " failed verification: " + detail, cause);
    }
}
