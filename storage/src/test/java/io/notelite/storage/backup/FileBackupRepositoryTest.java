package io.notelite.storage.backup;

import io.notelite.core.Entity;
import io.notelite.core.EntityChecksums;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FileBackupRepositoryTest {

    private static List<Entity> notes() {
        UUID b = UUID.randomUUID();
        return List.of(
                Entity.of(UUID.randomUUID(), "a", 10L, "alpha content").withLink(b),
                Entity.of(b, "b", 20L, "beta content").withTags(List.of("receipt", "food")));
    }

    @Test
    void written_backup_loads_and_verifies(@TempDir Path dir) {
        var repo = new FileBackupRepository(dir);
        List<Entity> entities = notes();

        BackupHeader header = repo.write("b1", Instant.ofEpochMilli(5_000), BackupTrigger.MANUAL, entities);
        StoredBackup loaded = repo.load("b1");

        assertTrue(Files.exists(dir.resolve("b1.backup")));
        assertEquals(header, loaded.header());
        assertEquals(EntityChecksums.of(entities), loaded.header().checksum());
        assertEquals(EntityChecksums.of(entities), EntityChecksums.of(loaded.entities()));
        assertEquals(2, loaded.header().entityCount());
    }

    @Test
    void truncated_file_fails_closed(@TempDir Path dir) throws Exception {
        var repo = new FileBackupRepository(dir);
        repo.write("b1", Instant.now(), BackupTrigger.MANUAL, notes());
        Path file = dir.resolve("b1.backup");
        byte[] bytes = Files.readAllBytes(file);
        Files.write(file, Arrays.copyOf(bytes, bytes.length / 2));

        var e = assertThrows(BackupVerificationException.class, () -> repo.load("b1"));
        assertEquals(BackupVerificationException.Reason.CHECKSUM_MISMATCH, e.reason());
    }

    @Test
    void flipped_content_byte_fails_closed(@TempDir Path dir) throws Exception {
        var repo = new FileBackupRepository(dir);
        repo.write("b1", Instant.now(), BackupTrigger.MANUAL, notes());
        Path file = dir.resolve("b1.backup");
        String text = Files.readString(file, StandardCharsets.UTF_8);
        int at = text.indexOf("alpha content");
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        bytes[at] ^= 0x01; // 'a' -> '`'
        Files.write(file, bytes);

        var e = assertThrows(BackupVerificationException.class, () -> repo.load("b1"));
        assertEquals(BackupVerificationException.Reason.CHECKSUM_MISMATCH, e.reason());
    }

    @Test
    void missing_backup_is_reported_as_not_found(@TempDir Path dir) {
        var repo = new FileBackupRepository(dir);
        var e = assertThrows(BackupVerificationException.class, () -> repo.load("nope"));
        assertEquals(BackupVerificationException.Reason.NOT_FOUND, e.reason());
    }

    @Test
    void list_is_newest_first_and_skips_garbage(@TempDir Path dir) throws Exception {
        var repo = new FileBackupRepository(dir);
        repo.write("old", Instant.ofEpochMilli(1_000), BackupTrigger.PERIODIC, notes());
        repo.write("new", Instant.ofEpochMilli(2_000), BackupTrigger.AUTOMATIC, notes());
        Files.writeString(dir.resolve("junk.backup"), "{not json");

        List<BackupHeader> listed = repo.list();

        assertEquals(List.of("new", "old"), listed.stream().map(BackupHeader::id).toList());
        assertTrue(repo.delete("old"));
        assertFalse(repo.delete("old"));
        assertEquals(1, repo.list().size());
    }

    @Test
    void path_like_ids_are_rejected(@TempDir Path dir) {
        var repo = new FileBackupRepository(dir);
        assertThrows(IllegalArgumentException.class,
                () -> repo.write("../escape", Instant.now(), BackupTrigger.MANUAL, List.of()));
    }
}
