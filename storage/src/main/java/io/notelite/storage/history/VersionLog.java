package io.notelite.storage.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notelite.core.ChangeType;
import io.notelite.core.DataVersion;
import io.notelite.storage.AtomicFiles;
import io.notelite.storage.dto.VersionEntryDto;
import io.notelite.storage.dto.VersionLogFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON file behind {@link VersionHistory}.
 * <p>
 * The whole log is rewritten on every change with write-then-rename, so readers
 * never see a partial file. How much is written is decided by the
 * {@link VersionPersistencePolicy}.
 */
public final class VersionLog {

    /** What a previous session left behind. */
    public record Contents(
            List<VersionSummary> archived,
            List<DataVersion> versions,
            String cursorVersionId,
            long nextSequence
    ) {
        public Contents {
            archived = List.copyOf(archived);
            versions = List.copyOf(versions);
        }
    }

    private final Path file;
    private final VersionPersistencePolicy policy;
    private final ObjectMapper json = new ObjectMapper();

    public VersionLog(Path file, VersionPersistencePolicy policy) {
        this.file = Objects.requireNonNull(file, "file");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public VersionPersistencePolicy policy() {
        return policy;
    }

    public Path file() {
        return file;
    }

    public void write(List<DataVersion> versions, List<VersionSummary> archived, String cursorVersionId, long nextSequence) {
        boolean payloads = policy == VersionPersistencePolicy.FULL_PAYLOAD;
        VersionLogFile out = new VersionLogFile();
        out.policy = policy.name();
        out.cursorVersionId = cursorVersionId;
        out.nextSequence = nextSequence;
        for (VersionSummary s : archived) {
            out.archived.add(fromSummary(s));
        }
        for (DataVersion v : versions) {
            out.versions.add(VersionEntryDto.from(v, payloads));
        }
        try {
            AtomicFiles.write(file, json.writerWithDefaultPrettyPrinter().writeValueAsBytes(out));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize version log", e);
        }
    }

    /**
     * Read the log. Entries without a payload, and every entry when the policy is
     * METADATA_ONLY, come back as non-replayable summaries.
     */
    public Optional<Contents> read() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        VersionLogFile in;
        try {
            in = json.readValue(file.toFile(), VersionLogFile.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read version log " + file, e);
        }
        List<VersionSummary> archived = new ArrayList<>();
        List<DataVersion> versions = new ArrayList<>();
        if (in.archived != null) {
            for (VersionEntryDto e : in.archived) {
                archived.add(toSummary(e));
            }
        }
        boolean replay = policy == VersionPersistencePolicy.FULL_PAYLOAD;
        if (in.versions != null) {
            for (VersionEntryDto e : in.versions) {
                if (replay && e.payloadIncluded) {
                    versions.add(e.toVersion());
                } else {
                    archived.add(toSummary(e));
                }
            }
        }
        String cursor = replay ? in.cursorVersionId : null;
        return Optional.of(new Contents(archived, versions, cursor, in.nextSequence));
    }

    private static VersionEntryDto fromSummary(VersionSummary s) {
        VersionEntryDto dto = new VersionEntryDto();
        dto.versionId = s.versionId();
        dto.sequence = s.sequence();
        dto.timestampMillis = s.timestamp().toEpochMilli();
        dto.changeType = s.changeType().name();
        dto.description = s.description();
        dto.snapshot = s.snapshot();
        dto.payloadIncluded = false;
        return dto;
    }

    private static VersionSummary toSummary(VersionEntryDto e) {
        return new VersionSummary(
                e.versionId,
                e.sequence,
                Instant.ofEpochMilli(e.timestampMillis),
                e.description,
                e.changeType == null ? ChangeType.SYSTEM : ChangeType.valueOf(e.changeType),
                e.snapshot,
                false,
                false
        );
    }
}
