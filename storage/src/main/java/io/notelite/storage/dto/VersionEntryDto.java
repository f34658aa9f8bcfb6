package io.notelite.storage.dto;

import io.notelite.core.ChangeImpact;
import io.notelite.core.ChangeType;
import io.notelite.core.DataVersion;
import io.notelite.core.DeltaOperation;
import io.notelite.core.VersionPayload;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * JSON shape of one history entry.
 * Payload fields (snapshot, operations) are only filled when payloads are persisted.
 */
public class VersionEntryDto {
    public String versionId;
    public long sequence;
    public long timestampMillis;
    public String changeType;
    public List<String> affectedIds;
    public String checksum;
    public String parentVersionId;
    public String description;
    public boolean userInitiated;
    public boolean systemGenerated;
    public String impact;
    public List<String> tags;
    public boolean snapshot;
    public boolean payloadIncluded;
    public List<EntityDto> entities;
    public List<DeltaOperationDto> operations;

    public static VersionEntryDto from(DataVersion v, boolean includePayload) {
        VersionEntryDto dto = new VersionEntryDto();
        dto.versionId = v.versionId();
        dto.sequence = v.sequence();
        dto.timestampMillis = v.timestamp().toEpochMilli();
        dto.changeType = v.changeType().name();
        dto.affectedIds = new ArrayList<>();
        for (UUID id : v.affectedIds()) {
            dto.affectedIds.add(id.toString());
        }
        dto.checksum = v.checksum();
        dto.parentVersionId = v.parentVersionId();
        dto.description = v.metadata().description();
        dto.userInitiated = v.metadata().userInitiated();
        dto.systemGenerated = v.metadata().systemGenerated();
        dto.impact = v.metadata().impact().name();
        dto.tags = new ArrayList<>(v.metadata().tags());
        dto.snapshot = v.isSnapshot();
        dto.payloadIncluded = includePayload;
        if (includePayload) {
            if (v.payload() instanceof VersionPayload.Snapshot s) {
                dto.entities = EntityDto.fromAll(s.entities());
            } else if (v.payload() instanceof VersionPayload.Delta d) {
                dto.operations = new ArrayList<>();
                for (DeltaOperation op : d.operations()) {
                    dto.operations.add(DeltaOperationDto.from(op));
                }
            }
        }
        return dto;
    }

    public DataVersion.Metadata toMetadata() {
        return new DataVersion.Metadata(description, userInitiated, systemGenerated,
                impact == null ? null : ChangeImpact.valueOf(impact), tags);
    }

    /** Rebuild the full version. Only valid when the payload was persisted. */
    public DataVersion toVersion() {
        if (!payloadIncluded) {
            throw new IllegalStateException("version " + versionId + " was stored without payload");
        }
        VersionPayload payload;
        if (snapshot) {
            payload = new VersionPayload.Snapshot(EntityDto.toEntities(entities));
        } else {
            List<DeltaOperation> ops = new ArrayList<>();
            if (operations != null) {
                for (DeltaOperationDto o : operations) {
                    ops.add(o.toOperation());
                }
            }
            payload = new VersionPayload.Delta(ops);
        }
        Set<UUID> ids = new LinkedHashSet<>();
        if (affectedIds != null) {
            for (String s : affectedIds) {
                ids.add(UUID.fromString(s));
            }
        }
        return new DataVersion(versionId, sequence, Instant.ofEpochMilli(timestampMillis),
                ChangeType.valueOf(changeType), ids, checksum, parentVersionId, toMetadata(), payload);
    }
}
