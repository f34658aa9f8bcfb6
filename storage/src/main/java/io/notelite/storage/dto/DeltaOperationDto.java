package io.notelite.storage.dto;

import io.notelite.core.DeltaOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** JSON shape of a {@link DeltaOperation}; {@code op} selects the variant. */
public class DeltaOperationDto {
    public String op;
    public EntityDto before;
    public EntityDto after;
    public String entityId;
    public String from;
    public String to;
    public List<String> sourceChangeIds;

    public static DeltaOperationDto from(DeltaOperation operation) {
        DeltaOperationDto dto = new DeltaOperationDto();
        if (operation instanceof DeltaOperation.Create c) {
            dto.op = "create";
            dto.after = EntityDto.from(c.after());
        } else if (operation instanceof DeltaOperation.Update u) {
            dto.op = "update";
            dto.before = EntityDto.from(u.before());
            dto.after = EntityDto.from(u.after());
        } else if (operation instanceof DeltaOperation.Delete d) {
            dto.op = "delete";
            dto.before = EntityDto.from(d.before());
        } else if (operation instanceof DeltaOperation.Move m) {
            dto.op = "move";
            dto.entityId = m.entityId().toString();
            dto.from = m.from().toString();
            dto.to = m.to().toString();
        } else if (operation instanceof DeltaOperation.Merge m) {
            dto.op = "merge";
            dto.before = EntityDto.from(m.before());
            dto.after = EntityDto.from(m.after());
            dto.sourceChangeIds = new ArrayList<>();
            for (UUID id : m.sourceChangeIds()) {
                dto.sourceChangeIds.add(id.toString());
            }
        }
        return dto;
    }

    public DeltaOperation toOperation() {
        if (op == null) {
            throw new IllegalArgumentException("delta operation kind missing");
        }
        return switch (op) {
            case "create" -> new DeltaOperation.Create(after.toEntity());
            case "update" -> new DeltaOperation.Update(before.toEntity(), after.toEntity());
            case "delete" -> new DeltaOperation.Delete(before.toEntity());
            case "move" -> new DeltaOperation.Move(
                    UUID.fromString(entityId), UUID.fromString(from), UUID.fromString(to));
            case "merge" -> {
                List<UUID> sources = new ArrayList<>();
                if (sourceChangeIds != null) {
                    for (String s : sourceChangeIds) {
                        sources.add(UUID.fromString(s));
                    }
                }
                yield new DeltaOperation.Merge(before.toEntity(), after.toEntity(), sources);
            }
            default -> throw new IllegalArgumentException("unknown delta operation: " + op);
        };
    }
}
