package io.notelite.server.integrity;

import io.notelite.core.Entity;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One read of the store shared by every validator of a check.
 *
 * @param entities  entities read, empty when the read failed; may contain nulls from a broken source
 * @param loadError message of the read failure, null when the read succeeded
 * @param checkedAt time the check started
 */
public record ValidationContext(List<Entity> entities, String loadError, Instant checkedAt) {
    public ValidationContext {
        Objects.requireNonNull(entities, "entities");
        Objects.requireNonNull(checkedAt, "checkedAt");
    }

    public boolean readable() {
        return loadError == null;
    }

    public boolean hasNullEntries() {
        for (Entity e : entities) {
            if (e == null) {
                return true;
            }
        }
        return false;
    }
}
