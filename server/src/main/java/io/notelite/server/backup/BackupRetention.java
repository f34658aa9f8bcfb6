package io.notelite.server.backup;

import java.time.Duration;
import java.util.Objects;

/** How long backups are kept and how many at most. */
public record BackupRetention(Duration maxAge, int maxCount) {
    public static final BackupRetention DEFAULT = new BackupRetention(Duration.ofDays(30), 50);

    public BackupRetention {
        Objects.requireNonNull(maxAge, "maxAge");
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be > 0");
        }
        if (maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be >= 1");
        }
    }
}
