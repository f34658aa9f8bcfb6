package io.notelite.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notelite.server.backup.BackupRetention;
import io.notelite.server.dto.JsonConsistencyConfig;
import io.notelite.storage.history.HistoryLimits;
import io.notelite.storage.history.VersionPersistencePolicy;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Tunables for the consistency core.
 *
 * Groups:
 *  - transactions:  maxConcurrentTransactions, transactionTimeout
 *  - conflicts:     simultaneousWindow, businessWindow, resolutionHistoryCapacity
 *  - history:       maxVersions, maxHistoryBytes, snapshotEvery, historyPersistence
 *  - integrity:     quickCheckInterval, comprehensiveCheckInterval
 *  - backups:       backupInterval, backupMaxAge, maxBackups, bulkBackupThreshold
 */
public record ConsistencyConfig(
        int maxConcurrentTransactions,
        Duration transactionTimeout,
        Duration simultaneousWindow,
        Duration businessWindow,
        int resolutionHistoryCapacity,
        int maxVersions,
        long maxHistoryBytes,
        int snapshotEvery,
        VersionPersistencePolicy historyPersistence,
        Duration quickCheckInterval,
        Duration comprehensiveCheckInterval,
        Duration backupInterval,
        Duration backupMaxAge,
        int maxBackups,
        int bulkBackupThreshold
) {
    public static final ConsistencyConfig DEFAULT = new ConsistencyConfig(
            10,
            Duration.ofSeconds(30),
            Duration.ofSeconds(5),
            Duration.ofSeconds(60),
            100,
            100,
            10L * 1024 * 1024,
            10,
            VersionPersistencePolicy.METADATA_ONLY,
            Duration.ofSeconds(60),
            Duration.ofSeconds(3600),
            Duration.ofHours(6),
            Duration.ofDays(30),
            50,
            10
    );

    public ConsistencyConfig {
        Objects.requireNonNull(transactionTimeout, "transactionTimeout");
        Objects.requireNonNull(simultaneousWindow, "simultaneousWindow");
        Objects.requireNonNull(businessWindow, "businessWindow");
        Objects.requireNonNull(historyPersistence, "historyPersistence");
        Objects.requireNonNull(quickCheckInterval, "quickCheckInterval");
        Objects.requireNonNull(comprehensiveCheckInterval, "comprehensiveCheckInterval");
        Objects.requireNonNull(backupInterval, "backupInterval");
        Objects.requireNonNull(backupMaxAge, "backupMaxAge");
        if (maxConcurrentTransactions <= 0) throw new IllegalArgumentException("maxConcurrentTransactions must be > 0");
        if (!positive(transactionTimeout)) throw new IllegalArgumentException("transactionTimeout must be > 0");
        if (simultaneousWindow.isNegative() || businessWindow.isNegative()) {
            throw new IllegalArgumentException("conflict windows must be >= 0");
        }
        if (resolutionHistoryCapacity <= 0) throw new IllegalArgumentException("resolutionHistoryCapacity must be > 0");
        if (maxVersions < 1) throw new IllegalArgumentException("maxVersions must be >= 1");
        if (maxHistoryBytes <= 0) throw new IllegalArgumentException("maxHistoryBytes must be > 0");
        if (snapshotEvery <= 0) throw new IllegalArgumentException("snapshotEvery must be > 0");
        if (!positive(quickCheckInterval) || !positive(comprehensiveCheckInterval)) {
            throw new IllegalArgumentException("integrity check intervals must be > 0");
        }
        if (!positive(backupInterval)) throw new IllegalArgumentException("backupInterval must be > 0");
        if (!positive(backupMaxAge)) throw new IllegalArgumentException("backupMaxAge must be > 0");
        if (maxBackups <= 0) throw new IllegalArgumentException("maxBackups must be > 0");
        if (bulkBackupThreshold < 0) throw new IllegalArgumentException("bulkBackupThreshold must be >= 0");
    }

    /** Reads a JSON config; keys that are absent keep their default. */
    public static ConsistencyConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonConsistencyConfig json = mapper.readValue(path.toFile(), JsonConsistencyConfig.class);
            return fromJson(json);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load ConsistencyConfig from " + path, e);
        }
    }

    static ConsistencyConfig fromJson(JsonConsistencyConfig json) {
        ConsistencyConfig d = DEFAULT;
        return new ConsistencyConfig(
                or(json.maxConcurrentTransactions, d.maxConcurrentTransactions),
                seconds(json.transactionTimeoutSeconds, d.transactionTimeout),
                seconds(json.simultaneousWindowSeconds, d.simultaneousWindow),
                seconds(json.businessWindowSeconds, d.businessWindow),
                or(json.resolutionHistoryCapacity, d.resolutionHistoryCapacity),
                or(json.maxVersions, d.maxVersions),
                json.maxHistoryBytes != null ? json.maxHistoryBytes : d.maxHistoryBytes,
                or(json.snapshotEvery, d.snapshotEvery),
                json.historyPersistence != null
                        ? VersionPersistencePolicy.valueOf(json.historyPersistence.trim().toUpperCase(Locale.ROOT))
                        : d.historyPersistence,
                seconds(json.quickCheckIntervalSeconds, d.quickCheckInterval),
                seconds(json.comprehensiveCheckIntervalSeconds, d.comprehensiveCheckInterval),
                json.backupIntervalHours != null ? Duration.ofHours(json.backupIntervalHours) : d.backupInterval,
                json.backupMaxAgeDays != null ? Duration.ofDays(json.backupMaxAgeDays) : d.backupMaxAge,
                or(json.maxBackups, d.maxBackups),
                or(json.bulkBackupThreshold, d.bulkBackupThreshold)
        );
    }

    public HistoryLimits historyLimits() {
        return new HistoryLimits(maxVersions, maxHistoryBytes);
    }

    public BackupRetention backupRetention() {
        return new BackupRetention(backupMaxAge, maxBackups);
    }

    // ---------- internals ----------

    private static boolean positive(Duration d) {
        return !d.isZero() && !d.isNegative();
    }

    private static int or(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    private static Duration seconds(Long value, Duration fallback) {
        return value != null ? Duration.ofSeconds(value) : fallback;
    }
}
