package io.notelite.server.dto;

/** On-disk shape of the consistency config. Missing keys stay null and fall back to defaults. */
public class JsonConsistencyConfig {
    public Integer maxConcurrentTransactions;
    public Long transactionTimeoutSeconds;
    public Long simultaneousWindowSeconds;
    public Long businessWindowSeconds;
    public Integer resolutionHistoryCapacity;
    public Integer maxVersions;
    public Long maxHistoryBytes;
    public Integer snapshotEvery;
    public String historyPersistence;
    public Long quickCheckIntervalSeconds;
    public Long comprehensiveCheckIntervalSeconds;
    public Long backupIntervalHours;
    public Long backupMaxAgeDays;
    public Integer maxBackups;
    public Integer bulkBackupThreshold;
}
