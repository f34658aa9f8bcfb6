package io.notelite.storage.history;

/**
 * Storage ceiling for the version history.
 *
 * @param maxVersions count ceiling; oldest versions are evicted first
 * @param maxBytes    estimated payload byte ceiling; older versions are compacted, then evicted
 */
public record HistoryLimits(int maxVersions, long maxBytes) {
    public static final HistoryLimits DEFAULT = new HistoryLimits(100, 10L * 1024 * 1024);

    public HistoryLimits {
        if (maxVersions < 1) throw new IllegalArgumentException("maxVersions must be >= 1");
        if (maxBytes < 1) throw new IllegalArgumentException("maxBytes must be >= 1");
    }
}
