package io.notelite.server.backup;

import io.notelite.core.integrity.IssueCategory;
import io.notelite.storage.tx.AppliedChange;

import java.util.List;
import java.util.Map;

/**
 * Outcome of detectAndRepairCorruption or repairIssues.
 *
 * @param corruptionFound    the integrity check reported at least one issue
 * @param repairAttempted    at least one repair path ran
 * @param repairSuccessful   every attempted path succeeded
 * @param repairsApplied     number of individual fixes, zero when nothing needed fixing
 * @param repairsByCategory  fixes per issue category
 * @param actions            human-readable log of what was changed
 * @param restoredFromBackup id of the backup restored for data corruption, null if none
 * @param appliedChanges     store mutations, for recording a system version
 */
public record RepairReport(
        boolean corruptionFound,
        boolean repairAttempted,
        boolean repairSuccessful,
        int repairsApplied,
        Map<IssueCategory, Integer> repairsByCategory,
        List<String> actions,
        String restoredFromBackup,
        List<AppliedChange> appliedChanges,
        String message
) {
    public RepairReport {
        repairsByCategory = Map.copyOf(repairsByCategory);
        actions = List.copyOf(actions);
        appliedChanges = List.copyOf(appliedChanges);
    }

    static RepairReport clean() {
        return new RepairReport(false, false, true, 0, Map.of(), List.of(), null, List.of(),
                "No corruption detected");
    }

    static RepairReport notAttempted(String message) {
        return new RepairReport(true, false, true, 0, Map.of(), List.of(), null, List.of(), message);
    }
}
