package com.patent.linkage.dictionary;

import java.util.List;

/**
 * Result of a dictionary build.
 *
 * @param dictionary   the resulting dictionary
 * @param conflicts    every conflict in the replayed ledger
 * @param newConflicts conflicts the previous dictionary did not already report
 * @param statistics   build summary
 */
public record BuildResult(
        CanonicalDictionary dictionary,
        List<ConflictRecord> conflicts,
        List<ConflictRecord> newConflicts,
        BuildStatistics statistics
) {
    public BuildResult {
        conflicts = List.copyOf(conflicts);
        newConflicts = List.copyOf(newConflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
