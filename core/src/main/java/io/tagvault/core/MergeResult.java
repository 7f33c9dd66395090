// file: core/src/main/java/io/tagvault/core/MergeResult.java
package io.tagvault.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of merging one entity collection.
 *
 * @param kind      the entity kind that was merged
 * @param merged    the reconciled collection (id -> entity)
 * @param decisions one decision per id in the union of both inputs
 */
public record MergeResult<T extends SyncEntity>(
        EntityKind kind,
        Map<String, T> merged,
        Map<String, MergeDecision> decisions
) {
    public MergeResult {
        Objects.requireNonNull(kind, "kind");
        merged = Map.copyOf(merged);
        decisions = Map.copyOf(decisions);
    }

    /** Ids (sorted) whose decision is one of the given values. */
    public List<String> idsWith(MergeDecision... wanted) {
        List<MergeDecision> set = List.of(wanted);
        return decisions.entrySet().stream()
                .filter(e -> set.contains(e.getValue()))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    /** Ids (sorted) whose local tombstone the remote side has confirmed. */
    public List<String> confirmedTombstones() {
        return idsWith(MergeDecision.TOMBSTONE_CONFIRMED, MergeDecision.TOMBSTONE_REMOTE_DELETED);
    }
}
