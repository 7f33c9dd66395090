// file: core/src/main/java/io/tagvault/core/CollectionMerger.java
package io.tagvault.core;

import java.util.Map;
import java.util.Set;

/**
 * Pure function that reconciles a local and a remote copy of one entity
 * collection, given the set of pending local deletions.
 * <p>
 * Implementations must be deterministic and idempotent:
 * merging the output again with the same remote and tombstones yields
 * the same collection.
 */
public interface CollectionMerger {

    <T extends SyncEntity> MergeResult<T> merge(
            EntityKind kind,
            Map<String, T> local,
            Map<String, T> remote,
            Set<TombstoneKey> tombstones
    );

    /** Merge both collections of a snapshot with the same tombstone set. */
    default MergedSnapshot mergeAll(DataSnapshot local, DataSnapshot remote, Set<TombstoneKey> tombstones) {
        return new MergedSnapshot(
                merge(EntityKind.TAG, local.tags(), remote.tags(), tombstones),
                merge(EntityKind.PAGE, local.pages(), remote.pages(), tombstones)
        );
    }
}
