// file: core/src/main/java/io/tagvault/core/MergeDecision.java
package io.tagvault.core;

/**
 * Outcome of reconciling one id during a collection merge.
 */
public enum MergeDecision {
    /** Tombstoned locally and absent remotely: the delete is confirmed. */
    TOMBSTONE_CONFIRMED(false),
    /** Tombstoned locally, remote still reports it as deleted: also confirmed. */
    TOMBSTONE_REMOTE_DELETED(false),
    /** Tombstoned locally, remote still has a live copy: stale echo, suppressed. */
    TOMBSTONE_SUPPRESSED(false),
    /** Only the remote has it, flagged deleted. */
    REMOTE_DELETED(false),
    /** Only the remote has it, live: newly learned. */
    REMOTE_ONLY(true),
    /** Only the local side has it: unsynced local creation. */
    LOCAL_ONLY(true),
    /** Both sides have it and the local copy is newer. */
    LOCAL_NEWER(true),
    /** Both sides have it with the same updatedAt; local wins. */
    LOCAL_TIE(true),
    /** Both sides have it and the remote copy is newer. */
    REMOTE_NEWER(true);

    private final boolean included;

    MergeDecision(boolean included) {
        this.included = included;
    }

    /** True if the id appears in the merged collection. */
    public boolean included() {
        return included;
    }

    /** True if the remote replica has observed the local delete. */
    public boolean confirmsTombstone() {
        return this == TOMBSTONE_CONFIRMED || this == TOMBSTONE_REMOTE_DELETED;
    }

    /** True if the merged value came from the local side. */
    public boolean keptLocal() {
        return this == LOCAL_ONLY || this == LOCAL_NEWER || this == LOCAL_TIE;
    }
}
