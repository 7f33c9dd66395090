// file: core/src/main/java/io/tagvault/core/TombstoneLedger.java
package io.tagvault.core;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Set of pending-delete markers, one per locally deleted entity whose
 * removal has not yet been observed on the remote replica.
 * <p>
 * Lifecycle:
 *  - recordDeletion() is called by the delete handlers; the marker is
 *    persisted by the same commit as the delete itself.
 *  - clearDeletion() is called by the sync cycle once the remote snapshot
 *    no longer carries the id as a live entity.
 * <p>
 * Not thread-safe. Callers serialize access (the command pipeline lock).
 */
public final class TombstoneLedger {
    private final Set<TombstoneKey> pending = new TreeSet<>();
    private boolean dirty;

    /** Idempotent. Returns true if the marker was not already present. */
    public boolean recordDeletion(EntityKind kind, String id) {
        boolean added = pending.add(new TombstoneKey(kind, id));
        dirty |= added;
        return added;
    }

    /** Returns true if a marker was removed. */
    public boolean clearDeletion(EntityKind kind, String id) {
        boolean removed = pending.remove(new TombstoneKey(kind, id));
        dirty |= removed;
        return removed;
    }

    public boolean isPending(EntityKind kind, String id) {
        return pending.contains(new TombstoneKey(kind, id));
    }

    /** Immutable copy, safe to hand to the merge engine. */
    public Set<TombstoneKey> pending() {
        return Set.copyOf(pending);
    }

    public int size() {
        return pending.size();
    }

    /**
     * Replace the content with persisted markers (rehydration).
     * Does not mark the ledger dirty.
     */
    public void load(Collection<TombstoneKey> persisted) {
        pending.clear();
        pending.addAll(persisted);
        dirty = false;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markClean() {
        dirty = false;
    }
}
