// file: core/src/main/java/io/tagvault/core/ChangeLedger.java
package io.tagvault.core;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ids of locally created or modified entities that the remote replica
 * has not accepted yet.
 * <p>
 * Lifecycle:
 *  - markChanged() is called by every local mutation and persisted by the
 *    same commit.
 *  - clear() is called once the remote acknowledged the exact version,
 *    or when the entity no longer exists locally.
 * <p>
 * Not thread-safe. Callers serialize access (the command pipeline lock).
 */
public final class ChangeLedger {
    private final Map<EntityKind, Set<String>> changed = new EnumMap<>(EntityKind.class);
    private boolean dirty;

    public ChangeLedger() {
        for (EntityKind k : EntityKind.values()) {
            changed.put(k, new TreeSet<>());
        }
    }

    /** Idempotent. Returns true if the id was not already marked. */
    public boolean markChanged(EntityKind kind, String id) {
        boolean added = changed.get(kind).add(id);
        dirty |= added;
        return added;
    }

    /** Returns true if a mark was removed. */
    public boolean clear(EntityKind kind, String id) {
        boolean removed = changed.get(kind).remove(id);
        dirty |= removed;
        return removed;
    }

    public boolean isChanged(EntityKind kind, String id) {
        return changed.get(kind).contains(id);
    }

    /** Immutable copy of the marked ids of one kind. */
    public Set<String> changed(EntityKind kind) {
        return Set.copyOf(changed.get(kind));
    }

    public int size() {
        int n = 0;
        for (Set<String> ids : changed.values()) n += ids.size();
        return n;
    }

    /**
     * Replace the content with persisted marks (rehydration).
     * Does not mark the ledger dirty.
     */
    public void load(Map<EntityKind, ? extends Collection<String>> persisted) {
        for (EntityKind k : EntityKind.values()) {
            Set<String> ids = changed.get(k);
            ids.clear();
            Collection<String> in = persisted.get(k);
            if (in != null) ids.addAll(in);
        }
        dirty = false;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markClean() {
        dirty = false;
    }
}
