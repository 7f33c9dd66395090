// file: core/src/main/java/io/tagvault/core/LastWriteWinsMerger.java
package io.tagvault.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Default merge: last-write-wins plus tombstone suppression.
 * <p>
 * For every id in the union of local and remote keys, in sorted order:
 *  - tombstoned: excluded, whatever the remote says (anti-resurrection).
 *  - remote only, deleted: excluded.
 *  - remote only, live: taken from remote.
 *  - local only: kept.
 *  - both, remote deleted: excluded.
 *  - both live: resolved by the {@link ConflictResolver}.
 */
public final class LastWriteWinsMerger implements CollectionMerger {
    private final ConflictResolver resolver;

    public LastWriteWinsMerger() {
        this(new ConflictResolver.LastWriterWins());
    }

    public LastWriteWinsMerger(ConflictResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public <T extends SyncEntity> MergeResult<T> merge(
            EntityKind kind,
            Map<String, T> local,
            Map<String, T> remote,
            Set<TombstoneKey> tombstones
    ) {
        Objects.requireNonNull(kind, "kind");
        Map<String, T> l = local == null ? Map.of() : local;
        Map<String, T> r = remote == null ? Map.of() : remote;
        Set<TombstoneKey> t = tombstones == null ? Set.of() : tombstones;

        Set<String> ids = new TreeSet<>(l.keySet());
        ids.addAll(r.keySet());
        for (TombstoneKey k : t) {
            if (k.kind() == kind) ids.add(k.id());
        }

        Map<String, T> merged = new HashMap<>();
        Map<String, MergeDecision> decisions = new HashMap<>();

        for (String id : ids) {
            T mine = l.get(id);
            T theirs = r.get(id);
            MergeDecision d = decide(kind, id, mine, theirs, t);
            decisions.put(id, d);
            if (!d.included()) continue;
            merged.put(id, d.keptLocal() ? mine : theirs);
        }
        return new MergeResult<>(kind, merged, decisions);
    }

    // ---------- helpers ----------

    private MergeDecision decide(EntityKind kind, String id, SyncEntity mine, SyncEntity theirs,
                                 Set<TombstoneKey> tombstones) {
        if (tombstones.contains(new TombstoneKey(kind, id))) {
            if (theirs == null) return MergeDecision.TOMBSTONE_CONFIRMED;
            return theirs.deleted() ? MergeDecision.TOMBSTONE_REMOTE_DELETED : MergeDecision.TOMBSTONE_SUPPRESSED;
        }
        if (mine == null) {
            return theirs.deleted() ? MergeDecision.REMOTE_DELETED : MergeDecision.REMOTE_ONLY;
        }
        if (theirs == null) {
            return MergeDecision.LOCAL_ONLY;
        }
        if (theirs.deleted()) {
            return MergeDecision.REMOTE_DELETED;
        }
        if (resolver.choose(mine, theirs) == ConflictResolver.Side.REMOTE) {
            return MergeDecision.REMOTE_NEWER;
        }
        return mine.updatedAt() == theirs.updatedAt() ? MergeDecision.LOCAL_TIE : MergeDecision.LOCAL_NEWER;
    }
}
