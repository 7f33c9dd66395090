// file: server/src/main/java/io/tagvault/server/sync/SyncCoordinator.java
package io.tagvault.server.sync;

import io.tagvault.core.CollectionMerger;
import io.tagvault.core.DataSnapshot;
import io.tagvault.core.EntityKind;
import io.tagvault.core.MergeDecision;
import io.tagvault.core.MergeResult;
import io.tagvault.core.MergedSnapshot;
import io.tagvault.core.Page;
import io.tagvault.core.SyncEntity;
import io.tagvault.core.Tag;
import io.tagvault.core.TombstoneKey;
import io.tagvault.server.error.SyncException;
import io.tagvault.server.error.TagVaultException;
import io.tagvault.server.pipeline.CommandPipeline;
import io.tagvault.server.store.EntityStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One synchronization cycle against the remote replica.
 * <p>
 * Steps:
 *  1) Pull the remote snapshot (no lock held). Entries whose map key does
 *     not match the entity id are dropped.
 *  2) Push pending deletes, then pending local changes the remote does not
 *     hold in a newer version (no lock held). If any of those upserts fail
 *     the cycle stops here: merging against the stale remote rows would
 *     overwrite the unpushed local changes.
 *  3) Under the pipeline lock: merge the current local state with the
 *     remote snapshot as updated by step 2 and the pending deletes, replace
 *     local state with the result, clear confirmed tombstones and
 *     acknowledged changes, commit.
 *  4) Push entities the merge kept from the local side that the remote
 *     still lacks in that form.
 * <p>
 * Single-flight: a cycle requested while one is running returns SKIPPED.
 * Nothing here throws to the caller; failures become a FAILED or PARTIAL
 * outcome and are retried by the next cycle.
 */
public final class SyncCoordinator {
    private static final Logger log = Logger.getLogger(SyncCoordinator.class.getName());

    private final CommandPipeline pipeline;
    private final RemoteReplica remote;
    private final CollectionMerger merger;
    private final Clock clock;

    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final AtomicLong cycles = new AtomicLong();
    private volatile SyncOutcome lastOutcome;
    private volatile Long lastSuccessAt;
    private volatile String lastError;

    public SyncCoordinator(CommandPipeline pipeline, RemoteReplica remote, CollectionMerger merger, Clock clock) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.merger = Objects.requireNonNull(merger, "merger");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SyncOutcome runCycle() {
        if (!inFlight.compareAndSet(false, true)) {
            return SyncOutcome.skipped("sync already in progress");
        }
        SyncOutcome outcome;
        try {
            outcome = doCycle();
        } catch (SyncException e) {
            log.log(Level.WARNING, "sync failed: " + e.getMessage(), e.getCause());
            outcome = SyncOutcome.failed(e.getMessage(), e.retryable());
        } catch (TagVaultException e) {
            log.log(Level.WARNING, "sync could not apply merge: " + e.getMessage(), e);
            outcome = SyncOutcome.failed(e.getMessage(), true);
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "sync failed unexpectedly", e);
            outcome = SyncOutcome.failed("internal error: " + e.getMessage(), true);
        } finally {
            inFlight.set(false);
        }
        record(outcome);
        return outcome;
    }

    public SyncStatus status() {
        return pipeline.transact("sync.status", store -> {
            EntityStore.DataStats stats = store.stats();
            return new SyncStatus(inFlight.get(), cycles.get(), lastOutcome, lastSuccessAt, lastError,
                    stats.pendingDeletions(), stats.pendingChanges());
        });
    }

    // ---------- internals ----------

    private record Outbound(List<TombstoneKey> deletes, List<Tag> tags, List<Page> pages) {}

    private record Reconciled(List<Tag> tags, List<Page> pages, int cleared) {}

    private SyncOutcome doCycle() {
        DataSnapshot remoteState = pull();

        Outbound out = pipeline.transact("sync.collect", store -> {
            DataSnapshot changed = store.pendingChanges();
            return new Outbound(
                    store.pendingDeletions().stream().sorted().toList(),
                    unlessRemoteNewer(changed.tags(), remoteState.tags()),
                    unlessRemoteNewer(changed.pages(), remoteState.pages()));
        });

        List<String> failures = new ArrayList<>();
        List<TombstoneKey> deleted = pushDeletes(out.deletes(), failures);
        int tags = push("tags", out.tags(), remote::upsertTags, failures);
        int pages = push("pages", out.pages(), remote::upsertPages, failures);
        acknowledge(tags > 0 ? out.tags() : List.of(), pages > 0 ? out.pages() : List.of());

        if (tags < out.tags().size() || pages < out.pages().size()) {
            String error = String.join("; ", failures);
            log.warning(() -> "sync stopped before merge, local changes not pushed: " + error);
            return new SyncOutcome(SyncOutcome.Status.FAILED, tags, pages, deleted.size(), 0, true, error);
        }

        DataSnapshot view = afterPush(remoteState, out.tags(), out.pages(), deleted);

        Reconciled plan = pipeline.transact("sync.apply", store -> {
            MergedSnapshot merged = merger.mergeAll(store.snapshot(), view, store.pendingDeletions());

            List<TombstoneKey> confirmed = new ArrayList<>();
            merged.tags().confirmedTombstones().forEach(id -> confirmed.add(TombstoneKey.tag(id)));
            merged.pages().confirmedTombstones().forEach(id -> confirmed.add(TombstoneKey.page(id)));

            store.replaceAll(merged.toSnapshot(), confirmed);
            store.markSynced(matchingRemote(merged.tags(), view.tags()));
            store.markSynced(matchingRemote(merged.pages(), view.pages()));

            return new Reconciled(
                    toPush(merged.tags(), view.tags()),
                    toPush(merged.pages(), view.pages()),
                    confirmed.size());
        });

        int lateTags = push("tags", plan.tags(), remote::upsertTags, failures);
        int latePages = push("pages", plan.pages(), remote::upsertPages, failures);
        acknowledge(lateTags > 0 ? plan.tags() : List.of(), latePages > 0 ? plan.pages() : List.of());

        int tagsPushed = tags + lateTags;
        int pagesPushed = pages + latePages;
        SyncOutcome.Status status = failures.isEmpty() ? SyncOutcome.Status.SUCCESS : SyncOutcome.Status.PARTIAL;
        String error = failures.isEmpty() ? null : String.join("; ", failures);
        log.info(() -> String.format(
                "sync %s: pushed %d tags, %d pages, %d deletes; cleared %d tombstones",
                status, tagsPushed, pagesPushed, deleted.size(), plan.cleared()));
        return new SyncOutcome(status, tagsPushed, pagesPushed, deleted.size(), plan.cleared(),
                !failures.isEmpty(), error);
    }

    private DataSnapshot pull() {
        DataSnapshot snap;
        try {
            snap = remote.fetchSnapshot();
        } catch (SyncException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SyncException("fetching remote snapshot failed: " + e.getMessage(), true, e);
        }
        if (snap == null) throw new SyncException("remote returned no snapshot", true);
        return new DataSnapshot(keyedById("tags", snap.tags()), keyedById("pages", snap.pages()));
    }

    /** Drops entries stored under a key other than their own id. */
    private static <T extends SyncEntity> Map<String, T> keyedById(String what, Map<String, T> in) {
        Map<String, T> out = new HashMap<>();
        for (Map.Entry<String, T> e : in.entrySet()) {
            T entity = e.getValue();
            if (entity == null || !e.getKey().equals(entity.id())) {
                log.warning(() -> "ignoring remote " + what + " entry with mismatched id: " + e.getKey());
                continue;
            }
            out.put(e.getKey(), entity);
        }
        return out;
    }

    /** Pending changes, in id order, except those the remote holds as is or in a newer version. */
    private static <T extends SyncEntity> List<T> unlessRemoteNewer(Map<String, T> changed, Map<String, T> remoteSide) {
        List<T> out = new ArrayList<>();
        for (T mine : new TreeMap<>(changed).values()) {
            T theirs = remoteSide.get(mine.id());
            if (theirs == null || (theirs.updatedAt() <= mine.updatedAt() && !theirs.equals(mine))) {
                out.add(mine);
            }
        }
        return out;
    }

    /** The remote snapshot as it stands after this cycle's pushes. */
    private static DataSnapshot afterPush(DataSnapshot pulled, List<Tag> tags, List<Page> pages,
                                          List<TombstoneKey> deleted) {
        Map<String, Tag> t = new HashMap<>(pulled.tags());
        Map<String, Page> p = new HashMap<>(pulled.pages());
        tags.forEach(tag -> t.put(tag.id(), tag));
        pages.forEach(page -> p.put(page.id(), page));
        for (TombstoneKey key : deleted) {
            if (key.kind() == EntityKind.TAG) t.remove(key.id());
            else p.remove(key.id());
        }
        return new DataSnapshot(t, p);
    }

    /** Merged entities the remote now holds in exactly this form. */
    private static <T extends SyncEntity> List<T> matchingRemote(MergeResult<T> result, Map<String, T> remoteSide) {
        List<T> out = new ArrayList<>();
        for (T mine : result.merged().values()) {
            if (mine.equals(remoteSide.get(mine.id()))) out.add(mine);
        }
        return out;
    }

    /**
     * Entities the remote does not have in this exact form: local-only,
     * locally newer, or tied with different content.
     */
    private static <T extends SyncEntity> List<T> toPush(MergeResult<T> result, Map<String, T> remoteSide) {
        List<T> out = new ArrayList<>();
        for (String id : result.idsWith(MergeDecision.LOCAL_ONLY, MergeDecision.LOCAL_NEWER, MergeDecision.LOCAL_TIE)) {
            T mine = result.merged().get(id);
            if (result.decisions().get(id) == MergeDecision.LOCAL_TIE && mine.equals(remoteSide.get(id))) {
                continue;
            }
            out.add(mine);
        }
        return out;
    }

    private void acknowledge(List<Tag> tags, List<Page> pages) {
        if (tags.isEmpty() && pages.isEmpty()) return;
        pipeline.transact("sync.ack", store -> {
            store.markSynced(tags);
            store.markSynced(pages);
            return null;
        });
    }

    private List<TombstoneKey> pushDeletes(List<TombstoneKey> deletes, List<String> failures) {
        List<TombstoneKey> sent = new ArrayList<>();
        for (TombstoneKey key : deletes) {
            try {
                remote.markDeleted(key);
                sent.add(key);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "remote delete of " + key + " failed", e);
                failures.add("delete " + key + ": " + e.getMessage());
            }
        }
        return sent;
    }

    private interface Upsert<T> {
        void send(List<T> batch);
    }

    private static <T> int push(String what, List<T> batch, Upsert<T> upsert, List<String> failures) {
        if (batch.isEmpty()) return 0;
        try {
            upsert.send(batch);
            return batch.size();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "remote upsert of " + batch.size() + " " + what + " failed", e);
            failures.add("upsert " + what + ": " + e.getMessage());
            return 0;
        }
    }

    private void record(SyncOutcome outcome) {
        if (outcome.status() == SyncOutcome.Status.SKIPPED) return;
        cycles.incrementAndGet();
        lastOutcome = outcome;
        if (outcome.status() == SyncOutcome.Status.SUCCESS) {
            lastSuccessAt = clock.millis();
            lastError = null;
        } else {
            lastError = outcome.error();
        }
    }
}
