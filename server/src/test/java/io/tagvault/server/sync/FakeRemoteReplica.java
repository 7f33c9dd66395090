// file: server/src/test/java/io/tagvault/server/sync/FakeRemoteReplica.java
package io.tagvault.server.sync;

import io.tagvault.core.DataSnapshot;
import io.tagvault.core.EntityKind;
import io.tagvault.core.Page;
import io.tagvault.core.Tag;
import io.tagvault.core.TombstoneKey;
import io.tagvault.server.error.SyncException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * In-memory remote replica. Deletes remove the entity (hard delete) unless
 * softDeletes is set, in which case the row stays with deleted=true.
 */
final class FakeRemoteReplica implements RemoteReplica {
    final Map<String, Tag> tags = new HashMap<>();
    final Map<String, Page> pages = new HashMap<>();

    final List<TombstoneKey> deletesReceived = new ArrayList<>();
    final List<Tag> tagsReceived = new ArrayList<>();
    final List<Page> pagesReceived = new ArrayList<>();

    int fetches;
    int failFetches;          // fail this many fetches, then succeed
    boolean fetchRetryable = true;
    boolean failUpserts;
    boolean failDeletes;
    boolean softDeletes;

    CountDownLatch fetchEntered;   // optional: signalled when a fetch starts
    CountDownLatch fetchRelease;   // optional: fetch blocks until released

    @Override
    public synchronized DataSnapshot fetchSnapshot() {
        fetches++;
        if (fetchEntered != null) fetchEntered.countDown();
        if (fetchRelease != null) {
            try {
                fetchRelease.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SyncException("interrupted", true, e);
            }
        }
        if (failFetches > 0) {
            failFetches--;
            throw new SyncException("remote unavailable", fetchRetryable);
        }
        return new DataSnapshot(tags, pages);
    }

    @Override
    public synchronized void upsertTags(Collection<Tag> batch) {
        if (failUpserts) throw new SyncException("upsert rejected", true);
        for (Tag t : batch) {
            tags.put(t.id(), t);
            tagsReceived.add(t);
        }
    }

    @Override
    public synchronized void upsertPages(Collection<Page> batch) {
        if (failUpserts) throw new SyncException("upsert rejected", true);
        for (Page p : batch) {
            pages.put(p.id(), p);
            pagesReceived.add(p);
        }
    }

    @Override
    public synchronized void markDeleted(TombstoneKey key) {
        if (failDeletes) throw new SyncException("delete rejected", true);
        deletesReceived.add(key);
        if (key.kind() == EntityKind.TAG) {
            Tag t = tags.remove(key.id());
            if (softDeletes && t != null) {
                tags.put(t.id(), new Tag(t.id(), t.name(), t.description(), t.color(),
                        t.createdAt(), t.updatedAt(), true));
            }
        } else {
            Page p = pages.remove(key.id());
            if (softDeletes && p != null) {
                pages.put(p.id(), new Page(p.id(), p.url(), p.title(), p.domain(), p.tags(),
                        p.createdAt(), p.updatedAt(), true, p.favicon(), p.description()));
            }
        }
    }
}
