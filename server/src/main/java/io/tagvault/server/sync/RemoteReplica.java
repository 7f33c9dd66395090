// file: server/src/main/java/io/tagvault/server/sync/RemoteReplica.java
package io.tagvault.server.sync;

import io.tagvault.core.DataSnapshot;
import io.tagvault.core.Page;
import io.tagvault.core.Tag;
import io.tagvault.core.TombstoneKey;

import java.util.Collection;

/**
 * The remote copy of the data. Implementations throw
 * {@link io.tagvault.server.error.SyncException} on failure.
 */
public interface RemoteReplica {

    /** Full remote state; entities deleted remotely may be present with deleted=true. */
    DataSnapshot fetchSnapshot();

    void upsertTags(Collection<Tag> tags);

    void upsertPages(Collection<Page> pages);

    /** Delete (or soft-delete) one entity remotely. Deleting an unknown id succeeds. */
    void markDeleted(TombstoneKey key);
}
