// file: core/src/main/java/io/tagvault/core/ConflictResolver.java
package io.tagvault.core;

/**
 * Policy that picks one side when both local and remote hold a live copy
 * of the same id.
 */
public interface ConflictResolver {

    enum Side { LOCAL, REMOTE }

    Side choose(SyncEntity local, SyncEntity remote);

    /**
     * Larger updatedAt wins; on an exact tie the local copy wins.
     * <p>
     * Wall-clock ordering only: truly concurrent edits are not detected.
     */
    final class LastWriterWins implements ConflictResolver {
        @Override
        public Side choose(SyncEntity local, SyncEntity remote) {
            if (local == null || remote == null)
                throw new IllegalArgumentException("both sides must be present");
            return local.updatedAt() >= remote.updatedAt() ? Side.LOCAL : Side.REMOTE;
        }
    }
}
