// file: core/src/main/java/io/tagvault/core/SyncEntity.java
package io.tagvault.core;

/**
 * Common view over entities that take part in synchronization.
 * <p>
 * The merge engine only needs the id, the last mutation time and the
 * remote-originated soft-delete flag; everything else is payload.
 */
public sealed interface SyncEntity permits Tag, Page {

    String id();

    /** Mutation time in epoch millis. Never decreases across writes to one id. */
    long updatedAt();

    /** True when the delete originated on the remote side (soft delete). */
    boolean deleted();

    EntityKind kind();
}
