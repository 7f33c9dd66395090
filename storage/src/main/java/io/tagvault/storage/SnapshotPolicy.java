// file: storage/src/main/java/io/tagvault/storage/SnapshotPolicy.java
package io.tagvault.storage;

/**
 * Triggers a snapshot after every N durable writes.
 * Bounds recovery time by limiting how much WAL has to be replayed.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private int sinceLast;

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Call after each durable write. Returns true (and resets) when a snapshot is due. */
    public synchronized boolean recordWrite() {
        if (++sinceLast >= everyOps) {
            sinceLast = 0;
            return true;
        }
        return false;
    }
}
