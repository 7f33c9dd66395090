// file: storage/src/main/java/io/tagvault/storage/Snapshotter.java
package io.tagvault.storage;

import java.util.Map;

/**
 * Full-copy snapshots that bound WAL replay on restart.
 * <p>
 * A snapshot records the sequence number of the last WAL record it covers;
 * recovery loads the latest snapshot and replays only newer records.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the store.
     *
     * @param seq     last WAL sequence number reflected in {@code current}
     * @param current key -> value map to persist
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(long seq, Map<String, String> current);

    /** @return the latest complete snapshot, or null if none exists */
    LoadedSnapshot loadLatest();

    record LoadedSnapshot(String id, long seq, Map<String, String> data) {}
}
