// file: storage/src/main/java/io/tagvault/storage/BackingStore.java
package io.tagvault.storage;

import java.util.Collection;
import java.util.Map;

/**
 * Durable string key -> string value storage.
 * <p>
 * Semantics:
 *  - Writes are durable before they return and survive process restarts.
 *  - Reads are read-after-write consistent within a process lifetime.
 *  - setMultiple() is atomic: after a crash either every entry of the batch
 *    is visible or none is.
 *  - Failures surface as {@link StorageException}.
 */
public interface BackingStore extends AutoCloseable {

    /** @return the stored value, or null if the key is absent */
    String get(String key);

    /** @return values for the keys that exist; absent keys are not in the map */
    Map<String, String> getMultiple(Collection<String> keys);

    void set(String key, String value);

    /** Atomically write every entry of the batch. */
    void setMultiple(Map<String, String> entries);

    void remove(String key);

    @Override
    default void close() {
    }
}
