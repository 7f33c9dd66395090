// file: server/src/test/java/io/tagvault/server/InMemoryBackingStore.java
package io.tagvault.server;

import io.tagvault.storage.BackingStore;
import io.tagvault.storage.StorageException;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * BackingStore kept in a HashMap, for tests.
 * Counts write calls and can be told to fail them.
 */
public final class InMemoryBackingStore implements BackingStore {
    private final Map<String, String> data = new HashMap<>();
    private int writes;
    private boolean failWrites;
    private boolean failReads;

    @Override
    public synchronized String get(String key) {
        checkRead();
        return data.get(key);
    }

    @Override
    public synchronized Map<String, String> getMultiple(Collection<String> keys) {
        checkRead();
        Map<String, String> out = new HashMap<>();
        for (String k : keys) {
            String v = data.get(k);
            if (v != null) out.put(k, v);
        }
        return out;
    }

    @Override
    public synchronized void set(String key, String value) {
        checkWrite();
        writes++;
        data.put(key, value);
    }

    @Override
    public synchronized void setMultiple(Map<String, String> entries) {
        checkWrite();
        writes++;
        data.putAll(entries);
    }

    @Override
    public synchronized void remove(String key) {
        checkWrite();
        writes++;
        data.remove(key);
    }

    // ---------- test hooks ----------

    public synchronized int writes() {
        return writes;
    }

    public synchronized String raw(String key) {
        return data.get(key);
    }

    public synchronized void putRaw(String key, String value) {
        data.put(key, value);
    }

    public synchronized void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public synchronized void failReads(boolean fail) {
        this.failReads = fail;
    }

    private void checkWrite() {
        if (failWrites) throw new StorageException("injected write failure");
    }

    private void checkRead() {
        if (failReads) throw new StorageException("injected read failure");
    }
}
