// file: storage/src/main/java/io/tagvault/storage/DurableBackingStore.java
package io.tagvault.storage;

import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BackingStore} on top of a WAL plus periodic snapshots.
 * <p>
 * Responsibilities:
 *  - Keep an in-memory map key -> value serving all reads.
 *  - On write (single key or batch):
 *      1) encode the whole batch as one WAL record with the next sequence number,
 *      2) append + fsync,
 *      3) apply to memory,
 *      4) rotate the WAL segment if needed,
 *      5) every N batches, snapshot memory and truncate the WAL.
 *  - On startup:
 *      1) load the latest snapshot,
 *      2) replay WAL records with a sequence number above the snapshot's,
 *      3) checkpoint the result and truncate the WAL.
 * <p>
 * A failed append leaves memory untouched, so the caller sees either the
 * whole batch or nothing.
 */
public final class DurableBackingStore implements BackingStore {
    private static final Logger log = Logger.getLogger(DurableBackingStore.class.getName());
    private static final long DEFAULT_ROTATE_BYTES = 64L * 1024 * 1024;

    private final Map<String, String> mem = new HashMap<>();
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private long lastSeq;

    public DurableBackingStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        recover();
    }

    /** Standard layout: {@code <dataDir>/wal} and {@code <dataDir>/snap}. */
    public static DurableBackingStore open(Path dataDir, int snapshotEvery) {
        return new DurableBackingStore(
                new FileWal(dataDir.resolve("wal"), DEFAULT_ROTATE_BYTES),
                new FileSnapshotter(dataDir.resolve("snap")),
                new SnapshotPolicy(snapshotEvery)
        );
    }

    @Override
    public synchronized String get(String key) {
        return mem.get(Objects.requireNonNull(key, "key"));
    }

    @Override
    public synchronized Map<String, String> getMultiple(Collection<String> keys) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String k : keys) {
            String v = mem.get(k);
            if (v != null) out.put(k, v);
        }
        return out;
    }

    @Override
    public void set(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Map<String, String> batch = new HashMap<>();
        batch.put(key, value);
        write(batch);
    }

    @Override
    public void setMultiple(Map<String, String> entries) {
        Objects.requireNonNull(entries, "entries");
        if (entries.isEmpty()) return;
        for (Map.Entry<String, String> e : entries.entrySet()) {
            Objects.requireNonNull(e.getKey(), "key");
            Objects.requireNonNull(e.getValue(), "value for " + e.getKey());
        }
        write(new LinkedHashMap<>(entries));
    }

    @Override
    public void remove(String key) {
        Objects.requireNonNull(key, "key");
        Map<String, String> batch = new HashMap<>();
        batch.put(key, null);
        write(batch);
    }

    @Override
    public void close() {
        wal.close();
    }

    // ---------- internals ----------

    private synchronized void write(Map<String, String> batch) {
        long seq = lastSeq + 1;

        // If the process dies after this returns, recovery replays the batch.
        wal.append(RecordCodec.encode(seq, batch));

        applyToMemory(batch);
        lastSeq = seq;

        wal.rotateIfNeeded();
        if (snapPolicy.recordWrite()) {
            compact();
        }
    }

    /**
     * Snapshot + WAL truncation. A failure here does not fail the write that
     * triggered it: the batch is already durable in the WAL.
     */
    private void compact() {
        try {
            String id = snaps.writeSnapshot(lastSeq, Map.copyOf(mem));
            wal.truncate();
            log.fine(() -> "compacted store into " + id);
        } catch (StorageException e) {
            log.log(Level.WARNING, "snapshot compaction failed; WAL kept", e);
        }
    }

    private void recover() {
        long snapSeq = 0;
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            mem.putAll(loaded.data());
            snapSeq = loaded.seq();
        }
        lastSeq = snapSeq;

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                if (rec.seq() <= snapSeq) continue; // already in the snapshot
                applyToMemory(rec.writes());
                lastSeq = Math.max(lastSeq, rec.seq());
                replayed++;
            }
        }
        int replayedCount = replayed;
        log.info(() -> String.format("store recovered: %d keys, snapshot seq=%d, replayed=%d",
                mem.size(), loaded == null ? 0 : loaded.seq(), replayedCount));

        // Fold the replayed records (and any torn tail) into a fresh snapshot so
        // that new appends never land behind a corrupt record.
        if (wal.sizeBytes() > 0) {
            snaps.writeSnapshot(lastSeq, Map.copyOf(mem));
            wal.truncate();
        }
    }


    private void applyToMemory(Map<String, String> batch) {
        for (Map.Entry<String, String> e : batch.entrySet()) {
            if (e.getValue() == null) {
                mem.remove(e.getKey());
            } else {
                mem.put(e.getKey(), e.getValue());
            }
        }
    }
}
