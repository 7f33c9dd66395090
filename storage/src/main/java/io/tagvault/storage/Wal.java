// file: storage/src/main/java/io/tagvault/storage/Wal.java
package io.tagvault.storage;

/**
 * Write-ahead log of store batches.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partially written record
 *    is treated as absent during recovery.
 *  - append() fsyncs before returning.
 *  - truncate() discards every record; only called once the records are
 *    covered by a durable snapshot.
 */
public interface Wal extends AutoCloseable {

    /** Append a header+payload record (see {@link RecordCodec#encode}) and fsync it. */
    void append(byte[] serializedRecord);

    /** Start a new segment if the current one is over the size threshold. */
    void rotateIfNeeded();

    /** Drop all segments and continue in a fresh, empty one. */
    void truncate();

    /** Total bytes currently held in all segments, including any torn tail. */
    long sizeBytes();

    /**
     * Sequential reader over every segment, oldest first.
     * Stops at the first corrupt or truncated record.
     */
    WalReader openReader();

    @Override
    void close();

    interface WalReader extends AutoCloseable {

        /** @return next valid payload (without header), or null at end or at a torn tail */
        byte[] next();

        @Override
        void close();
    }
}
