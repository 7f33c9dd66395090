// file: storage/src/main/java/io/tagvault/storage/FileWal.java
package io.tagvault.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to numbered segment
 * files ("00000001.log", "00000002.log", ...).
 * <p>
 *  - On construction: creates the directory and opens the newest segment
 *    for append (or creates the first one).
 *  - append(): writes, then force(true) so data and metadata are on disk.
 *  - rotateIfNeeded(): starts the next segment once rotateBytes is reached.
 *  - truncate(): deletes every segment and opens a fresh one with the next
 *    index, so segment names keep increasing.
 *  - Reader: walks all segments oldest first, validating magic, version,
 *    length and CRC; stops at the first bad or truncated record.
 */
public class FileWal implements Wal {
    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new StorageException("cannot create WAL dir " + dir, e); }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new StorageException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        openSegment(indexOf(current) + 1);
    }

    @Override
    public synchronized void truncate() {
        int next = indexOf(current) + 1;
        try {
            ch.close();
            for (Path seg : segments(dir)) {
                Files.deleteIfExists(seg);
            }
        } catch (IOException e) {
            throw new StorageException("WAL truncate failed", e);
        }
        openSegment(next);
    }

    @Override
    public synchronized long sizeBytes() {
        long total = 0;
        try {
            for (Path seg : segments(dir)) {
                total += Files.size(seg);
            }
        } catch (IOException e) {
            throw new StorageException("cannot size WAL dir " + dir, e);
        }
        return total;
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public synchronized void close() {
        try {
            if (ch != null && ch.isOpen()) ch.close();
        } catch (IOException e) {
            throw new StorageException("WAL close failed", e);
        }
    }

    // ---------- helpers ----------

    private void openNewestOrCreate() {
        List<Path> segs = segments(dir);
        int index = segs.isEmpty() ? 1 : indexOf(segs.get(segs.size() - 1));
        openSegment(index);
    }

    private void openSegment(int index) {
        try {
            if (ch != null && ch.isOpen()) ch.close();
            current = dir.resolve(String.format("%08d.log", index));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new StorageException("cannot open WAL segment " + index, e);
        }
    }

    private static int indexOf(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(".log", ""));
    }

    static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().matches("\\d{8}\\.log"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("cannot list WAL dir " + dir, e);
        }
    }

    /**
     * Sequential reader used during recovery. Moves to the next segment
     * only when the current one ended cleanly.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIndex = -1;
        private FileChannel ch;
        private long pos;
        private boolean stopped;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null) {
                        if (++segIndex >= segments.size()) return null;
                        ch = FileChannel.open(segments.get(segIndex), READ);
                        pos = 0;
                    }
                    if (pos >= ch.size()) {
                        ch.close();
                        ch = null;
                        continue;
                    }
                    byte[] payload = readRecord();
                    if (payload == null) {
                        stopped = true; // torn or corrupt tail
                        return null;
                    }
                    return payload;
                }
            } catch (IOException e) {
                throw new StorageException("WAL read failed", e);
            }
        }

        private byte[] readRecord() throws IOException {
            ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
            int read = ch.read(hdr, pos);
            if (read < RecordCodec.HEADER_BYTES) return null;
            hdr.flip();
            short magic = hdr.getShort();
            byte ver = hdr.get();
            int len = hdr.getInt();
            int crc = hdr.getInt();
            if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
            if (pos + RecordCodec.HEADER_BYTES + len > ch.size()) return null;
            ByteBuffer payload = ByteBuffer.allocate(len);
            int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
            if (r2 < len) return null;
            byte[] bytes = payload.array();
            if (RecordCodec.crc32(bytes) != crc) return null;
            pos += RecordCodec.HEADER_BYTES + len;
            return bytes;
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new StorageException("WAL reader close failed", e);
            }
        }
    }
}
