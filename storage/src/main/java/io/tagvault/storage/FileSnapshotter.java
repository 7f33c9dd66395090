// file: storage/src/main/java/io/tagvault/storage/FileSnapshotter.java
package io.tagvault.storage;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation, one file per snapshot.
 * <p>
 * Format:
 *   int64 seq
 *   int32 count
 *   repeated 'count' times:
 *     - key:   int32 len + UTF-8 bytes
 *     - value: int32 len + UTF-8 bytes
 * <p>
 * Atomicity:
 *   - written to "snapshot-&lt;seq&gt;.bin.tmp" and fsynced,
 *   - then moved to "snapshot-&lt;seq&gt;.bin" with ATOMIC_MOVE,
 *   - older snapshots are deleted afterwards.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new StorageException("cannot create snapshot dir " + dir, e); }
    }

    @Override
    public String writeSnapshot(long seq, Map<String, String> current) {
        String name = String.format("%s%020d%s", PREFIX, seq, SUFFIX);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING))) {
            out.writeLong(seq);
            out.writeInt(current.size());
            for (Map.Entry<String, String> e : current.entrySet()) {
                writeString(out, e.getKey());
                writeString(out, e.getValue());
            }
        } catch (IOException ex) {
            throw new StorageException("snapshot write failed: " + tmp, ex);
        }

        try {
            try (FileChannel c = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                c.force(true);
            }
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("snapshot publish failed: " + dst, e);
        }

        pruneOlderThan(dst);
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> all = completeSnapshots();
        if (all.isEmpty()) return null;
        Path snap = all.get(all.size() - 1);

        try (var in = new DataInputStream(Files.newInputStream(snap))) {
            long seq = in.readLong();
            int count = in.readInt();
            Map<String, String> map = new HashMap<>(count * 2);
            for (int i = 0; i < count; i++) {
                String key = readString(in);
                map.put(key, readString(in));
            }
            return new LoadedSnapshot(snap.getFileName().toString(), seq, map);
        } catch (IOException e) {
            throw new StorageException("snapshot load failed: " + snap, e);
        }
    }

    // ---------- helpers ----------

    private List<Path> completeSnapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("cannot list snapshot dir " + dir, e);
        }
    }

    private void pruneOlderThan(Path keep) {
        for (Path p : completeSnapshots()) {
            if (p.getFileName().compareTo(keep.getFileName()) < 0) {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new StorageException("cannot delete old snapshot " + p, e);
                }
            }
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        byte[] b = in.readNBytes(len);
        if (b.length != len) throw new IOException("truncated snapshot");
        return new String(b, StandardCharsets.UTF_8);
    }
}
