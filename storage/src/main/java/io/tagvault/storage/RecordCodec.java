// file: storage/src/main/java/io/tagvault/storage/RecordCodec.java
package io.tagvault.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x7A6B
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD]
 *     - seq:   int64, strictly increasing per store
 *     - count: int32 number of writes in the batch
 *         repeated count times:
 *           - key:   int32 len + UTF-8 bytes
 *           - value: int32 len + UTF-8 bytes (len == -1 => removal)
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x7A6B;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 11;

    /**
     * One committed batch. A null value in {@code writes} removes the key.
     */
    record LogRecord(long seq, Map<String, String> writes) {}

    private RecordCodec() {
    }

    static byte[] encode(long seq, Map<String, String> writes) {
        byte[] payload = encodePayload(seq, writes);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long seq = b.getLong();
        int count = b.getInt();
        Map<String, String> writes = new LinkedHashMap<>(count * 2);
        for (int i = 0; i < count; i++) {
            String key = readString(b);
            if (key == null) throw new StorageException("null key in WAL record " + seq);
            writes.put(key, readString(b));
        }
        return new LogRecord(seq, Collections.unmodifiableMap(writes));
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(long seq, Map<String, String> writes) {
        List<byte[]> parts = new ArrayList<>(writes.size() * 2);
        int size = 8 + 4;
        for (Map.Entry<String, String> e : writes.entrySet()) {
            byte[] k = e.getKey().getBytes(StandardCharsets.UTF_8);
            byte[] v = e.getValue() == null ? null : e.getValue().getBytes(StandardCharsets.UTF_8);
            parts.add(k);
            parts.add(v);
            size += 4 + k.length;
            size += 4 + (v == null ? 0 : v.length);
        }

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.putLong(seq);
        b.putInt(writes.size());
        for (byte[] part : parts) {
            writeBytes(b, part);
        }
        return b.array();
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        if (data == null) { b.putInt(-1); return; }
        b.putInt(data.length).put(data);
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) return null;
        byte[] out = new byte[len];
        b.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }
}
