// file: storage/src/test/java/io/tagvault/storage/DurableBackingStoreDurabilityTest.java
package io.tagvault.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DurableBackingStoreDurabilityTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private DurableBackingStore open(int snapshotEvery) {
        return new DurableBackingStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir),
                new SnapshotPolicy(snapshotEvery));
    }

    @Test
    void latest_value_survives_restart() {
        var store1 = open(1000);
        store1.set("k", "v1");
        store1.set("k", "v2");
        store1.close();

        // "Crash": drop the instance, recover from disk
        var store2 = open(1000);
        assertEquals("v2", store2.get("k"));
        store2.close();
    }

    @Test
    void batch_and_remove_survive_restart() {
        var store1 = open(1000);
        store1.setMultiple(Map.of("a", "1", "b", "2", "c", "3"));
        store1.remove("b");
        store1.close();

        var store2 = open(1000);
        assertEquals(Map.of("a", "1", "c", "3"), store2.getMultiple(List.of("a", "b", "c")));
        assertNull(store2.get("b"));
        store2.close();
    }

    @Test
    void values_survive_compaction_and_later_writes() {
        var store1 = open(2);
        store1.set("k1", "v1");
        store1.set("k2", "v2"); // snapshot + WAL truncation here
        store1.set("k1", "v1b"); // only in the WAL
        store1.close();

        var store2 = open(2);
        assertEquals("v1b", store2.get("k1"));
        assertEquals("v2", store2.get("k2"));
        store2.set("k3", "v3");
        store2.close();

        var store3 = open(2);
        assertEquals("v1b", store3.get("k1"));
        assertEquals("v3", store3.get("k3"));
        store3.close();
    }

    @Test
    void rejects_null_values_in_batch_without_writing_anything() {
        var store = open(1000);
        var batch = new java.util.HashMap<String, String>();
        batch.put("ok", "1");
        batch.put("bad", null);

        assertThrows(NullPointerException.class, () -> store.setMultiple(batch));
        assertNull(store.get("ok"));
        store.close();
    }
}
