// file: core/src/test/java/io/tagvault/core/TombstoneLedgerTest.java
package io.tagvault.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TombstoneLedgerTest {

    @Test
    void record_is_idempotent_and_marks_dirty_once() {
        var ledger = new TombstoneLedger();

        assertTrue(ledger.recordDeletion(EntityKind.TAG, "t1"));
        ledger.markClean();
        assertFalse(ledger.recordDeletion(EntityKind.TAG, "t1"));

        assertFalse(ledger.isDirty(), "re-recording an existing marker changes nothing");
        assertEquals(1, ledger.size());
        assertTrue(ledger.isPending(EntityKind.TAG, "t1"));
        assertFalse(ledger.isPending(EntityKind.PAGE, "t1"));
    }

    @Test
    void clear_removes_marker() {
        var ledger = new TombstoneLedger();
        ledger.recordDeletion(EntityKind.PAGE, "p1");
        ledger.markClean();

        assertTrue(ledger.clearDeletion(EntityKind.PAGE, "p1"));
        assertTrue(ledger.isDirty());
        assertFalse(ledger.isPending(EntityKind.PAGE, "p1"));
        assertFalse(ledger.clearDeletion(EntityKind.PAGE, "p1"));
    }

    @Test
    void load_replaces_content_without_dirtying() {
        var ledger = new TombstoneLedger();
        ledger.recordDeletion(EntityKind.TAG, "old");

        ledger.load(List.of(TombstoneKey.page("p9")));

        assertFalse(ledger.isDirty());
        assertEquals(Set.of(TombstoneKey.page("p9")), ledger.pending());
    }

    @Test
    void pending_is_a_detached_copy() {
        var ledger = new TombstoneLedger();
        ledger.recordDeletion(EntityKind.TAG, "t1");
        var snapshot = ledger.pending();

        ledger.recordDeletion(EntityKind.TAG, "t2");

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(TombstoneKey.tag("x")));
    }

    @Test
    void wire_key_round_trips_and_rejects_garbage() {
        assertEquals("tag:t1", TombstoneKey.tag("t1").wireKey());
        assertEquals(TombstoneKey.page("a:b"), TombstoneKey.parse("page:a:b"));

        assertThrows(IllegalArgumentException.class, () -> TombstoneKey.parse("t1"));
        assertThrows(IllegalArgumentException.class, () -> TombstoneKey.parse("tag:"));
        assertThrows(IllegalArgumentException.class, () -> TombstoneKey.parse("widget:1"));
    }
}
