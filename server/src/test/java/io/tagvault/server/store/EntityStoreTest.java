// file: server/src/test/java/io/tagvault/server/store/EntityStoreTest.java
package io.tagvault.server.store;

import io.tagvault.core.EntityKind;
import io.tagvault.core.MutationClock;
import io.tagvault.core.Page;
import io.tagvault.core.Tag;
import io.tagvault.core.TombstoneKey;
import io.tagvault.server.InMemoryBackingStore;
import io.tagvault.server.ManualClock;
import io.tagvault.server.error.BusinessRuleException;
import io.tagvault.server.error.PersistenceException;
import io.tagvault.server.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Business rules and persistence layout of the entity store, without the pipeline.
 */
class EntityStoreTest {

    private InMemoryBackingStore backing;
    private ManualClock wall;
    private EntityStore store;

    @BeforeEach
    void setUp() {
        backing = new InMemoryBackingStore();
        wall = new ManualClock(1_000);
        store = newStore();
        store.ensureLoaded();
    }

    private EntityStore newStore() {
        AtomicInteger ids = new AtomicInteger();
        return new EntityStore(backing, new StateCodec(), new MutationClock(wall), () -> "t" + ids.incrementAndGet());
    }

    @Test
    void create_tag_trims_name_and_assigns_palette_color() {
        Tag t = store.createTag("  Research  ", null, null);

        assertEquals("t1", t.id());
        assertEquals("Research", t.name());
        assertNotNull(t.color());
        assertTrue(t.color().matches("#[0-9a-f]{6}"));
        assertEquals(1_000, t.createdAt());
        assertEquals(1_000, t.updatedAt());
        assertFalse(t.deleted());
        assertTrue(store.isDirty());
    }

    @Test
    void explicit_color_is_normalized_to_lower_case() {
        Tag t = store.createTag("Work", "job stuff", "#A1B2C3");
        assertEquals("#a1b2c3", t.color());
        assertEquals("job stuff", t.description());
    }

    @Test
    void tag_names_are_unique_ignoring_case() {
        store.createTag("Work", null, null);
        assertThrows(BusinessRuleException.class, () -> store.createTag("  WORK ", null, null));
    }

    @Test
    void invalid_tag_input_is_rejected_before_anything_changes() {
        assertThrows(ValidationException.class, () -> store.createTag("   ", null, null));
        assertThrows(ValidationException.class, () -> store.createTag("x".repeat(51), null, null));
        assertThrows(ValidationException.class, () -> store.createTag("ok", null, "red"));
        assertFalse(store.isDirty());
        assertTrue(store.allTags().isEmpty());
    }

    @Test
    void fifty_character_name_is_accepted() {
        Tag t = store.createTag("y".repeat(50), null, null);
        assertEquals(50, t.name().length());
    }

    @Test
    void update_without_changes_stages_nothing() {
        Tag t = store.createTag("Work", null, "#112233");
        store.commit();

        Tag same = store.updateTag(t.id(), "Work", null, null);

        assertEquals(t, same);
        assertFalse(store.isDirty());
    }

    @Test
    void update_bumps_updated_at_monotonically() {
        Tag t = store.createTag("Work", null, null);
        wall.set(500); // wall clock stepped backwards

        Tag renamed = store.updateTag(t.id(), "Job", null, null);

        assertEquals("Job", renamed.name());
        assertTrue(renamed.updatedAt() >= t.updatedAt());
        assertEquals(t.createdAt(), renamed.createdAt());
    }

    @Test
    void rename_to_own_name_with_different_case_is_allowed() {
        Tag t = store.createTag("work", null, null);
        Tag renamed = store.updateTag(t.id(), "Work", null, null);
        assertEquals("Work", renamed.name());
    }

    @Test
    void unknown_tag_is_a_business_rule_violation() {
        assertThrows(BusinessRuleException.class, () -> store.updateTag("nope", "x", null, null));
        assertThrows(BusinessRuleException.class, () -> store.deleteTag("nope"));
        assertThrows(BusinessRuleException.class, () -> store.pagesForTag("nope"));
    }

    @Test
    void delete_tag_cascades_to_pages_and_records_tombstone() {
        Tag t = store.createTag("Work", null, null);
        Page p = store.registerPage("https://example.com/a", "A", null, null);
        store.addTagToPage(p.id(), t.id());
        store.commit();
        int before = backing.writes();

        wall.advance(10);
        store.deleteTag(t.id());
        assertTrue(store.commit());

        assertEquals(before + 1, backing.writes());
        assertTrue(store.findTag(t.id()).isEmpty());
        assertFalse(store.getPage(p.id()).hasTag(t.id()));
        assertTrue(store.isPendingDeletion(EntityKind.TAG, t.id()));
        assertEquals(Set.of(TombstoneKey.tag(t.id())), store.pendingDeletions());
        assertNotNull(backing.raw(StateKeys.PENDING_DELETES));
        assertTrue(backing.raw(StateKeys.PENDING_DELETES).contains("tag:" + t.id()));
    }

    @Test
    void register_same_url_twice_updates_one_page_and_keeps_tags() {
        Tag t = store.createTag("Work", null, null);
        Page first = store.registerPage("https://Example.com/a?x=1", "First", null, null);
        store.addTagToPage(first.id(), t.id());

        wall.advance(5);
        Page second = store.registerPage("https://Example.com/a?x=1", "Second", "https://example.com/f.ico", null);

        assertEquals(first.id(), second.id());
        assertEquals("Second", second.title());
        assertEquals("example.com", second.domain());
        assertEquals("https://example.com/f.ico", second.favicon());
        assertTrue(second.hasTag(t.id()));
        assertEquals(1, store.allPages().size());
    }

    @Test
    void page_without_title_uses_url_and_derived_domain() {
        Page p = store.registerPage("about:blank", null, null, null);
        assertEquals("about:blank", p.title());
        assertEquals("about-page", p.domain());
    }

    @Test
    void re_registering_a_deleted_url_revokes_its_tombstone() {
        Page p = store.registerPage("https://example.com/a", "A", null, null);
        store.deletePage(p.id());
        assertTrue(store.isPendingDeletion(EntityKind.PAGE, p.id()));

        store.registerPage("https://example.com/a", "A again", null, null);

        assertFalse(store.isPendingDeletion(EntityKind.PAGE, p.id()));
        assertEquals("A again", store.getPage(p.id()).title());
    }

    @Test
    void add_and_remove_tag_report_whether_anything_changed() {
        Tag t = store.createTag("Work", null, null);
        Page p = store.registerPage("https://example.com/a", "A", null, null);

        assertTrue(store.addTagToPage(p.id(), t.id()));
        assertFalse(store.addTagToPage(p.id(), t.id()));
        assertTrue(store.removeTagFromPage(p.id(), t.id()));
        assertFalse(store.removeTagFromPage(p.id(), t.id()));
    }

    @Test
    void create_tag_and_add_reuses_existing_tag_by_name() {
        Tag existing = store.createTag("Reading", null, null);
        Page p = store.registerPage("https://example.com/a", "A", null, null);

        EntityStore.TagAssignment a = store.createTagAndAddToPage("reading", p.id());

        assertFalse(a.tagCreated());
        assertEquals(existing.id(), a.tag().id());
        assertTrue(a.page().hasTag(existing.id()));
        assertEquals(1, store.allTags().size());

        EntityStore.TagAssignment b = store.createTagAndAddToPage("Later", p.id());
        assertTrue(b.tagCreated());
        assertEquals(2, store.allTags().size());
    }

    @Test
    void create_tag_and_add_on_missing_page_creates_nothing() {
        assertThrows(BusinessRuleException.class, () -> store.createTagAndAddToPage("New", "missing"));
        assertTrue(store.allTags().isEmpty());
    }

    @Test
    void tagged_pages_and_usage_counts() {
        Tag work = store.createTag("Work", null, null);
        Tag fun = store.createTag("Fun", null, null);
        Page a = store.registerPage("https://example.com/a", "A", null, null);
        wall.advance(1);
        Page b = store.registerPage("https://example.com/b", "B", null, null);
        store.registerPage("https://example.com/c", "C", null, null);
        store.addTagToPage(a.id(), work.id());
        wall.advance(1);
        store.addTagToPage(b.id(), work.id());

        List<Page> tagged = store.pagesForTag(null);
        assertEquals(List.of(b.id(), a.id()), tagged.stream().map(Page::id).toList());
        assertEquals(2, store.pagesForTag(work.id()).size());
        assertTrue(store.pagesForTag(fun.id()).isEmpty());

        assertEquals(2, store.tagUsageCounts().get(work.id()));
        assertEquals(0, store.tagUsageCounts().get(fun.id()));

        EntityStore.DataStats stats = store.stats();
        assertEquals(2, stats.tagCount());
        assertEquals(3, stats.pageCount());
        assertEquals(2, stats.taggedPageCount());
        assertEquals(0, stats.pendingDeletions());
    }

    @Test
    void committed_state_rehydrates_in_a_fresh_store() {
        Tag t = store.createTag("Work", "desc", null);
        Page p = store.registerPage("https://example.com/a", "A", null, null);
        store.addTagToPage(p.id(), t.id());
        store.commit();
        store.deletePage(p.id());
        store.commit();

        EntityStore reopened = newStore();
        reopened.ensureLoaded();

        assertEquals(List.of(t), reopened.allTags());
        assertTrue(reopened.allPages().isEmpty());
        assertEquals(Set.of(TombstoneKey.page(p.id())), reopened.pendingDeletions());
    }

    @Test
    void local_mutations_are_recorded_as_pending_changes() {
        Tag t = store.createTag("Work", null, null);
        Page p = store.registerPage("https://example.com/a", "A", null, null);

        assertTrue(store.hasPendingChange(EntityKind.TAG, t.id()));
        assertTrue(store.hasPendingChange(EntityKind.PAGE, p.id()));
        assertEquals(2, store.stats().pendingChanges());

        store.deletePage(p.id());

        assertFalse(store.hasPendingChange(EntityKind.PAGE, p.id()));
        assertEquals(Set.of(t.id()), store.pendingChanges().tags().keySet());
        assertTrue(store.pendingChanges().pages().isEmpty());
    }

    @Test
    void pending_changes_survive_restart() {
        Page p = store.registerPage("https://example.com/a", "A", null, null);
        store.commit();

        EntityStore reopened = newStore();
        reopened.ensureLoaded();

        assertTrue(reopened.hasPendingChange(EntityKind.PAGE, p.id()));
        assertEquals(p, reopened.pendingChanges().pages().get(p.id()));
    }

    @Test
    void mark_synced_keeps_marks_of_entities_edited_since() {
        Tag t = store.createTag("Work", null, null);
        Page p = store.registerPage("https://example.com/a", "A", null, null);
        wall.advance(10);
        store.updatePageTitle(p.id(), "Edited");

        store.markSynced(List.of(t, p));

        assertFalse(store.hasPendingChange(EntityKind.TAG, t.id()));
        assertTrue(store.hasPendingChange(EntityKind.PAGE, p.id()), "remote accepted an older version");
        assertEquals(1, store.stats().pendingChanges());
    }

    @Test
    void invalidate_discards_uncommitted_changes() {
        store.createTag("Work", null, null);
        store.commit();
        store.createTag("Uncommitted", null, null);

        store.invalidate();
        store.ensureLoaded();

        assertEquals(List.of("Work"), store.allTags().stream().map(Tag::name).toList());
        assertFalse(store.isDirty());
    }

    @Test
    void malformed_entry_is_dropped_on_load() {
        backing.putRaw(StateKeys.TAGS, """
                {"good": {"id": "good", "name": "Good", "createdAt": 1, "updatedAt": 1, "deleted": false},
                 "bad":  {"id": "other", "name": "Mismatch", "createdAt": 1, "updatedAt": 1, "deleted": false},
                 "worse": {"name": null}}
                """);

        EntityStore reopened = newStore();
        reopened.ensureLoaded();

        assertEquals(List.of("good"), reopened.allTags().stream().map(Tag::id).toList());
    }

    @Test
    void unreadable_document_fails_the_load() {
        backing.putRaw(StateKeys.PAGES, "{ not json");
        EntityStore reopened = newStore();
        assertThrows(PersistenceException.class, reopened::ensureLoaded);
        assertFalse(reopened.isLoaded());
    }

    @Test
    void commit_writes_only_dirty_documents() {
        store.createTag("Work", null, null);
        store.commit();

        assertNotNull(backing.raw(StateKeys.TAGS));
        assertNull(backing.raw(StateKeys.PAGES));
        assertNull(backing.raw(StateKeys.PENDING_DELETES));
        assertNotNull(backing.raw(StateKeys.PENDING_CHANGES));
        assertFalse(store.commit());
    }
}
