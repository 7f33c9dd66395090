// file: server/src/main/java/io/tagvault/server/store/EntityStore.java
package io.tagvault.server.store;

import io.tagvault.core.ChangeLedger;
import io.tagvault.core.DataSnapshot;
import io.tagvault.core.EntityKind;
import io.tagvault.core.MutationClock;
import io.tagvault.core.Page;
import io.tagvault.core.SyncEntity;
import io.tagvault.core.Tag;
import io.tagvault.core.TombstoneKey;
import io.tagvault.core.TombstoneLedger;
import io.tagvault.server.error.BusinessRuleException;
import io.tagvault.server.error.PersistenceException;
import io.tagvault.server.error.ValidationException;
import io.tagvault.storage.BackingStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * In-memory authoritative copy of tags, pages and pending deletions,
 * backed by a {@link BackingStore}.
 * <p>
 * Responsibilities:
 *  - Rehydrate from the backing store on first use (readiness cache).
 *  - Validate input and apply business rules before mutating anything.
 *  - Track which persisted documents are dirty, and write all of them in
 *    one atomic batch on {@link #commit()}.
 *  - Record a tombstone in the same commit as every local delete, and a
 *    pending change in the same commit as every local create or update.
 * <p>
 * Not thread-safe: the command pipeline serializes every access.
 */
public final class EntityStore {
    private static final Logger log = Logger.getLogger(EntityStore.class.getName());

    public static final int MAX_TAG_NAME_LENGTH = 50;
    public static final int MAX_TEXT_LENGTH = 500;
    public static final int MAX_URL_LENGTH = 2048;

    private static final Pattern COLOR = Pattern.compile("#[0-9a-fA-F]{6}");
    private static final List<String> PALETTE = List.of(
            "#3b82f6", "#ef4444", "#10b981", "#f59e0b",
            "#8b5cf6", "#ec4899", "#14b8a6", "#f97316");

    private final BackingStore backing;
    private final StateCodec codec;
    private final MutationClock clock;
    private final Supplier<String> tagIds;

    private final Map<String, Tag> tags = new HashMap<>();
    private final Map<String, Page> pages = new HashMap<>();
    private final TombstoneLedger ledger = new TombstoneLedger();
    private final ChangeLedger changes = new ChangeLedger();

    private boolean loaded;
    private boolean tagsDirty;
    private boolean pagesDirty;

    public EntityStore(BackingStore backing, MutationClock clock) {
        this(backing, new StateCodec(), clock, () -> UUID.randomUUID().toString());
    }

    public EntityStore(BackingStore backing, StateCodec codec, MutationClock clock, Supplier<String> tagIds) {
        this.backing = Objects.requireNonNull(backing, "backing");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tagIds = Objects.requireNonNull(tagIds, "tagIds");
    }

    /** Result of {@link #createTagAndAddToPage}. */
    public record TagAssignment(Tag tag, Page page, boolean tagCreated) {}

    /** Counters for the getDataStats operation. */
    public record DataStats(int tagCount, int pageCount, int taggedPageCount, int pendingDeletions, int pendingChanges) {}

    // ---------- lifecycle ----------

    public boolean isLoaded() {
        return loaded;
    }

    /** Load persisted state unless already loaded. */
    public void ensureLoaded() {
        if (loaded) return;
        Map<String, String> raw;
        try {
            raw = backing.getMultiple(StateKeys.ALL);
        } catch (RuntimeException e) {
            throw new PersistenceException("failed to read persisted state", e);
        }
        Map<String, Tag> t = codec.decodeTags(raw.get(StateKeys.TAGS));
        Map<String, Page> p = codec.decodePages(raw.get(StateKeys.PAGES));
        List<TombstoneKey> d = codec.decodeTombstones(raw.get(StateKeys.PENDING_DELETES));

        tags.clear();
        tags.putAll(t);
        pages.clear();
        pages.putAll(p);
        ledger.load(d);
        changes.load(codec.decodeChanges(raw.get(StateKeys.PENDING_CHANGES)));
        tagsDirty = false;
        pagesDirty = false;
        loaded = true;
        log.fine(() -> String.format("rehydrated %d tags, %d pages, %d pending deletes, %d pending changes",
                tags.size(), pages.size(), ledger.size(), changes.size()));
    }

    /** Drop the in-memory copy; the next {@link #ensureLoaded()} re-reads the persisted view. */
    public void invalidate() {
        tags.clear();
        pages.clear();
        ledger.load(List.of());
        changes.load(Map.of());
        tagsDirty = false;
        pagesDirty = false;
        loaded = false;
    }

    public boolean isDirty() {
        return tagsDirty || pagesDirty || ledger.isDirty() || changes.isDirty();
    }

    /**
     * Write every dirty document in one atomic batch.
     *
     * @return true if anything was written
     * @throws PersistenceException if the backing store rejects the write
     */
    public boolean commit() {
        requireLoaded();
        if (!isDirty()) return false;

        Map<String, String> batch = new LinkedHashMap<>();
        if (tagsDirty) batch.put(StateKeys.TAGS, codec.encodeTags(tags));
        if (pagesDirty) batch.put(StateKeys.PAGES, codec.encodePages(pages));
        if (ledger.isDirty()) batch.put(StateKeys.PENDING_DELETES, codec.encodeTombstones(ledger.pending()));
        if (changes.isDirty()) batch.put(StateKeys.PENDING_CHANGES, codec.encodeChanges(changes));

        try {
            backing.setMultiple(batch);
        } catch (RuntimeException e) {
            throw new PersistenceException("commit failed for " + batch.keySet(), e);
        }
        tagsDirty = false;
        pagesDirty = false;
        ledger.markClean();
        changes.markClean();
        return true;
    }

    // ---------- tag queries ----------

    public List<Tag> allTags() {
        requireLoaded();
        List<Tag> out = new ArrayList<>(tags.values());
        out.sort(Comparator.comparing((Tag t) -> t.name().toLowerCase(Locale.ROOT)).thenComparing(Tag::id));
        return out;
    }

    public Optional<Tag> findTag(String tagId) {
        requireLoaded();
        return Optional.ofNullable(tags.get(tagId));
    }

    public Tag getTag(String tagId) {
        return findTag(tagId).orElseThrow(() -> new BusinessRuleException("tag not found: " + tagId));
    }

    public Optional<Tag> findTagByName(String name) {
        requireLoaded();
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return tags.values().stream()
                .filter(t -> t.name().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    /** Number of pages carrying each tag; unused tags map to 0. */
    public Map<String, Integer> tagUsageCounts() {
        requireLoaded();
        Map<String, Integer> counts = new HashMap<>();
        for (String id : tags.keySet()) counts.put(id, 0);
        for (Page p : pages.values()) {
            for (String tagId : p.tags()) {
                counts.computeIfPresent(tagId, (k, n) -> n + 1);
            }
        }
        return counts;
    }

    // ---------- tag mutations ----------

    public Tag createTag(String name, String description, String color) {
        requireLoaded();
        String cleanName = validateTagName(name);
        String cleanDescription = optionalText("description", description);
        String cleanColor = optionalColor(color);
        ensureNameFree(cleanName, null);

        String id = tagIds.get();
        while (tags.containsKey(id) || ledger.isPending(EntityKind.TAG, id)) {
            id = tagIds.get();
        }
        String finalColor = cleanColor != null ? cleanColor : PALETTE.get(tags.size() % PALETTE.size());
        Tag tag = Tag.create(id, cleanName, cleanDescription, finalColor, clock.now());
        tags.put(id, tag);
        tagsDirty = true;
        changes.markChanged(EntityKind.TAG, id);
        return tag;
    }

    /**
     * Change name, description or color. A null argument leaves the field as is.
     * No write is staged when nothing changes.
     */
    public Tag updateTag(String tagId, String name, String description, String color) {
        Tag current = getTag(tagId);
        String newName = name == null ? current.name() : validateTagName(name);
        String newDescription = description == null ? current.description() : optionalText("description", description);
        String newColor = color == null ? current.color() : optionalColor(color);
        if (!newName.equalsIgnoreCase(current.name())) {
            ensureNameFree(newName, tagId);
        }

        if (Objects.equals(newName, current.name())
                && Objects.equals(newDescription, current.description())
                && Objects.equals(newColor, current.color())) {
            return current;
        }
        Tag updated = current.withDetails(newName, newDescription, newColor, clock.nextAfter(current.updatedAt()));
        tags.put(tagId, updated);
        tagsDirty = true;
        changes.markChanged(EntityKind.TAG, tagId);
        return updated;
    }

    /** Remove a tag everywhere and record a pending delete for it. */
    public void deleteTag(String tagId) {
        getTag(tagId);
        tags.remove(tagId);
        tagsDirty = true;
        for (Page p : List.copyOf(pages.values())) {
            if (p.hasTag(tagId)) {
                pages.put(p.id(), p.withTagRemoved(tagId, clock.nextAfter(p.updatedAt())));
                pagesDirty = true;
                changes.markChanged(EntityKind.PAGE, p.id());
            }
        }
        changes.clear(EntityKind.TAG, tagId);
        ledger.recordDeletion(EntityKind.TAG, tagId);
    }

    // ---------- page queries ----------

    /** All pages, most recently updated first. */
    public List<Page> allPages() {
        requireLoaded();
        return sortedPages(pages.values());
    }

    public Page getPage(String pageId) {
        requireLoaded();
        Page p = pages.get(pageId);
        if (p == null) throw new BusinessRuleException("page not found: " + pageId);
        return p;
    }

    /**
     * Pages carrying the given tag, or every page with at least one tag
     * when {@code tagId} is null. Most recently updated first.
     */
    public List<Page> pagesForTag(String tagId) {
        requireLoaded();
        if (tagId == null) {
            return sortedPages(pages.values().stream().filter(p -> !p.tags().isEmpty()).toList());
        }
        getTag(tagId);
        return sortedPages(pages.values().stream().filter(p -> p.hasTag(tagId)).toList());
    }

    // ---------- page mutations ----------

    /**
     * Create a page for the URL, or refresh the metadata of the existing one.
     * Existing tags are kept. Re-registering a locally deleted URL revokes
     * its pending delete.
     */
    public Page registerPage(String url, String title, String favicon, String description) {
        requireLoaded();
        String cleanUrl = requireText("url", url, MAX_URL_LENGTH);
        String cleanTitle = optionalText("title", title);
        String cleanFavicon = optionalText("favicon", favicon);
        String cleanDescription = optionalText("description", description);

        String id = PageIds.idFor(cleanUrl);
        Page existing = pages.get(id);
        Page next;
        if (existing == null) {
            long now = clock.now();
            next = new Page(id, cleanUrl, cleanTitle == null ? cleanUrl : cleanTitle, PageIds.domainOf(cleanUrl),
                    Set.of(), now, now, false, cleanFavicon, cleanDescription);
        } else {
            next = existing.withMetadata(
                    cleanTitle != null ? cleanTitle : existing.title(),
                    cleanFavicon != null ? cleanFavicon : existing.favicon(),
                    cleanDescription != null ? cleanDescription : existing.description(),
                    clock.nextAfter(existing.updatedAt()));
        }
        pages.put(id, next);
        pagesDirty = true;
        changes.markChanged(EntityKind.PAGE, id);
        if (ledger.clearDeletion(EntityKind.PAGE, id)) {
            log.fine(() -> "page re-registered, pending delete revoked: " + id);
        }
        return next;
    }

    public Page updatePageTitle(String pageId, String title) {
        String cleanTitle = requireText("title", title, MAX_TEXT_LENGTH);
        Page current = getPage(pageId);
        if (cleanTitle.equals(current.title())) return current;
        Page updated = current.withTitle(cleanTitle, clock.nextAfter(current.updatedAt()));
        pages.put(pageId, updated);
        pagesDirty = true;
        changes.markChanged(EntityKind.PAGE, pageId);
        return updated;
    }

    /** @return false if the page already had the tag */
    public boolean addTagToPage(String pageId, String tagId) {
        requireText("pageId", pageId, MAX_URL_LENGTH);
        requireText("tagId", tagId, MAX_TEXT_LENGTH);
        Page page = getPage(pageId);
        getTag(tagId);
        if (page.hasTag(tagId)) return false;
        pages.put(pageId, page.withTagAdded(tagId, clock.nextAfter(page.updatedAt())));
        pagesDirty = true;
        changes.markChanged(EntityKind.PAGE, pageId);
        return true;
    }

    /** @return false if the page did not have the tag */
    public boolean removeTagFromPage(String pageId, String tagId) {
        requireText("pageId", pageId, MAX_URL_LENGTH);
        requireText("tagId", tagId, MAX_TEXT_LENGTH);
        Page page = getPage(pageId);
        if (!page.hasTag(tagId)) return false;
        pages.put(pageId, page.withTagRemoved(tagId, clock.nextAfter(page.updatedAt())));
        pagesDirty = true;
        changes.markChanged(EntityKind.PAGE, pageId);
        return true;
    }

    /**
     * Attach a tag by name, reusing an existing tag with the same name
     * (case-insensitive) or creating it.
     */
    public TagAssignment createTagAndAddToPage(String tagName, String pageId) {
        String cleanName = validateTagName(tagName);
        getPage(pageId);

        Optional<Tag> existing = findTagByName(cleanName);
        Tag tag = existing.orElseGet(() -> createTag(cleanName, null, null));
        addTagToPage(pageId, tag.id());
        return new TagAssignment(tag, pages.get(pageId), existing.isEmpty());
    }

    /** Remove a page and record a pending delete for it. */
    public void deletePage(String pageId) {
        getPage(pageId);
        pages.remove(pageId);
        pagesDirty = true;
        changes.clear(EntityKind.PAGE, pageId);
        ledger.recordDeletion(EntityKind.PAGE, pageId);
    }

    public DataStats stats() {
        requireLoaded();
        int tagged = (int) pages.values().stream().filter(p -> !p.tags().isEmpty()).count();
        return new DataStats(tags.size(), pages.size(), tagged, ledger.size(), changes.size());
    }

    // ---------- sync support ----------

    public DataSnapshot snapshot() {
        requireLoaded();
        return new DataSnapshot(tags, pages);
    }

    public Set<TombstoneKey> pendingDeletions() {
        requireLoaded();
        return ledger.pending();
    }

    public boolean isPendingDeletion(EntityKind kind, String id) {
        requireLoaded();
        return ledger.isPending(kind, id);
    }

    /** Current version of every entity with a local change the remote has not accepted yet. */
    public DataSnapshot pendingChanges() {
        requireLoaded();
        return new DataSnapshot(present(changes.changed(EntityKind.TAG), tags),
                present(changes.changed(EntityKind.PAGE), pages));
    }

    public boolean hasPendingChange(EntityKind kind, String id) {
        requireLoaded();
        return changes.isChanged(kind, id);
    }

    /**
     * The remote accepted these versions. Marks are cleared only where the
     * local entity is still exactly that version, so edits made while the
     * push was in flight stay pending.
     */
    public void markSynced(Collection<? extends SyncEntity> accepted) {
        requireLoaded();
        for (SyncEntity e : accepted) {
            SyncEntity current = e.kind() == EntityKind.TAG ? tags.get(e.id()) : pages.get(e.id());
            if (current == null || current.equals(e)) {
                changes.clear(e.kind(), e.id());
            }
        }
    }

    /**
     * Replace both collections with a merge result and clear the tombstones
     * the remote side has confirmed. Pending changes of entities the merge
     * removed are dropped. Only changed documents become dirty.
     */
    public void replaceAll(DataSnapshot merged, Collection<TombstoneKey> confirmed) {
        requireLoaded();
        if (!tags.equals(merged.tags())) {
            tags.clear();
            tags.putAll(merged.tags());
            tagsDirty = true;
        }
        if (!pages.equals(merged.pages())) {
            pages.clear();
            pages.putAll(merged.pages());
            pagesDirty = true;
        }
        for (TombstoneKey k : confirmed) {
            ledger.clearDeletion(k.kind(), k.id());
        }
        for (String id : changes.changed(EntityKind.TAG)) {
            if (!tags.containsKey(id)) changes.clear(EntityKind.TAG, id);
        }
        for (String id : changes.changed(EntityKind.PAGE)) {
            if (!pages.containsKey(id)) changes.clear(EntityKind.PAGE, id);
        }
    }

    // ---------- helpers ----------

    private void requireLoaded() {
        if (!loaded) throw new IllegalStateException("entity store used before ensureLoaded()");
    }

    private static <T> Map<String, T> present(Set<String> ids, Map<String, T> from) {
        Map<String, T> out = new HashMap<>();
        for (String id : ids) {
            T e = from.get(id);
            if (e != null) out.put(id, e);
        }
        return out;
    }

    private static List<Page> sortedPages(Collection<Page> in) {
        List<Page> out = new ArrayList<>(in);
        out.sort(Comparator.comparingLong(Page::updatedAt).reversed().thenComparing(Page::id));
        return out;
    }

    private void ensureNameFree(String name, String exceptTagId) {
        Optional<Tag> clash = findTagByName(name);
        if (clash.isPresent() && !clash.get().id().equals(exceptTagId)) {
            throw new BusinessRuleException("a tag named '" + clash.get().name() + "' already exists");
        }
    }

    static String validateTagName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "tag name must not be empty");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_TAG_NAME_LENGTH) {
            throw new ValidationException("name", "tag name must be at most " + MAX_TAG_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    private static String requireText(String field, String value, int max) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " must not be empty");
        }
        String trimmed = value.trim();
        if (trimmed.length() > max) {
            throw new ValidationException(field, field + " must be at most " + max + " characters");
        }
        return trimmed;
    }

    /** Null or blank means unset. */
    private static String optionalText(String field, String value) {
        if (value == null || value.isBlank()) return null;
        String trimmed = value.trim();
        int max = "url".equals(field) || "favicon".equals(field) ? MAX_URL_LENGTH : MAX_TEXT_LENGTH;
        if (trimmed.length() > max) {
            throw new ValidationException(field, field + " must be at most " + max + " characters");
        }
        return trimmed;
    }

    private static String optionalColor(String color) {
        if (color == null || color.isBlank()) return null;
        String trimmed = color.trim();
        if (!COLOR.matcher(trimmed).matches()) {
            throw new ValidationException("color", "color must look like #RRGGBB");
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
