// file: core/src/main/java/io/tagvault/core/Page.java
package io.tagvault.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable tagged-page entity.
 * <p>
 * Semantics:
 *  - tags is an order-irrelevant set of tag ids, kept sorted so that two
 *    pages with the same tags compare equal and serialize identically.
 *  - favicon and description are optional (null when unset).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Page(
        String id,
        String url,
        String title,
        String domain,
        Set<String> tags,
        long createdAt,
        long updatedAt,
        boolean deleted,
        String favicon,
        String description
) implements SyncEntity {

    public Page {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(url, "url");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        title = title == null ? "" : title;
        domain = domain == null ? "" : domain;
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(tags));
    }

    @Override
    public EntityKind kind() {
        return EntityKind.PAGE;
    }

    public boolean hasTag(String tagId) {
        return tags.contains(tagId);
    }

    public Page withTitle(String newTitle, long now) {
        return new Page(id, url, newTitle, domain, tags, createdAt, now, deleted, favicon, description);
    }

    public Page withMetadata(String newTitle, String newFavicon, String newDescription, long now) {
        return new Page(id, url, newTitle, domain, tags, createdAt, now, deleted, newFavicon, newDescription);
    }

    public Page withTagAdded(String tagId, long now) {
        Set<String> next = new TreeSet<>(tags);
        next.add(tagId);
        return new Page(id, url, title, domain, next, createdAt, now, deleted, favicon, description);
    }

    public Page withTagRemoved(String tagId, long now) {
        Set<String> next = new TreeSet<>(tags);
        next.remove(tagId);
        return new Page(id, url, title, domain, next, createdAt, now, deleted, favicon, description);
    }
}
