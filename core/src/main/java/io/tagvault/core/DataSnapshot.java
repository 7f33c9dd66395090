// file: core/src/main/java/io/tagvault/core/DataSnapshot.java
package io.tagvault.core;

import java.util.Map;

/**
 * Immutable pair of entity collections (id -> entity), one per kind.
 * Used for both the local and the remote side of a merge.
 */
public record DataSnapshot(Map<String, Tag> tags, Map<String, Page> pages) {

    public DataSnapshot {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        pages = pages == null ? Map.of() : Map.copyOf(pages);
    }

    public static DataSnapshot empty() {
        return new DataSnapshot(Map.of(), Map.of());
    }
}
