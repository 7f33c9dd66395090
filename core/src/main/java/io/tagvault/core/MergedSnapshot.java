// file: core/src/main/java/io/tagvault/core/MergedSnapshot.java
package io.tagvault.core;

/**
 * Merge results for both collections of a {@link DataSnapshot}.
 */
public record MergedSnapshot(MergeResult<Tag> tags, MergeResult<Page> pages) {

    public DataSnapshot toSnapshot() {
        return new DataSnapshot(tags.merged(), pages.merged());
    }
}
