// file: core/src/main/java/io/tagvault/core/EntityKind.java
package io.tagvault.core;

/**
 * The two entity types the datastore keeps and synchronizes.
 * <p>
 * The wire name is the lower-case prefix used in persisted tombstone keys
 * ("tag:...", "page:...") and in remote replica paths.
 */
public enum EntityKind {
    TAG("tag"),
    PAGE("page");

    private final String wireName;

    EntityKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static EntityKind fromWireName(String name) {
        for (EntityKind k : values()) {
            if (k.wireName.equals(name)) return k;
        }
        throw new IllegalArgumentException("unknown entity kind: " + name);
    }
}
