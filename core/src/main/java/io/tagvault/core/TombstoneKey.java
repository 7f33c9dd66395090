// file: core/src/main/java/io/tagvault/core/TombstoneKey.java
package io.tagvault.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Typed pending-delete marker: which kind of entity, and which id.
 * <p>
 * The persisted form is the flat string "&lt;kind&gt;:&lt;id&gt;", e.g. "tag:t1".
 */
public record TombstoneKey(EntityKind kind, String id) implements Comparable<TombstoneKey> {

    private static final Comparator<TombstoneKey> ORDER =
            Comparator.comparing(TombstoneKey::kind).thenComparing(TombstoneKey::id);

    public TombstoneKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
    }

    public static TombstoneKey tag(String id) {
        return new TombstoneKey(EntityKind.TAG, id);
    }

    public static TombstoneKey page(String id) {
        return new TombstoneKey(EntityKind.PAGE, id);
    }

    public String wireKey() {
        return kind.wireName() + ":" + id;
    }

    /**
     * Parse the persisted "kind:id" form. The id is everything after the
     * first colon.
     *
     * @throws IllegalArgumentException on a missing separator, unknown kind or empty id
     */
    public static TombstoneKey parse(String wireKey) {
        Objects.requireNonNull(wireKey, "wireKey");
        int sep = wireKey.indexOf(':');
        if (sep <= 0 || sep == wireKey.length() - 1) {
            throw new IllegalArgumentException("malformed tombstone key: " + wireKey);
        }
        EntityKind kind = EntityKind.fromWireName(wireKey.substring(0, sep));
        return new TombstoneKey(kind, wireKey.substring(sep + 1));
    }

    @Override
    public int compareTo(TombstoneKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return wireKey();
    }
}
