// file: core/src/main/java/io/tagvault/core/Tag.java
package io.tagvault.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Immutable tag entity.
 * <p>
 * Optional fields (description, color) are null when unset and omitted
 * from the JSON form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Tag(
        String id,
        String name,
        String description,
        String color,
        long createdAt,
        long updatedAt,
        boolean deleted
) implements SyncEntity {

    public Tag {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
    }

    public static Tag create(String id, String name, String description, String color, long now) {
        return new Tag(id, name, description, color, now, now, false);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.TAG;
    }

    public Tag withDetails(String newName, String newDescription, String newColor, long now) {
        return new Tag(id, newName, newDescription, newColor, createdAt, now, deleted);
    }
}
