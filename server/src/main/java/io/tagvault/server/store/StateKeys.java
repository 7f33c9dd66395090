// file: server/src/main/java/io/tagvault/server/store/StateKeys.java
package io.tagvault.server.store;

import java.util.List;

/**
 * Backing-store keys holding the persisted state. Each value is a JSON document.
 */
public final class StateKeys {
    public static final String TAGS = "tags";
    public static final String PAGES = "pages";
    public static final String PENDING_DELETES = "sync_pending_deletes";
    public static final String PENDING_CHANGES = "sync_pending_changes";

    public static final List<String> ALL = List.of(TAGS, PAGES, PENDING_DELETES, PENDING_CHANGES);

    private StateKeys() {
    }
}
