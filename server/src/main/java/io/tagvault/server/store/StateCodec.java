// file: server/src/main/java/io/tagvault/server/store/StateCodec.java
package io.tagvault.server.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tagvault.core.ChangeLedger;
import io.tagvault.core.EntityKind;
import io.tagvault.core.Page;
import io.tagvault.core.SyncEntity;
import io.tagvault.core.Tag;
import io.tagvault.core.TombstoneKey;
import io.tagvault.server.error.PersistenceException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * JSON encoding of the persisted state.
 * <p>
 * Layout:
 *  - tags / pages: JSON object id -> entity, keys sorted.
 *  - pending deletes: JSON array of "kind:id" strings, sorted.
 *  - pending changes: JSON object kind -> sorted array of ids.
 * <p>
 * Decoding is lenient per entry: an entry that does not bind, or whose id
 * disagrees with its key, is dropped with a warning. A document that is
 * not JSON at all fails the load.
 */
public final class StateCodec {
    private static final Logger log = Logger.getLogger(StateCodec.class.getName());
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, List<String>>> IDS_BY_KIND = new TypeReference<>() {};

    private final ObjectMapper json;

    public StateCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public StateCodec(ObjectMapper json) {
        this.json = json;
    }

    public String encodeTags(Map<String, Tag> tags) {
        return write(new TreeMap<>(tags));
    }

    public String encodePages(Map<String, Page> pages) {
        return write(new TreeMap<>(pages));
    }

    public String encodeTombstones(Collection<TombstoneKey> keys) {
        return write(keys.stream().sorted().map(TombstoneKey::wireKey).toList());
    }

    public String encodeChanges(ChangeLedger ledger) {
        Map<String, List<String>> out = new TreeMap<>();
        for (EntityKind k : EntityKind.values()) {
            out.put(k.wireName(), ledger.changed(k).stream().sorted().toList());
        }
        return write(out);
    }

    public Map<String, Tag> decodeTags(String doc) {
        return decodeCollection(doc, Tag.class, StateKeys.TAGS);
    }

    public Map<String, Page> decodePages(String doc) {
        return decodeCollection(doc, Page.class, StateKeys.PAGES);
    }

    public List<TombstoneKey> decodeTombstones(String doc) {
        if (doc == null || doc.isBlank()) return List.of();
        List<String> raw;
        try {
            raw = json.readValue(doc, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("stored " + StateKeys.PENDING_DELETES + " is not valid JSON", e);
        }
        List<TombstoneKey> out = new ArrayList<>(raw.size());
        for (String s : raw) {
            try {
                out.add(TombstoneKey.parse(s));
            } catch (IllegalArgumentException | NullPointerException e) {
                log.warning("dropping malformed pending delete: " + s);
            }
        }
        return out;
    }

    public Map<EntityKind, List<String>> decodeChanges(String doc) {
        Map<EntityKind, List<String>> out = new EnumMap<>(EntityKind.class);
        if (doc == null || doc.isBlank()) return out;
        Map<String, List<String>> raw;
        try {
            raw = json.readValue(doc, IDS_BY_KIND);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("stored " + StateKeys.PENDING_CHANGES + " is not valid JSON", e);
        }
        if (raw == null) return out;
        for (Map.Entry<String, List<String>> e : raw.entrySet()) {
            try {
                EntityKind kind = EntityKind.fromWireName(e.getKey());
                List<String> ids = e.getValue() == null ? List.of() : e.getValue();
                out.put(kind, ids.stream().filter(id -> id != null && !id.isBlank()).toList());
            } catch (IllegalArgumentException ex) {
                log.warning("dropping pending changes of unknown kind: " + e.getKey());
            }
        }
        return out;
    }

    // ---------- helpers ----------

    private <T extends SyncEntity> Map<String, T> decodeCollection(String doc, Class<T> type, String key) {
        Map<String, T> out = new HashMap<>();
        if (doc == null || doc.isBlank()) return out;

        JsonNode root;
        try {
            root = json.readTree(doc);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("stored " + key + " is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new PersistenceException("stored " + key + " is not a JSON object", null);
        }

        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            try {
                T entity = json.treeToValue(e.getValue(), type);
                if (!e.getKey().equals(entity.id())) {
                    log.warning(() -> "dropping " + key + " entry with mismatched id: " + e.getKey());
                    continue;
                }
                out.put(e.getKey(), entity);
            } catch (JsonProcessingException | IllegalArgumentException | NullPointerException ex) {
                log.warning(() -> "dropping unreadable " + key + " entry " + e.getKey() + ": " + ex.getMessage());
            }
        }
        return out;
    }

    private String write(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode state", e);
        }
    }
}
