// file: server/src/test/java/io/tagvault/server/sync/HttpRemoteReplicaTest.java
package io.tagvault.server.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tagvault.core.DataSnapshot;
import io.tagvault.core.Page;
import io.tagvault.core.Tag;
import io.tagvault.core.TombstoneKey;
import io.tagvault.server.error.SyncException;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wire behavior of the HTTP replica client against a stub Undertow server.
 */
class HttpRemoteReplicaTest {

    private static final int PORT = 18091; // test-only port
    private final ObjectMapper json = new ObjectMapper();

    private Undertow stub;
    private volatile int statusToReturn = 200;
    private volatile String bodyToReturn = "{}";
    private volatile String lastMethod;
    private volatile String lastUri;
    private volatile String lastBody;

    private HttpRemoteReplica replica;

    @BeforeEach
    void startStub() {
        stub = Undertow.builder()
                .addHttpListener(PORT, "localhost")
                .setHandler(new BlockingHandler(this::handle))
                .build();
        stub.start();
        replica = new HttpRemoteReplica(URI.create("http://localhost:" + PORT), Duration.ofSeconds(2));
    }

    @AfterEach
    void stopStub() {
        if (stub != null) stub.stop();
    }

    private void handle(HttpServerExchange ex) throws Exception {
        lastMethod = ex.getRequestMethod().toString();
        lastUri = ex.getRequestURI();
        lastBody = new String(ex.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        ex.setStatusCode(statusToReturn);
        ex.getResponseSender().send(bodyToReturn);
    }

    @Test
    void fetch_snapshot_decodes_both_collections() {
        bodyToReturn = """
                {"tags": {"t1": {"id": "t1", "name": "Work", "createdAt": 1, "updatedAt": 2, "deleted": false}},
                 "pages": {"p1": {"id": "p1", "url": "https://example.com", "title": "Ex", "domain": "example.com",
                                  "tags": ["t1"], "createdAt": 1, "updatedAt": 3, "deleted": true,
                                  "someFutureField": 7}}}
                """;

        DataSnapshot snap = replica.fetchSnapshot();

        assertEquals("GET", lastMethod);
        assertEquals("/replica/snapshot", lastUri);
        assertEquals("Work", snap.tags().get("t1").name());
        Page p = snap.pages().get("p1");
        assertTrue(p.deleted());
        assertEquals(Set.of("t1"), p.tags());
    }

    @Test
    void upsert_tags_puts_json_array() throws Exception {
        Tag t = new Tag("t1", "Work", null, "#112233", 1, 2, false);

        replica.upsertTags(List.of(t));

        assertEquals("PUT", lastMethod);
        assertEquals("/replica/tags", lastUri);
        JsonNode body = json.readTree(lastBody);
        assertTrue(body.isArray());
        assertEquals("Work", body.get(0).get("name").asText());
        assertFalse(body.get(0).has("description"), "null fields are omitted");
    }

    @Test
    void upsert_pages_puts_json_array() throws Exception {
        Page p = new Page("p1", "https://example.com", "Ex", "example.com", Set.of("b", "a"), 1, 2, false, null, null);

        replica.upsertPages(List.of(p));

        assertEquals("/replica/pages", lastUri);
        assertEquals("[\"a\",\"b\"]", json.readTree(lastBody).get(0).get("tags").toString());
    }

    @Test
    void mark_deleted_uses_kind_and_id_in_path() {
        replica.markDeleted(TombstoneKey.page("aHR0cHM6Ly9leGFtcGxlLmNvbQ"));

        assertEquals("DELETE", lastMethod);
        assertEquals("/replica/page/aHR0cHM6Ly9leGFtcGxlLmNvbQ", lastUri);
    }

    @Test
    void base_url_path_prefix_is_kept() {
        var prefixed = new HttpRemoteReplica(URI.create("http://localhost:" + PORT + "/api/"), Duration.ofSeconds(2));

        prefixed.fetchSnapshot();
        assertEquals("/api/replica/snapshot", lastUri);

        prefixed.markDeleted(TombstoneKey.tag("t1"));
        assertEquals("/api/replica/tag/t1", lastUri);

        new HttpRemoteReplica(URI.create("http://localhost:" + PORT + "/api"), Duration.ofSeconds(2)).fetchSnapshot();
        assertEquals("/api/replica/snapshot", lastUri);
    }

    @Test
    void delete_of_unknown_id_counts_as_done() {
        statusToReturn = 404;
        assertDoesNotThrow(() -> replica.markDeleted(TombstoneKey.tag("gone")));
    }

    @Test
    void server_errors_are_retryable() {
        statusToReturn = 503;
        SyncException e = assertThrows(SyncException.class, replica::fetchSnapshot);
        assertTrue(e.retryable());
    }

    @Test
    void client_errors_are_not_retryable() {
        statusToReturn = 400;
        SyncException e = assertThrows(SyncException.class, () -> replica.upsertTags(List.of()));
        assertFalse(e.retryable());
    }

    @Test
    void garbage_snapshot_is_not_retryable() {
        bodyToReturn = "<html>oops</html>";
        SyncException e = assertThrows(SyncException.class, replica::fetchSnapshot);
        assertFalse(e.retryable());
    }

    @Test
    void unreachable_remote_is_retryable() {
        stub.stop();
        stub = null;

        SyncException e = assertThrows(SyncException.class, replica::fetchSnapshot);
        assertTrue(e.retryable());
    }

    @Test
    void snapshot_round_trips_through_the_stub() throws Exception {
        DataSnapshot snap = new DataSnapshot(
                Map.of("t1", new Tag("t1", "Work", "d", "#000000", 1, 2, false)),
                Map.of());
        bodyToReturn = json.writeValueAsString(snap);

        assertEquals(snap, replica.fetchSnapshot());
    }
}
