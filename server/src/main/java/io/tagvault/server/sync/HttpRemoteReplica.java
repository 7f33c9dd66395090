// file: server/src/main/java/io/tagvault/server/sync/HttpRemoteReplica.java
package io.tagvault.server.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tagvault.core.DataSnapshot;
import io.tagvault.core.Page;
import io.tagvault.core.Tag;
import io.tagvault.core.TombstoneKey;
import io.tagvault.server.error.SyncException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;

/**
 * {@link RemoteReplica} over HTTP + JSON.
 * <p>
 * Endpoints (relative to the base URI):
 *   GET    /replica/snapshot          -> {"tags": {id: tag}, "pages": {id: page}}
 *   PUT    /replica/tags              body: [tag, ...]
 *   PUT    /replica/pages             body: [page, ...]
 *   DELETE /replica/{tag|page}/{id}   404 counts as already deleted
 * <p>
 * Errors: I/O failures, 5xx and 429 are retryable; other non-2xx are not.
 */
public final class HttpRemoteReplica implements RemoteReplica {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final String base;
    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpRemoteReplica(URI baseUri, Duration requestTimeout) {
        Objects.requireNonNull(baseUri, "baseUri");
        // keep any path prefix ("http://host/api" -> "http://host/api/replica/...")
        String b = baseUri.toString();
        this.base = b.endsWith("/") ? b.substring(0, b.length() - 1) : b;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.client = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public DataSnapshot fetchSnapshot() {
        HttpRequest req = request("/replica/snapshot").GET().build();
        HttpResponse<String> resp = send(req, "fetch snapshot");
        try {
            return MAPPER.readValue(resp.body(), DataSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new SyncException("remote snapshot is not valid JSON", false, e);
        }
    }

    @Override
    public void upsertTags(Collection<Tag> tags) {
        put("/replica/tags", tags, "upsert tags");
    }

    @Override
    public void upsertPages(Collection<Page> pages) {
        put("/replica/pages", pages, "upsert pages");
    }

    @Override
    public void markDeleted(TombstoneKey key) {
        String path = "/replica/" + key.kind().wireName() + "/" + URLEncoder.encode(key.id(), StandardCharsets.UTF_8);
        HttpRequest req = request(path).DELETE().build();
        sendAllowing(req, "delete " + key, 404);
    }

    // ---------- helpers ----------

    private void put(String path, Object body, String what) {
        byte[] json;
        try {
            json = MAPPER.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new SyncException("cannot encode " + what, false, e);
        }
        HttpRequest req = request(path)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofByteArray(json))
                .build();
        send(req, what);
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create(base + path)).timeout(requestTimeout);
    }

    private HttpResponse<String> send(HttpRequest req, String what) {
        return sendAllowing(req, what, -1);
    }

    private HttpResponse<String> sendAllowing(HttpRequest req, String what, int alsoOk) {
        HttpResponse<String> resp;
        try {
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SyncException("remote " + what + " failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException("remote " + what + " interrupted", true, e);
        }
        int code = resp.statusCode();
        if ((code >= 200 && code < 300) || code == alsoOk) {
            return resp;
        }
        boolean retryable = code >= 500 || code == 429;
        throw new SyncException("remote " + what + " returned HTTP " + code, retryable);
    }
}
