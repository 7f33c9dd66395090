// file: server/src/main/java/io/tagvault/server/WebServer.java
package io.tagvault.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tagvault.server.command.CommandRequest;
import io.tagvault.server.command.CommandResponse;
import io.tagvault.server.command.CommandRouter;
import io.tagvault.server.error.ErrorCode;
import io.tagvault.server.sync.SyncCoordinator;
import io.tagvault.server.sync.SyncOutcome;
import io.tagvault.server.sync.SyncTrigger;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Thin HTTP adapter over the command router and the sync coordinator.
 *
 * Responsibilities:
 *  - Decode JSON request bodies.
 *  - Map response error codes to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST /rpc           {"operation": "...", "payload": {...}}
 *   - GET  /admin/health  Basic health check
 *   - GET  /admin/sync    Sync status (404 when sync is disabled)
 *   - POST /admin/sync    Request a sync cycle and wait for its outcome
 *
 * Status mapping for /rpc:
 *   success 200, VALIDATION_ERROR 400, UNKNOWN_OPERATION 404,
 *   BUSINESS_RULE_VIOLATION 409, PERSISTENCE_ERROR 503, anything else 500.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final CommandRouter router;
    private final SyncCoordinator sync;   // null when sync is disabled
    private final SyncTrigger trigger;
    private final Duration syncWait;

    public WebServer(int port, CommandRouter router) {
        this(port, router, null, SyncTrigger.NOOP, Duration.ofSeconds(60));
    }

    public WebServer(int port,
                     CommandRouter router,
                     SyncCoordinator sync,
                     SyncTrigger trigger,
                     Duration syncWait) {
        this.router = Objects.requireNonNull(router, "router");
        this.sync = sync;
        this.trigger = Objects.requireNonNull(trigger, "trigger");
        this.syncWait = Objects.requireNonNull(syncWait, "syncWait");

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(new BlockingHandler(this::route))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange exchange) {
        String path = exchange.getRequestPath();
        String method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if ("/rpc".equals(path)) {
            if ("POST".equals(method)) {
                handleRpc(exchange);
            } else {
                send(exchange, 405, Map.of("error", "method not allowed"));
                RequestLogger.logRequest(method, path, null, 405, 0, null);
            }
        } else if ("/admin/health".equals(path)) {
            send(exchange, 200, Map.of("status", "ok"));
            RequestLogger.logRequest(method, path, null, 200, 0, null);
        } else if ("/admin/sync".equals(path)) {
            switch (method) {
                case "GET" -> handleSyncStatus(exchange);
                case "POST" -> handleSyncNow(exchange);
                default -> {
                    send(exchange, 405, Map.of("error", "method not allowed"));
                    RequestLogger.logRequest(method, path, null, 405, 0, null);
                }
            }
        } else {
            send(exchange, 404, Map.of("error", "not found"));
            RequestLogger.logRequest(method, path, null, 404, 0, null);
        }
    }

    // ---------- handlers ----------

    /** POST /rpc */
    private void handleRpc(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        String operation = null;
        Throwable error = null;
        try {
            byte[] body = ex.getInputStream().readNBytes(MAX_BODY_BYTES + 1);
            if (body.length > MAX_BODY_BYTES) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
                return;
            }
            CommandRequest req = json.readValue(body, CommandRequest.class);
            operation = req == null ? null : req.operation();
            CommandResponse resp = router.dispatch(req);
            status = statusFor(resp);
            send(ex, status, resp);
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, CommandResponse.failure(ErrorCode.VALIDATION_ERROR, "invalid JSON"));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, CommandResponse.failure(ErrorCode.INTERNAL_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("POST", ex.getRequestPath(), operation, status, totalMs, error);
        }
    }

    /** GET /admin/sync */
    private void handleSyncStatus(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            if (sync == null) {
                status = 404;
                send(ex, status, Map.of("error", "sync disabled"));
            } else {
                send(ex, status, sync.status());
            }
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), null, status, totalMs, error);
        }
    }

    /** POST /admin/sync */
    private void handleSyncNow(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            SyncOutcome outcome = trigger.requestSync("admin").get(syncWait.toMillis(), TimeUnit.MILLISECONDS);
            status = outcome.isFailed() ? 502 : 200;
            send(ex, status, outcome);
        } catch (TimeoutException e) {
            status = 504;
            error = e;
            send(ex, status, Map.of("error", "sync still running"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = 503;
            error = e;
            send(ex, status, Map.of("error", "interrupted"));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("POST", ex.getRequestPath(), null, status, totalMs, error);
        }
    }

    // ---------- helpers ----------

    static int statusFor(CommandResponse resp) {
        if (resp.success()) return 200;
        if (resp.code() == null) return 500;
        return switch (resp.code()) {
            case VALIDATION_ERROR -> 400;
            case UNKNOWN_OPERATION -> 404;
            case BUSINESS_RULE_VIOLATION -> 409;
            case PERSISTENCE_ERROR -> 503;
            default -> 500;
        };
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
