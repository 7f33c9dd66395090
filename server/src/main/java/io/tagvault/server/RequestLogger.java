// file: server/src/main/java/io/tagvault/server/RequestLogger.java
package io.tagvault.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-request logging hook.
 *
 * Responsibilities:
 *  - Central place to log method/path/operation/status and latency.
 *  - 5xx responses are logged at WARNING, with the cause when known.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param operation   RPC operation name, or null for non-RPC paths
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param error       optional exception, null if none
     */
    public static void logRequest(
            String method,
            String path,
            String operation,
            int status,
            long totalMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s%s -> %d (total=%dms)",
                method,
                path,
                operation != null ? " [" + operation + "]" : "",
                status,
                totalMillis
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
