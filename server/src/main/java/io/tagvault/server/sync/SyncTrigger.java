// file: server/src/main/java/io/tagvault/server/sync/SyncTrigger.java
package io.tagvault.server.sync;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for asking for a sync cycle without waiting for it.
 * The returned future completes with the outcome of the cycle that
 * served the request.
 */
@FunctionalInterface
public interface SyncTrigger {

    SyncTrigger NOOP = reason -> CompletableFuture.completedFuture(SyncOutcome.skipped("sync disabled"));

    CompletableFuture<SyncOutcome> requestSync(String reason);
}
