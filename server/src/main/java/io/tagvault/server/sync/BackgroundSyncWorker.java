// file: server/src/main/java/io/tagvault/server/sync/BackgroundSyncWorker.java
package io.tagvault.server.sync;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background queue that runs sync cycles off the request path.
 * <p>
 * Behavior:
 *  - A single daemon thread runs cycles, so at most one runs at a time.
 *  - Requests that arrive while a cycle is queued but not started share
 *    that cycle and its future.
 *  - A FAILED, retryable cycle is retried with the {@link RetryPolicy}
 *    backoff; the request's future completes with the final outcome.
 *  - Optionally runs a cycle at a fixed interval.
 */
public final class BackgroundSyncWorker implements SyncTrigger, AutoCloseable {
    private static final Logger log = Logger.getLogger(BackgroundSyncWorker.class.getName());

    private final SyncCoordinator coordinator;
    private final RetryPolicy retryPolicy;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    private CompletableFuture<SyncOutcome> queued; // guarded by this

    /**
     * @param interval period of background cycles; null or zero disables them
     */
    public BackgroundSyncWorker(SyncCoordinator coordinator, RetryPolicy retryPolicy, Duration interval) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sync-worker");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (interval == null || interval.isZero() || interval.isNegative()) return;
        scheduler.scheduleWithFixedDelay(
                () -> requestSync("periodic"),
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
    }

    @Override
    public synchronized CompletableFuture<SyncOutcome> requestSync(String reason) {
        if (queued != null) {
            return queued;
        }
        CompletableFuture<SyncOutcome> request = new CompletableFuture<>();
        try {
            scheduler.execute(() -> attempt(request, reason, 0));
        } catch (RejectedExecutionException e) {
            request.complete(SyncOutcome.skipped("sync worker stopped"));
            return request;
        }
        queued = request;
        return request;
    }

    public void stop() {
        scheduler.shutdownNow();
        CompletableFuture<SyncOutcome> pending;
        synchronized (this) {
            pending = queued;
            queued = null;
        }
        if (pending != null) {
            pending.complete(SyncOutcome.skipped("sync worker stopped"));
        }
    }

    @Override
    public void close() {
        stop();
    }

    // ---------- internals ----------

    private void attempt(CompletableFuture<SyncOutcome> request, String reason, int retry) {
        if (retry == 0) {
            // From here on, new requests need a fresh cycle to see later writes.
            synchronized (this) {
                if (queued == request) queued = null;
            }
        }

        SyncOutcome outcome;
        try {
            outcome = coordinator.runCycle();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "sync cycle threw", e);
            outcome = SyncOutcome.failed(e.getMessage(), true);
        }

        if (outcome.isFailed() && outcome.retryable() && retryPolicy.allowsRetry(retry)) {
            long delay = retryPolicy.delayMillis(retry);
            log.info(() -> String.format("sync (%s) failed, retry %d/%d in %dms",
                    reason, retry + 1, retryPolicy.maxRetries(), delay));
            try {
                scheduler.schedule(() -> attempt(request, reason, retry + 1), delay, TimeUnit.MILLISECONDS);
                return;
            } catch (RejectedExecutionException e) {
                // shutting down: report the last outcome
            }
        }
        request.complete(outcome);
    }
}
