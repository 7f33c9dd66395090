// file: server/src/main/java/io/tagvault/server/pipeline/CommandPipeline.java
package io.tagvault.server.pipeline;

import io.tagvault.server.error.ErrorCode;
import io.tagvault.server.error.TagVaultException;
import io.tagvault.server.store.EntityStore;
import io.tagvault.server.sync.SyncTrigger;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs every operation as rehydrate -> execute -> commit -> respond -> request sync.
 * <p>
 * Semantics:
 *  - One fair lock covers rehydrate, execute and commit, so two operations
 *    (or an operation and the local phase of a sync cycle) never interleave.
 *  - The caller is told "success" only after the commit returned.
 *  - A failing handler or commit discards uncommitted in-memory changes by
 *    invalidating the store; the next operation rehydrates the persisted view.
 *  - Operations that changed nothing do not touch the backing store.
 *  - The sync request happens after the lock is released and only when
 *    something was written. Its failures are logged, never returned.
 */
public final class CommandPipeline {
    private static final Logger log = Logger.getLogger(CommandPipeline.class.getName());

    static final long SLOW_OPERATION_MILLIS = 200;

    private final EntityStore store;
    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile SyncTrigger syncTrigger = SyncTrigger.NOOP;

    public CommandPipeline(EntityStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public CommandPipeline(EntityStore store, SyncTrigger syncTrigger) {
        this(store);
        attachSyncTrigger(syncTrigger);
    }

    /** The sync worker is built after the pipeline (it needs it), so it is attached late. */
    public void attachSyncTrigger(SyncTrigger trigger) {
        this.syncTrigger = Objects.requireNonNull(trigger, "trigger");
    }

    /**
     * Execute a caller-facing operation. Never throws for expected failures;
     * they come back as a failed {@link CommandResult}.
     */
    public <T> CommandResult<T> execute(String operation, Command<T> command) {
        long start = System.nanoTime();
        Committed<T> done = null;
        CommandResult<T> result;
        try {
            done = runLocked(command);
            result = CommandResult.ok(done.value());
        } catch (TagVaultException e) {
            Level level = e.code() == ErrorCode.PERSISTENCE_ERROR ? Level.WARNING : Level.FINE;
            log.log(level, "operation " + operation + " failed: " + e.getMessage(), e);
            result = CommandResult.failure(e.code(), e.getMessage());
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "operation " + operation + " failed unexpectedly", e);
            result = CommandResult.failure(ErrorCode.INTERNAL_ERROR, "internal error: " + e.getMessage());
        } finally {
            long tookMs = (System.nanoTime() - start) / 1_000_000L;
            if (tookMs > SLOW_OPERATION_MILLIS) {
                log.warning(String.format("slow operation %s took %dms", operation, tookMs));
            }
        }

        if (done != null && done.wrote()) {
            requestSync(operation);
        }
        return result;
    }

    /**
     * Rehydrate, execute and commit under the pipeline lock, without
     * requesting a sync. Failures propagate to the caller.
     */
    public <T> T transact(String operation, Command<T> command) {
        Objects.requireNonNull(operation, "operation");
        return runLocked(command).value();
    }

    // ---------- internals ----------

    private record Committed<T>(T value, boolean wrote) {}

    private <T> Committed<T> runLocked(Command<T> command) {
        Objects.requireNonNull(command, "command");
        lock.lock();
        try {
            store.ensureLoaded();
            try {
                T value = command.execute(store);
                boolean wrote = store.commit();
                return new Committed<>(value, wrote);
            } catch (RuntimeException e) {
                if (store.isDirty()) {
                    store.invalidate();
                }
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private void requestSync(String operation) {
        try {
            syncTrigger.requestSync(operation).whenComplete((outcome, err) -> {
                if (err != null) {
                    log.log(Level.WARNING, "background sync after " + operation + " failed", err);
                }
            });
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "could not request sync after " + operation, e);
        }
    }
}
