// file: server/src/main/java/io/tagvault/server/sync/SyncOutcome.java
package io.tagvault.server.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one sync cycle.
 *
 * @param status            overall result
 * @param tagsPushed        tags upserted to the remote replica
 * @param pagesPushed       pages upserted to the remote replica
 * @param deletesPushed     deletions sent to the remote replica
 * @param tombstonesCleared pending deletes the remote confirmed this cycle
 * @param retryable         for FAILED: whether trying again can help
 * @param error             failure description, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncOutcome(
        Status status,
        int tagsPushed,
        int pagesPushed,
        int deletesPushed,
        int tombstonesCleared,
        boolean retryable,
        String error
) {
    public enum Status { SUCCESS, PARTIAL, FAILED, SKIPPED }

    public static SyncOutcome skipped(String reason) {
        return new SyncOutcome(Status.SKIPPED, 0, 0, 0, 0, false, reason);
    }

    public static SyncOutcome failed(String error, boolean retryable) {
        return new SyncOutcome(Status.FAILED, 0, 0, 0, 0, retryable, error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
