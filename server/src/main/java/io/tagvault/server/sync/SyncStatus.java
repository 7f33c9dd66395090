// file: server/src/main/java/io/tagvault/server/sync/SyncStatus.java
package io.tagvault.server.sync;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Point-in-time view of the sync coordinator, served by the admin endpoint.
 *
 * @param lastSuccessAt  epoch millis of the last SUCCESS cycle, null if none yet
 * @param pendingChanges local creates and edits the remote has not accepted yet
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncStatus(
        boolean inFlight,
        long cyclesRun,
        SyncOutcome lastOutcome,
        Long lastSuccessAt,
        String lastError,
        int pendingDeletions,
        int pendingChanges
) {}
