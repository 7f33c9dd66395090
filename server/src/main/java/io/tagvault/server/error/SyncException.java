// file: server/src/main/java/io/tagvault/server/error/SyncException.java
package io.tagvault.server.error;

/**
 * Failure of the remote exchange. Never reaches an interactive caller.
 */
public class SyncException extends TagVaultException {
    private final boolean retryable;

    public SyncException(String message, boolean retryable, Throwable cause) {
        super(ErrorCode.SYNC_ERROR, message, cause);
        this.retryable = retryable;
    }

    public SyncException(String message, boolean retryable) {
        this(message, retryable, null);
    }

    public boolean retryable() {
        return retryable;
    }
}
