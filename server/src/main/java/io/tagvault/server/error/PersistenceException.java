// file: server/src/main/java/io/tagvault/server/error/PersistenceException.java
package io.tagvault.server.error;

/**
 * The commit write (or the rehydration read) against the backing store failed.
 * The operation must be treated as not applied.
 */
public class PersistenceException extends TagVaultException {
    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, cause);
    }
}
