// file: storage/src/main/java/io/tagvault/storage/StorageException.java
package io.tagvault.storage;

/**
 * Unchecked failure of the durable storage layer (I/O, corrupt snapshot).
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
