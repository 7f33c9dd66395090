// file: server/src/main/java/io/tagvault/server/error/ErrorCode.java
package io.tagvault.server.error;

/**
 * Machine-readable failure category returned to callers.
 */
public enum ErrorCode {
    VALIDATION_ERROR,
    BUSINESS_RULE_VIOLATION,
    PERSISTENCE_ERROR,
    SYNC_ERROR,
    UNKNOWN_OPERATION,
    INTERNAL_ERROR
}
