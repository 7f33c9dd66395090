// file: server/src/main/java/io/tagvault/server/error/ValidationException.java
package io.tagvault.server.error;

/**
 * Bad input. Raised before any state is touched.
 */
public class ValidationException extends TagVaultException {
    private final String field;

    public ValidationException(String field, String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = field;
    }

    /** Offending payload field, or null if not field-specific. */
    public String field() {
        return field;
    }
}
