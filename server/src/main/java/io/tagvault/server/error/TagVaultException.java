// file: server/src/main/java/io/tagvault/server/error/TagVaultException.java
package io.tagvault.server.error;

import java.util.Objects;

/**
 * Base of all expected failures on the command and sync paths.
 * Carries an {@link ErrorCode} so the outer layers can map it without
 * inspecting the concrete type.
 */
public class TagVaultException extends RuntimeException {
    private final ErrorCode code;

    public TagVaultException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public TagVaultException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() {
        return code;
    }
}
