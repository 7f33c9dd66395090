// file: server/src/main/java/io/tagvault/server/pipeline/CommandResult.java
package io.tagvault.server.pipeline;

import io.tagvault.server.error.ErrorCode;

/**
 * Outcome of one pipeline execution. On success, {@code data} holds the
 * handler's return value and the mutation (if any) is durable.
 */
public record CommandResult<T>(boolean success, T data, String error, ErrorCode code) {

    public static <T> CommandResult<T> ok(T data) {
        return new CommandResult<>(true, data, null, null);
    }

    public static <T> CommandResult<T> failure(ErrorCode code, String error) {
        return new CommandResult<>(false, null, error, code);
    }
}
