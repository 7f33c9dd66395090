// file: server/src/main/java/io/tagvault/server/command/CommandResponse.java
package io.tagvault.server.command;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.tagvault.server.error.ErrorCode;
import io.tagvault.server.pipeline.CommandResult;

/**
 * Caller response: {success, data?, error?, code?}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResponse(boolean success, Object data, String error, ErrorCode code) {

    public static CommandResponse from(CommandResult<?> r) {
        return new CommandResponse(r.success(), r.data(), r.error(), r.code());
    }

    public static CommandResponse failure(ErrorCode code, String error) {
        return new CommandResponse(false, null, error, code);
    }
}
