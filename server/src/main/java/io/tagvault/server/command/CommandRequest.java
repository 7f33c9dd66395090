// file: server/src/main/java/io/tagvault/server/command/CommandRequest.java
package io.tagvault.server.command;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Caller request: an operation name and a JSON object payload (may be null).
 */
public record CommandRequest(String operation, JsonNode payload) {}
