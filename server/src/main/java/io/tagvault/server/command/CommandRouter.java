// file: server/src/main/java/io/tagvault/server/command/CommandRouter.java
package io.tagvault.server.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.tagvault.server.error.ErrorCode;
import io.tagvault.server.error.ValidationException;
import io.tagvault.server.pipeline.CommandPipeline;
import io.tagvault.server.pipeline.CommandResult;
import io.tagvault.server.store.EntityStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Maps operation names to pipeline commands.
 * <p>
 * Payload fields are extracted and type-checked here, before the pipeline
 * runs, so a malformed request never reaches the store.
 */
public final class CommandRouter {
    private static final Logger log = Logger.getLogger(CommandRouter.class.getName());

    @FunctionalInterface
    private interface Handler {
        CommandResult<?> handle(JsonNode payload);
    }

    private final CommandPipeline pipeline;
    private final Map<String, Handler> handlers = new LinkedHashMap<>();

    public CommandRouter(CommandPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        registerQueries();
        registerTagCommands();
        registerPageCommands();
    }

    public CommandResponse dispatch(CommandRequest request) {
        if (request == null || request.operation() == null || request.operation().isBlank()) {
            return CommandResponse.failure(ErrorCode.VALIDATION_ERROR, "operation is required");
        }
        Handler handler = handlers.get(request.operation());
        if (handler == null) {
            log.fine(() -> "unknown operation: " + request.operation());
            return CommandResponse.failure(ErrorCode.UNKNOWN_OPERATION, "unknown operation: " + request.operation());
        }
        JsonNode payload = request.payload();
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            return CommandResponse.failure(ErrorCode.VALIDATION_ERROR, "payload must be a JSON object");
        }
        try {
            return CommandResponse.from(handler.handle(payload));
        } catch (ValidationException e) {
            return CommandResponse.failure(e.code(), e.getMessage());
        }
    }

    public Set<String> operations() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    // ---------- registrations ----------

    private void registerQueries() {
        handlers.put("getAllTags", p -> pipeline.execute("getAllTags", EntityStore::allTags));
        handlers.put("getAllPages", p -> pipeline.execute("getAllPages", EntityStore::allPages));
        handlers.put("getTaggedPages", p -> {
            String tagId = Payloads.optional(p, "tagId");
            return pipeline.execute("getTaggedPages", s -> s.pagesForTag(tagId));
        });
        handlers.put("getPage", p -> {
            String pageId = Payloads.required(p, "pageId");
            return pipeline.execute("getPage", s -> s.getPage(pageId));
        });
        handlers.put("getTagUsageCounts", p -> pipeline.execute("getTagUsageCounts", EntityStore::tagUsageCounts));
        handlers.put("getDataStats", p -> pipeline.execute("getDataStats", EntityStore::stats));
    }

    private void registerTagCommands() {
        handlers.put("createTag", p -> {
            String name = Payloads.required(p, "name");
            String description = Payloads.optional(p, "description");
            String color = Payloads.optional(p, "color");
            return pipeline.execute("createTag", s -> s.createTag(name, description, color));
        });
        handlers.put("updateTag", p -> {
            String tagId = Payloads.required(p, "tagId");
            String name = Payloads.optional(p, "name");
            String description = Payloads.optional(p, "description");
            String color = Payloads.optional(p, "color");
            return pipeline.execute("updateTag", s -> s.updateTag(tagId, name, description, color));
        });
        handlers.put("deleteTag", p -> {
            String tagId = Payloads.required(p, "tagId");
            return pipeline.execute("deleteTag", s -> {
                s.deleteTag(tagId);
                return Map.of("deleted", tagId);
            });
        });
        handlers.put("createTagAndAddToPage", p -> {
            String tagName = Payloads.required(p, "tagName");
            String pageId = Payloads.required(p, "pageId");
            return pipeline.execute("createTagAndAddToPage", s -> s.createTagAndAddToPage(tagName, pageId));
        });
    }

    private void registerPageCommands() {
        handlers.put("registerPage", p -> {
            String url = Payloads.required(p, "url");
            String title = Payloads.optional(p, "title");
            String favicon = Payloads.optional(p, "favicon");
            String description = Payloads.optional(p, "description");
            return pipeline.execute("registerPage", s -> s.registerPage(url, title, favicon, description));
        });
        handlers.put("updatePageTitle", p -> {
            String pageId = Payloads.required(p, "pageId");
            String title = Payloads.required(p, "title");
            return pipeline.execute("updatePageTitle", s -> s.updatePageTitle(pageId, title));
        });
        handlers.put("addTagToPage", p -> {
            String pageId = Payloads.required(p, "pageId");
            String tagId = Payloads.required(p, "tagId");
            return pipeline.execute("addTagToPage", s -> Map.of("changed", s.addTagToPage(pageId, tagId)));
        });
        handlers.put("removeTagFromPage", p -> {
            String pageId = Payloads.required(p, "pageId");
            String tagId = Payloads.required(p, "tagId");
            return pipeline.execute("removeTagFromPage", s -> Map.of("changed", s.removeTagFromPage(pageId, tagId)));
        });
        handlers.put("deletePage", p -> {
            String pageId = Payloads.required(p, "pageId");
            return pipeline.execute("deletePage", s -> {
                s.deletePage(pageId);
                return Map.of("deleted", pageId);
            });
        });
    }
}
