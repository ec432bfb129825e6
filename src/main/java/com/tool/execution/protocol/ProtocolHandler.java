package com.tool.execution.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tool.execution.core.error.ErrorCode;
import com.tool.execution.core.model.InvocationRequest;
import com.tool.execution.core.model.InvocationResult;
import com.tool.execution.core.model.ToolArguments;
import com.tool.execution.core.model.ToolDescriptor;
import com.tool.execution.engine.ToolEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Dispatches protocol envelopes to the engine.
 *
 * <p>Supported methods:</p>
 * <ul>
 *   <li>{@code tools/list}: {@code {"tools": [{name, description, version, tags, inputSchema, outputSchema}]}}</li>
 *   <li>{@code tools/call}: params {@code {"name": ..., "arguments": {...}}}, result
 *       {@code {"content": ..., "fromCache": ..., "durationMs": ..., "attempts": ...}}</li>
 * </ul>
 *
 * <p>Malformed envelopes yield {@code INVALID_REQUEST}, unknown methods {@code METHOD_NOT_FOUND}.
 * Returned futures complete normally; cancelling one cancels the underlying invocation.</p>
 */
public class ProtocolHandler {
    private static final Logger log = LoggerFactory.getLogger(ProtocolHandler.class);

    public static final String METHOD_LIST = "tools/list";
    public static final String METHOD_CALL = "tools/call";

    private final ToolEngine engine;
    private final ObjectMapper mapper;

    public ProtocolHandler(ToolEngine engine) {
        this(engine, new ObjectMapper());
    }

    public ProtocolHandler(ToolEngine engine, ObjectMapper mapper) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
    }

    /**
     * Parses a raw message, dispatches it and serializes the response.
     */
    public CompletableFuture<String> handle(String message) {
        ProtocolRequest request;
        try {
            request = mapper.readValue(message, ProtocolRequest.class);
        } catch (JsonProcessingException e) {
            log.debug("protocol.request.malformed error={}", e.getOriginalMessage());
            return CompletableFuture.completedFuture(
                    toJson(ProtocolResponse.failure(null, ErrorCode.INVALID_REQUEST, "Malformed request: invalid JSON")));
        }
        CompletableFuture<ProtocolResponse> response = handle(request);
        CompletableFuture<String> serialized = response.thenApply(this::toJson);
        propagateCancel(serialized, response);
        return serialized;
    }

    public CompletableFuture<ProtocolResponse> handle(ProtocolRequest request) {
        if (request == null || request.method() == null || request.method().isBlank()) {
            String id = request != null ? request.id() : null;
            return CompletableFuture.completedFuture(
                    ProtocolResponse.failure(id, ErrorCode.INVALID_REQUEST, "Missing method"));
        }
        return switch (request.method()) {
            case METHOD_LIST -> CompletableFuture.completedFuture(listTools(request));
            case METHOD_CALL -> callTool(request);
            default -> CompletableFuture.completedFuture(ProtocolResponse.failure(request.id(),
                    ErrorCode.METHOD_NOT_FOUND, "Unknown method: " + request.method()));
        };
    }

    public String toJson(ProtocolResponse response) {
        try {
            return mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("protocol.response.serialization_failed id={}", response.id(), e);
            try {
                return mapper.writeValueAsString(ProtocolResponse.failure(response.id(),
                        ErrorCode.INTERNAL_ERROR, "Failed to serialize response"));
            } catch (JsonProcessingException nested) {
                throw new IllegalStateException("Cannot serialize error response", nested);
            }
        }
    }

    private ProtocolResponse listTools(ProtocolRequest request) {
        ObjectNode result = mapper.createObjectNode();
        ArrayNode tools = result.putArray("tools");
        for (ToolDescriptor descriptor : engine.listTools()) {
            tools.add(describe(descriptor));
        }
        return ProtocolResponse.success(request.id(), result);
    }

    /**
     * Wire form of a descriptor, as listed by {@code tools/list}.
     */
    public ObjectNode describe(ToolDescriptor descriptor) {
        ObjectNode tool = mapper.createObjectNode();
        tool.put("name", descriptor.getName());
        tool.put("description", descriptor.getDescription());
        tool.put("version", descriptor.getVersion());
        ArrayNode tags = tool.putArray("tags");
        descriptor.getTags().forEach(tags::add);
        tool.set("inputSchema", descriptor.getInputSchema());
        tool.set("outputSchema", descriptor.getOutputSchema());
        return tool;
    }

    private CompletableFuture<ProtocolResponse> callTool(ProtocolRequest request) {
        JsonNode params = request.params();
        if (params == null || !params.isObject()) {
            return invalid(request, "Missing parameters");
        }
        JsonNode name = params.get("name");
        if (name == null || !name.isTextual() || name.textValue().isBlank()) {
            return invalid(request, "Missing tool name");
        }
        JsonNode arguments = params.get("arguments");
        if (arguments != null && !arguments.isNull() && !arguments.isObject()) {
            return invalid(request, "Arguments must be a JSON object");
        }

        InvocationRequest invocation = new InvocationRequest(
                name.textValue(), ToolArguments.from(arguments), request.id());
        CompletableFuture<InvocationResult> pending = engine.invokeAsync(invocation);
        CompletableFuture<ProtocolResponse> response = pending.thenApply(result -> toResponse(request.id(), result));
        propagateCancel(response, pending);
        return response;
    }

    private ProtocolResponse toResponse(String id, InvocationResult result) {
        if (!result.isSuccess()) {
            return ProtocolResponse.failure(id, result.error());
        }
        ObjectNode content = mapper.createObjectNode();
        content.set("content", result.value());
        content.put("fromCache", result.fromCache());
        content.put("durationMs", result.duration().toMillis());
        content.put("attempts", result.attempts());
        return ProtocolResponse.success(id, content);
    }

    private CompletableFuture<ProtocolResponse> invalid(ProtocolRequest request, String message) {
        return CompletableFuture.completedFuture(
                ProtocolResponse.failure(request.id(), ErrorCode.INVALID_REQUEST, message));
    }

    private static void propagateCancel(CompletableFuture<?> downstream, CompletableFuture<?> upstream) {
        downstream.whenComplete((value, error) -> {
            if (downstream.isCancelled()) {
                upstream.cancel(true);
            }
        });
    }
}
