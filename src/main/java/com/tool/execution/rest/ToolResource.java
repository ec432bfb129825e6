package com.tool.execution.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.tool.execution.core.model.ToolDescriptor;
import com.tool.execution.engine.ToolEngine;
import com.tool.execution.health.HealthCheckRegistry;
import com.tool.execution.health.HealthStatus;
import com.tool.execution.protocol.ProtocolHandler;
import com.tool.execution.protocol.ProtocolRequest;
import com.tool.execution.protocol.SessionRegistry;
import com.tool.execution.rest.dto.ErrorResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * HTTP surface of the tool server.
 *
 * <ul>
 *   <li>{@code GET /}: server name, version and status</li>
 *   <li>{@code GET /health}: aggregate health, open connections and registered tools</li>
 *   <li>{@code GET /tools}: registered tool descriptors</li>
 *   <li>{@code POST /execute}: a {@code tools/call} envelope, answered with a protocol response</li>
 * </ul>
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Tools", description = "Discover and execute tools")
public class ToolResource {
    private static final Logger log = LoggerFactory.getLogger(ToolResource.class);

    static final String SERVER_NAME = "Tool Execution Server";
    static final String SERVER_VERSION = "1.0.0";

    private final ToolEngine engine;
    private final ProtocolHandler protocolHandler;
    private final SessionRegistry sessionRegistry;
    private final HealthCheckRegistry healthCheckRegistry;

    @Inject
    public ToolResource(ToolEngine engine, ProtocolHandler protocolHandler,
                        SessionRegistry sessionRegistry, HealthCheckRegistry healthCheckRegistry) {
        this.engine = engine;
        this.protocolHandler = protocolHandler;
        this.sessionRegistry = sessionRegistry;
        this.healthCheckRegistry = healthCheckRegistry;
    }

    @GET
    @Operation(summary = "Server information")
    @APIResponse(responseCode = "200", description = "Server name, version and status")
    public Response root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", SERVER_NAME);
        body.put("version", SERVER_VERSION);
        body.put("status", engine.isClosed() ? "stopped" : "running");
        return Response.ok(body).build();
    }

    @GET
    @Path("/health")
    @Operation(summary = "Aggregate health",
            description = "Runs every registered health check. Returns 503 when any check is DOWN.")
    @APIResponse(responseCode = "200", description = "Server is UP or DEGRADED")
    @APIResponse(responseCode = "503", description = "At least one check is DOWN")
    public Response health() {
        HealthStatus status = healthCheckRegistry.checkAll();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.status().name());
        body.put("message", status.message());
        body.put("timestamp", Instant.now().toString());
        body.put("activeConnections", sessionRegistry.activeCount());
        body.put("registeredTools", engine.getRegistry().size());
        body.put("checks", status.details());
        Response.Status httpStatus = status.isDown() ? Response.Status.SERVICE_UNAVAILABLE : Response.Status.OK;
        return Response.status(httpStatus).entity(body).build();
    }

    @GET
    @Path("/tools")
    @Operation(summary = "List registered tools")
    @APIResponse(responseCode = "200", description = "Descriptors in registration order")
    public Response listTools() {
        List<JsonNode> tools = new ArrayList<>();
        for (ToolDescriptor descriptor : engine.listTools()) {
            tools.add(protocolHandler.describe(descriptor));
        }
        return Response.ok(Map.of("tools", tools)).build();
    }

    @POST
    @Path("/execute")
    @Operation(summary = "Execute a tool",
            description = "Accepts a tools/call envelope. Tool failures are reported in the response's error field.")
    @APIResponse(responseCode = "200", description = "Protocol response with result or error")
    @APIResponse(responseCode = "400", description = "Wrong method, missing parameters or missing tool name")
    public CompletionStage<Response> execute(ProtocolRequest request) {
        String rejection = checkCallEnvelope(request);
        if (rejection != null) {
            return CompletableFuture.completedFuture(Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(
                            request == null || ProtocolHandler.METHOD_CALL.equals(request.method())
                                    ? "INVALID_REQUEST" : "METHOD_NOT_FOUND",
                            rejection, "/execute"))
                    .build());
        }
        return protocolHandler.handle(request)
                .thenApply(response -> Response.ok(response).build())
                .exceptionally(error -> {
                    log.error("execute.failed id={} error={}", request.id(), error.getMessage(), error);
                    return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                            .entity(ErrorResponse.internalError(
                                    "An internal error occurred. Check server logs for details.", "/execute"))
                            .build();
                });
    }

    private static String checkCallEnvelope(ProtocolRequest request) {
        if (request == null) {
            return "Missing request body";
        }
        if (!ProtocolHandler.METHOD_CALL.equals(request.method())) {
            return "Invalid method";
        }
        JsonNode params = request.params();
        if (params == null || !params.isObject() || params.isEmpty()) {
            return "Missing parameters";
        }
        JsonNode name = params.get("name");
        if (name == null || !name.isTextual() || name.textValue().isBlank()) {
            return "Missing tool name";
        }
        return null;
    }
}
