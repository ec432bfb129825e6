package com.tool.execution.tools;

import com.tool.execution.core.model.ToolArguments;
import com.tool.execution.core.model.ToolDefinition;
import com.tool.execution.core.model.ToolDescriptor;
import com.tool.execution.registry.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Builds the tool definitions every server registers at startup.
 *
 * <p>Available tools:</p>
 * <ul>
 *   <li>{@code echo}: returns its {@code text} argument unchanged</li>
 *   <li>{@code get_current_time}: ISO-8601 timestamp of the server clock (never cached)</li>
 *   <li>{@code search_web}: placeholder search returning a single synthetic result</li>
 *   <li>{@code file_operations}: read, write or list files below a sandbox root (never cached)</li>
 * </ul>
 */
public final class BuiltinTools {
    private static final Logger log = LoggerFactory.getLogger(BuiltinTools.class);

    private static final int DEFAULT_MAX_RESULTS = 5;

    private final Clock clock;
    private final Path fileRoot;

    /**
     * @param clock    clock read by {@code get_current_time}
     * @param fileRoot directory {@code file_operations} is confined to
     */
    public BuiltinTools(Clock clock, Path fileRoot) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.fileRoot = Objects.requireNonNull(fileRoot, "fileRoot is required").toAbsolutePath().normalize();
    }

    /**
     * Returns all built-in tool definitions.
     */
    public List<ToolDefinition> definitions() {
        return List.of(
                buildEchoTool(),
                buildCurrentTimeTool(),
                buildSearchWebTool(),
                buildFileOperationsTool()
        );
    }

    /**
     * Registers every built-in tool with the registry.
     */
    public void registerAll(ToolRegistry registry) {
        definitions().forEach(registry::register);
        log.info("tools.builtin.registered count={} fileRoot={}", definitions().size(), fileRoot);
    }

    private ToolDefinition buildEchoTool() {
        ToolDescriptor descriptor = ToolDescriptor.builder()
                .name("echo")
                .description("Return the given text unchanged.")
                .tags(List.of("utility"))
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "text", Map.of("type", "string", "description", "Text to echo")
                        ),
                        "required", List.of("text")
                ))
                .outputSchema(Map.of("type", "string"))
                .maxRetries(0)
                .build();
        return new ToolDefinition(descriptor, args -> args.getString("text"));
    }

    private ToolDefinition buildCurrentTimeTool() {
        ToolDescriptor descriptor = ToolDescriptor.builder()
                .name("get_current_time")
                .description("Get the current date and time")
                .tags(List.of("utility", "time"))
                .outputSchema(Map.of("type", "string", "description", "Current timestamp"))
                .cacheable(false)
                .build();
        return new ToolDefinition(descriptor, args -> OffsetDateTime.now(clock).toString());
    }

    private ToolDefinition buildSearchWebTool() {
        ToolDescriptor descriptor = ToolDescriptor.builder()
                .name("search_web")
                .description("Search the web for information")
                .tags(List.of("web", "search"))
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "query", Map.of("type", "string", "description", "Search query"),
                                "max_results", Map.of("type", "integer", "description", "Maximum number of results")
                        ),
                        "required", List.of("query")
                ))
                .outputSchema(Map.of(
                        "type", "array",
                        "items", Map.of("type", "object"),
                        "description", "Search results"
                ))
                .timeout(Duration.ofSeconds(30))
                .build();
        return new ToolDefinition(descriptor, this::searchWeb);
    }

    private ToolDefinition buildFileOperationsTool() {
        ToolDescriptor descriptor = ToolDescriptor.builder()
                .name("file_operations")
                .description("Perform file operations (read, write, list)")
                .tags(List.of("file", "system"))
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "operation", Map.of("type", "string", "enum", List.of("read", "write", "list")),
                                "path", Map.of("type", "string", "description", "File path, relative to the file root"),
                                "content", Map.of("type", "string", "description", "File content (for write operation)")
                        ),
                        "required", List.of("operation", "path")
                ))
                .outputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "success", Map.of("type", "boolean"),
                                "data", Map.of("type", "string"),
                                "error", Map.of("type", "string")
                        )
                ))
                .timeout(Duration.ofSeconds(10))
                .cacheable(false)
                .build();
        return new ToolDefinition(descriptor, this::fileOperation);
    }

    private List<Map<String, Object>> searchWeb(ToolArguments args) {
        String query = args.getString("query");
        int maxResults = args.getInt("max_results", DEFAULT_MAX_RESULTS);
        List<Map<String, Object>> results = new ArrayList<>();
        if (maxResults > 0) {
            results.add(Map.of(
                    "title", "Search result for: " + query,
                    "url", "https://example.com",
                    "snippet", "Information about " + query
            ));
        }
        return results;
    }

    private Map<String, Object> fileOperation(ToolArguments args) {
        String operation = args.getString("operation");
        String path = args.getString("path");
        Path target = fileRoot.resolve(path).normalize();
        if (!target.startsWith(fileRoot)) {
            return fileResult(false, "", "Path escapes the file root: " + path);
        }
        try {
            return switch (operation) {
                case "read" -> fileResult(true, Files.readString(target), "");
                case "write" -> {
                    Files.writeString(target, args.getString("content", ""));
                    yield fileResult(true, "File written to " + path, "");
                }
                case "list" -> listDirectory(target, path);
                default -> fileResult(false, "", "Unknown operation: " + operation);
            };
        } catch (IOException e) {
            log.debug("tool.file_operations.failed operation={} path={} error={}", operation, path, e.toString());
            return fileResult(false, "", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Map<String, Object> listDirectory(Path target, String path) throws IOException {
        if (!Files.isDirectory(target)) {
            return fileResult(false, "", path + " is not a directory");
        }
        List<String> names;
        try (Stream<Path> entries = Files.list(target)) {
            names = entries.map(p -> p.getFileName().toString()).sorted().toList();
        }
        return fileResult(true, String.join("\n", names), "");
    }

    private static Map<String, Object> fileResult(boolean success, String data, String error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", success);
        result.put("data", data);
        result.put("error", error);
        return result;
    }
}
