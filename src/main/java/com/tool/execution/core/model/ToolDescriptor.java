package com.tool.execution.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable metadata describing a tool's contract.
 *
 * <p>Timeout, retry count, retry delay and cache TTL are optional: when absent the engine
 * applies its configured defaults at dispatch time. Range checks that concern runtime
 * behaviour (a zero timeout, for instance) are enforced when the descriptor is registered.</p>
 *
 * <pre>
 * ToolDescriptor echo = ToolDescriptor.builder()
 *     .name("echo")
 *     .description("Returns its input")
 *     .inputSchema(Map.of(
 *         "type", "object",
 *         "properties", Map.of("text", Map.of("type", "string")),
 *         "required", List.of("text")))
 *     .outputSchema(Map.of("type", "string"))
 *     .maxRetries(0)
 *     .build();
 * </pre>
 */
public final class ToolDescriptor {

    public static final String DEFAULT_VERSION = "1.0.0";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;
    private final String description;
    private final String version;
    private final Set<String> tags;
    private final JsonNode inputSchema;
    private final JsonNode outputSchema;
    private final Duration timeout;
    private final Integer maxRetries;
    private final Duration retryDelay;
    private final boolean cacheable;
    private final Duration cacheTtl;

    private ToolDescriptor(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.version = builder.version;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.inputSchema = builder.inputSchema;
        this.outputSchema = builder.outputSchema;
        this.timeout = builder.timeout;
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.cacheable = builder.cacheable;
        this.cacheTtl = builder.cacheTtl;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getVersion() {
        return version;
    }

    public Set<String> getTags() {
        return tags;
    }

    /**
     * Returns a copy of the input schema document.
     */
    public JsonNode getInputSchema() {
        return inputSchema.deepCopy();
    }

    /**
     * Returns a copy of the output schema document.
     */
    public JsonNode getOutputSchema() {
        return outputSchema.deepCopy();
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<Integer> getMaxRetries() {
        return Optional.ofNullable(maxRetries);
    }

    public Optional<Duration> getRetryDelay() {
        return Optional.ofNullable(retryDelay);
    }

    /**
     * Whether identical calls may reuse a previous result. Implies the tool is idempotent.
     */
    public boolean isCacheable() {
        return cacheable;
    }

    public Optional<Duration> getCacheTtl() {
        return Optional.ofNullable(cacheTtl);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String description = "";
        private String version = DEFAULT_VERSION;
        private final Set<String> tags = new LinkedHashSet<>();
        private JsonNode inputSchema = emptyObjectSchema();
        private JsonNode outputSchema = JsonNodeFactory.instance.objectNode();
        private Duration timeout;
        private Integer maxRetries;
        private Duration retryDelay;
        private boolean cacheable = true;
        private Duration cacheTtl;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(Objects.requireNonNull(tag, "tag must not be null"));
            return this;
        }

        public Builder tags(Collection<String> tags) {
            tags.forEach(this::tag);
            return this;
        }

        public Builder inputSchema(JsonNode inputSchema) {
            this.inputSchema = Objects.requireNonNull(inputSchema, "inputSchema must not be null").deepCopy();
            return this;
        }

        public Builder inputSchema(Map<String, ?> inputSchema) {
            return inputSchema((JsonNode) MAPPER.valueToTree(inputSchema));
        }

        public Builder outputSchema(JsonNode outputSchema) {
            this.outputSchema = Objects.requireNonNull(outputSchema, "outputSchema must not be null").deepCopy();
            return this;
        }

        public Builder outputSchema(Map<String, ?> outputSchema) {
            return outputSchema((JsonNode) MAPPER.valueToTree(outputSchema));
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder cacheable(boolean cacheable) {
            this.cacheable = cacheable;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public ToolDescriptor build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name is required");
            }
            if (version == null || version.isBlank()) {
                throw new IllegalArgumentException("version is required");
            }
            if (description == null) {
                description = "";
            }
            if (!inputSchema.isObject()) {
                throw new IllegalArgumentException("inputSchema must be a JSON object");
            }
            if (!outputSchema.isObject()) {
                throw new IllegalArgumentException("outputSchema must be a JSON object");
            }
            return new ToolDescriptor(this);
        }

        private static ObjectNode emptyObjectSchema() {
            ObjectNode schema = JsonNodeFactory.instance.objectNode();
            schema.put("type", "object");
            schema.putObject("properties");
            schema.putArray("required");
            return schema;
        }
    }

    @Override
    public String toString() {
        return "ToolDescriptor{" +
                "name='" + name + '\'' +
                ", version='" + version + '\'' +
                ", tags=" + tags +
                ", timeout=" + timeout +
                ", maxRetries=" + maxRetries +
                ", retryDelay=" + retryDelay +
                ", cacheable=" + cacheable +
                ", cacheTtl=" + cacheTtl +
                '}';
    }
}
