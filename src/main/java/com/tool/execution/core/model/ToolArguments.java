package com.tool.execution.core.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable argument payload of an invocation: a JSON object whose values are tagged
 * (string, number, boolean, object, array or null).
 *
 * <p>The underlying tree is copied on the way in and on the way out, so neither callers
 * nor handlers can mutate a payload another party holds.</p>
 */
public final class ToolArguments {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final ToolArguments EMPTY = new ToolArguments(JsonNodeFactory.instance.objectNode());

    private final ObjectNode node;

    private ToolArguments(ObjectNode node) {
        this.node = node;
    }

    public static ToolArguments empty() {
        return EMPTY;
    }

    /**
     * Builds arguments from plain Java values (strings, numbers, booleans, maps, lists).
     */
    public static ToolArguments of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ToolArguments(MAPPER.valueToTree(values));
    }

    /**
     * Builds arguments from a JSON tree. {@code null} and JSON null yield empty arguments.
     *
     * @throws IllegalArgumentException if the node is not a JSON object
     */
    public static ToolArguments from(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return EMPTY;
        }
        if (!json.isObject()) {
            throw new IllegalArgumentException("arguments must be a JSON object, got " + json.getNodeType());
        }
        return new ToolArguments(((ObjectNode) json).deepCopy());
    }

    public boolean has(String name) {
        return node.has(name);
    }

    public Optional<JsonNode> get(String name) {
        JsonNode value = node.get(name);
        return value == null ? Optional.empty() : Optional.of(value.deepCopy());
    }

    /**
     * Returns a required string argument.
     *
     * @throws IllegalArgumentException if absent or not a string
     */
    public String getString(String name) {
        JsonNode value = node.get(name);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("argument '" + name + "' must be a string");
        }
        return value.textValue();
    }

    public String getString(String name, String defaultValue) {
        JsonNode value = node.get(name);
        return value != null && value.isTextual() ? value.textValue() : defaultValue;
    }

    public int getInt(String name, int defaultValue) {
        JsonNode value = node.get(name);
        return value != null && value.isNumber() ? value.intValue() : defaultValue;
    }

    public long getLong(String name, long defaultValue) {
        JsonNode value = node.get(name);
        return value != null && value.isNumber() ? value.longValue() : defaultValue;
    }

    public double getDouble(String name, double defaultValue) {
        JsonNode value = node.get(name);
        return value != null && value.isNumber() ? value.doubleValue() : defaultValue;
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        JsonNode value = node.get(name);
        return value != null && value.isBoolean() ? value.booleanValue() : defaultValue;
    }

    /**
     * Field names in payload order.
     */
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        Iterator<String> it = node.fieldNames();
        while (it.hasNext()) {
            names.add(it.next());
        }
        return names;
    }

    public int size() {
        return node.size();
    }

    public boolean isEmpty() {
        return node.isEmpty();
    }

    /**
     * Converts the payload to plain Java values.
     */
    public Map<String, Object> asMap() {
        return MAPPER.convertValue(node, MAP_TYPE);
    }

    /**
     * Returns a copy of the payload as a JSON object.
     */
    public ObjectNode toJson() {
        return node.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolArguments that)) return false;
        return node.equals(that.node);
    }

    @Override
    public int hashCode() {
        return node.hashCode();
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
