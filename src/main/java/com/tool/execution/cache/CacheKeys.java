package com.tool.execution.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tool.execution.core.error.InternalEngineException;
import com.tool.execution.core.model.ToolArguments;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derives cache keys of the form {@code toolName:canonicalJson}.
 *
 * <p>The canonical form sorts object keys at every depth and writes numbers in their
 * shortest plain decimal form, so {@code {"b":1,"a":2.0}} and {@code {"a":2,"b":1}}
 * map to the same key. Array order is preserved. NaN and infinities are written as
 * Jackson quotes them ({@code "NaN"}, {@code "Infinity"}).</p>
 */
public final class CacheKeys {

    private static final JsonMapper CANONICAL = JsonMapper.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private CacheKeys() {
    }

    public static String derive(String toolName, ToolArguments arguments) {
        return toolName + ":" + canonicalJson(arguments.toJson());
    }

    /**
     * Serializes a JSON tree in canonical form.
     */
    public static String canonicalJson(JsonNode node) {
        try {
            return CANONICAL.writeValueAsString(canonicalize(node));
        } catch (JsonProcessingException e) {
            throw new InternalEngineException("Failed to derive cache key", e);
        }
    }

    private static JsonNode canonicalize(JsonNode node) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode sorted = factory.objectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode items = factory.arrayNode(node.size());
            for (JsonNode item : node) {
                items.add(canonicalize(item));
            }
            return items;
        }
        if (node.isNumber() && isFinite(node)) {
            BigDecimal normalized = node.decimalValue().stripTrailingZeros();
            return factory.numberNode(normalized);
        }
        return node;
    }

    private static boolean isFinite(JsonNode number) {
        return !(number.isDouble() || number.isFloat()) || Double.isFinite(number.doubleValue());
    }
}
