package com.tool.execution.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.tool.execution.core.model.ToolArguments;
import com.tool.execution.core.model.ToolDescriptor;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Validates argument payloads and produced values against a tool's structural schemas.
 *
 * <p>Supported keywords: {@code type} (a name or a list of names out of {@code string},
 * {@code number}, {@code integer}, {@code boolean}, {@code object}, {@code array},
 * {@code null}), {@code enum}, {@code required}, {@code properties} and {@code items}.
 * Nested objects and array items are checked recursively. Fields the schema does not
 * declare are accepted without further checks, and unknown type names are accepted too,
 * so older servers tolerate newer schemas.</p>
 *
 * <p>Stateless and thread-safe. Validation is pure: identical inputs give identical reports.</p>
 */
public class SchemaValidator {

    private static final String ROOT = "$";

    /**
     * Validates invocation arguments against the descriptor's input schema.
     */
    public ValidationReport validateInput(ToolDescriptor descriptor, ToolArguments arguments) {
        List<Violation> violations = new ArrayList<>();
        validateValue(ROOT, descriptor.getInputSchema(), arguments.toJson(), violations);
        return violations.isEmpty() ? ValidationReport.ok() : new ValidationReport(violations);
    }

    /**
     * Validates a produced value against the descriptor's output schema.
     * Callers treat the report as advisory.
     */
    public ValidationReport validateOutput(ToolDescriptor descriptor, JsonNode value) {
        List<Violation> violations = new ArrayList<>();
        validateValue(ROOT, descriptor.getOutputSchema(), value != null ? value : NullNode.getInstance(), violations);
        return violations.isEmpty() ? ValidationReport.ok() : new ValidationReport(violations);
    }

    private void validateValue(String path, JsonNode schema, JsonNode value, List<Violation> violations) {
        if (schema == null || !schema.isObject()) {
            return;
        }

        JsonNode type = schema.get("type");
        if (type != null && !matchesType(type, value)) {
            violations.add(Violation.typeMismatch(path, describeType(type), typeName(value)));
            return;
        }

        JsonNode allowed = schema.get("enum");
        if (allowed != null && allowed.isArray() && !containsValue(allowed, value)) {
            violations.add(Violation.notInEnum(path, allowed.toString()));
            return;
        }

        if (value.isObject()) {
            validateObject(path, schema, value, violations);
        } else if (value.isArray()) {
            JsonNode items = schema.get("items");
            if (items != null && items.isObject()) {
                for (int i = 0; i < value.size(); i++) {
                    validateValue(path + "[" + i + "]", items, value.get(i), violations);
                }
            }
        }
    }

    private void validateObject(String path, JsonNode schema, JsonNode value, List<Violation> violations) {
        JsonNode required = schema.get("required");
        if (required != null && required.isArray()) {
            for (JsonNode name : required) {
                if (name.isTextual() && !value.has(name.textValue())) {
                    violations.add(Violation.missing(child(path, name.textValue())));
                }
            }
        }

        JsonNode properties = schema.get("properties");
        if (properties != null && properties.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> property = fields.next();
                JsonNode present = value.get(property.getKey());
                if (present != null) {
                    validateValue(child(path, property.getKey()), property.getValue(), present, violations);
                }
            }
        }
    }

    private boolean matchesType(JsonNode type, JsonNode value) {
        if (type.isTextual()) {
            return matchesTypeName(type.textValue(), value);
        }
        if (type.isArray()) {
            for (JsonNode candidate : type) {
                if (candidate.isTextual() && matchesTypeName(candidate.textValue(), value)) {
                    return true;
                }
            }
            return type.isEmpty();
        }
        return true;
    }

    private boolean matchesTypeName(String typeName, JsonNode value) {
        return switch (typeName) {
            case "string" -> value.isTextual();
            case "number" -> value.isNumber();
            case "integer" -> isInteger(value);
            case "boolean" -> value.isBoolean();
            case "object" -> value.isObject();
            case "array" -> value.isArray();
            case "null" -> value.isNull();
            default -> true;
        };
    }

    private boolean isInteger(JsonNode value) {
        if (value.isIntegralNumber()) {
            return true;
        }
        return isFinite(value)
                && value.decimalValue().stripTrailingZeros().scale() <= 0;
    }

    /**
     * False for NaN and infinite doubles, which have no decimal form.
     */
    static boolean isFinite(JsonNode value) {
        return value.isNumber()
                && (!(value.isDouble() || value.isFloat()) || Double.isFinite(value.doubleValue()));
    }

    private boolean containsValue(JsonNode allowed, JsonNode value) {
        for (JsonNode candidate : allowed) {
            if (candidate.equals(value)) {
                return true;
            }
            if (isFinite(candidate) && isFinite(value)
                    && candidate.decimalValue().compareTo(value.decimalValue()) == 0) {
                return true;
            }
        }
        return false;
    }

    private String describeType(JsonNode type) {
        return type.isTextual() ? type.textValue() : type.toString();
    }

    private String typeName(JsonNode value) {
        if (value.isIntegralNumber()) {
            return "integer";
        }
        return value.getNodeType().name().toLowerCase();
    }

    private String child(String path, String name) {
        return ROOT.equals(path) ? name : path + "." + name;
    }
}
