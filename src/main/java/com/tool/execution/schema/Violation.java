package com.tool.execution.schema;

import java.util.Map;

/**
 * A single field-level schema violation.
 *
 * @param field   dotted / indexed path of the offending field ({@code address.city}, {@code items[2]})
 * @param kind    what went wrong
 * @param message human-readable description
 */
public record Violation(String field, Kind kind, String message) {

    public enum Kind { MISSING, TYPE_MISMATCH, NOT_IN_ENUM }

    public static Violation missing(String field) {
        return new Violation(field, Kind.MISSING, "required field is missing");
    }

    public static Violation typeMismatch(String field, String expected, String actual) {
        return new Violation(field, Kind.TYPE_MISMATCH, "expected " + expected + " but was " + actual);
    }

    public static Violation notInEnum(String field, String allowed) {
        return new Violation(field, Kind.NOT_IN_ENUM, "value must be one of " + allowed);
    }

    public Map<String, Object> toMap() {
        return Map.of("field", field, "kind", kind.name(), "message", message);
    }
}
