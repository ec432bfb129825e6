package com.tool.execution.policy;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Successful result of a handler run: the produced value and the attempt that produced it.
 */
public record ExecutionOutcome(JsonNode value, int attempts) {
}
