package com.tool.execution.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request envelope: {@code {"id": ..., "method": ..., "params": {...}}}.
 *
 * @param id     caller-chosen correlation id, echoed in the response
 * @param method {@code tools/list} or {@code tools/call}
 * @param params method parameters, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProtocolRequest(String id, String method, JsonNode params) {
}
