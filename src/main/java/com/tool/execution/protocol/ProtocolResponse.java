package com.tool.execution.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.tool.execution.core.error.ErrorCode;
import com.tool.execution.core.model.ToolError;

/**
 * Response envelope carrying either a result or an error, correlated by id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProtocolResponse(String id, JsonNode result, ToolError error) {

    public static ProtocolResponse success(String id, JsonNode result) {
        return new ProtocolResponse(id, result, null);
    }

    public static ProtocolResponse failure(String id, ToolError error) {
        return new ProtocolResponse(id, null, error);
    }

    public static ProtocolResponse failure(String id, ErrorCode code, String message) {
        return new ProtocolResponse(id, null, ToolError.of(code, message));
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
