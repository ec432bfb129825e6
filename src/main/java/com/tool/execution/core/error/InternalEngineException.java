package com.tool.execution.core.error;

/**
 * Unexpected fault inside the engine (cache failure, unserializable result, ...).
 * Always surfaced to the caller as {@link ErrorCode#INTERNAL_ERROR}.
 */
public class InternalEngineException extends ToolException {

    public InternalEngineException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, message, cause);
    }
}
