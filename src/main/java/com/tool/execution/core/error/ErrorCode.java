package com.tool.execution.core.error;

/**
 * Stable error codes surfaced to callers of the engine and its transports.
 */
public enum ErrorCode {

    /** The requested tool is not registered. */
    NOT_FOUND,

    /** The argument payload does not satisfy the tool's input schema. */
    INVALID_ARGUMENTS,

    /** The handler failed on every allowed attempt. */
    EXECUTION_FAILED,

    /** Unexpected fault inside the engine itself. */
    INTERNAL_ERROR,

    /** The envelope itself is malformed (bad JSON, missing params or tool name). */
    INVALID_REQUEST,

    /** The envelope names a method the protocol does not support. */
    METHOD_NOT_FOUND,

    /** The invocation was cancelled by the caller or by shutdown. */
    CANCELLED,

    /** A tool with the same name is already registered. Registration-time only. */
    DUPLICATE_NAME,

    /** A single attempt exceeded its deadline. Surfaced only as the cause of {@link #EXECUTION_FAILED}. */
    TIMEOUT
}
