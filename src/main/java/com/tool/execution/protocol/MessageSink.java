package com.tool.execution.protocol;

import java.io.IOException;

/**
 * Outbound side of a streaming connection.
 */
@FunctionalInterface
public interface MessageSink {

    void send(String message) throws IOException;
}
