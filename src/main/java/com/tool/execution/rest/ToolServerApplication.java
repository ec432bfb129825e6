package com.tool.execution.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Jakarta RS Application class with OpenAPI metadata for the tool server.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Tool Execution Server",
                version = "1.0.0",
                description = "Registers named tools with structural schemas and executes them on request " +
                        "with input validation, timeouts, bounded retries and result caching. " +
                        "Streaming clients connect over WebSocket at /ws.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        ),
        tags = @Tag(name = "Tools", description = "Discover and execute tools")
)
public class ToolServerApplication extends Application {
}
