package com.tool.execution.health;

import com.tool.execution.engine.ToolEngine;
import com.tool.execution.protocol.SessionRegistry;

/**
 * Reports open streaming connections and invocations in flight. DOWN once the engine is closed.
 */
public class SessionHealthCheck implements HealthCheck {

    private final SessionRegistry sessions;
    private final ToolEngine engine;

    public SessionHealthCheck(SessionRegistry sessions, ToolEngine engine) {
        this.sessions = sessions;
        this.engine = engine;
    }

    @Override
    public String getName() {
        return "sessions";
    }

    @Override
    public HealthStatus check() {
        HealthStatus base = engine.isClosed() ? HealthStatus.down("Engine closed") : HealthStatus.up();
        return base
                .withDetail("activeConnections", sessions.activeCount())
                .withDetail("inFlightInvocations", engine.getInFlightCount());
    }
}
