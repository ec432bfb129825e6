package com.tool.execution.health;

import com.tool.execution.registry.ToolRegistry;

/**
 * Reports the number of registered tools. DEGRADED when none are registered,
 * since every call would then fail with NOT_FOUND.
 */
public class ToolRegistryHealthCheck implements HealthCheck {

    private final ToolRegistry registry;

    public ToolRegistryHealthCheck(ToolRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String getName() {
        return "tools";
    }

    @Override
    public HealthStatus check() {
        int count = registry.size();
        HealthStatus base = count == 0 ? HealthStatus.degraded("No tools registered") : HealthStatus.up();
        return base.withDetail("registeredTools", count);
    }
}
