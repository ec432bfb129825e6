package com.tool.execution.health;

/**
 * A single component check reported under {@code GET /health}.
 */
public interface HealthCheck {

    /**
     * Key under which this check's result appears in the aggregate report.
     */
    String getName();

    HealthStatus check();
}
