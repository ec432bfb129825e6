package com.tool.execution.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered health checks and folds them into one status.
 * The aggregate takes the worst individual status; each check's result is kept as a detail.
 * A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        HealthStatus worst = HealthStatus.up();
        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            details.put(check.getName(), result.toMap());
            if (result.isWorseThan(worst)) {
                worst = new HealthStatus(result.status(), check.getName() + ": " + result.message(), Map.of());
            }
        }
        return new HealthStatus(worst.status(), worst.message(), details);
    }

    public int size() {
        return checks.size();
    }

    private HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.error("health.check.failed check={}", check.getName(), e);
            return HealthStatus.down("Check failed: " + e.getMessage());
        }
    }
}
