package com.tool.execution.health;

import com.tool.execution.cache.CacheStats;
import com.tool.execution.engine.ToolEngine;

/**
 * Reports result cache statistics. Always UP; a disabled cache is reported as such.
 */
public class ResultCacheHealthCheck implements HealthCheck {

    private final ToolEngine engine;

    public ResultCacheHealthCheck(ToolEngine engine) {
        this.engine = engine;
    }

    @Override
    public String getName() {
        return "resultCache";
    }

    @Override
    public HealthStatus check() {
        if (!engine.isCacheEnabled()) {
            return HealthStatus.up("Caching disabled").withDetail("enabled", false);
        }
        CacheStats stats = engine.getCacheStats();
        return HealthStatus.up()
                .withDetail("enabled", true)
                .withDetail("size", stats.size())
                .withDetail("hits", stats.hitCount())
                .withDetail("misses", stats.missCount())
                .withDetail("evictions", stats.evictionCount())
                .withDetail("hitRate", Math.round(stats.hitRate() * 1000.0) / 1000.0);
    }
}
