package com.tool.execution.cdi;

import com.tool.execution.cache.CacheConfig;
import com.tool.execution.engine.EngineOptions;
import com.tool.execution.engine.ToolEngine;
import com.tool.execution.health.HealthCheckRegistry;
import com.tool.execution.health.ResultCacheHealthCheck;
import com.tool.execution.health.SessionHealthCheck;
import com.tool.execution.health.ToolRegistryHealthCheck;
import com.tool.execution.metrics.MetricsService;
import com.tool.execution.metrics.MicrometerMetricsService;
import com.tool.execution.metrics.NoOpMetricsService;
import com.tool.execution.protocol.ProtocolHandler;
import com.tool.execution.protocol.SessionRegistry;
import com.tool.execution.registry.ToolRegistry;
import com.tool.execution.rest.cors.CorsConfig;
import com.tool.execution.rest.cors.CorsFilter;
import com.tool.execution.tools.BuiltinTools;
import com.tool.execution.tracing.NoOpTracingService;
import com.tool.execution.tracing.OpenTelemetryTracingService;
import com.tool.execution.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * CDI producer that wires the tool server from MicroProfile Config properties.
 *
 * <p>Every property lives under {@code tool-engine.*}; environment variables map to them
 * through the usual MicroProfile rules ({@code TOOL_ENGINE_CACHE_TTL_SECONDS}, ...).
 * See {@code application.properties} for the defaults.</p>
 *
 * <p>A {@link MeterRegistry} bean, when the container provides one, receives the engine's
 * metrics; otherwise they go to an in-memory registry.</p>
 */
@ApplicationScoped
public class ToolEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(ToolEngineProducer.class);

    // ── Execution ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tool-engine.execution.timeout-seconds", defaultValue = "30")
    long timeoutSeconds;

    @Inject
    @ConfigProperty(name = "tool-engine.execution.max-retries", defaultValue = "3")
    int maxRetries;

    @Inject
    @ConfigProperty(name = "tool-engine.execution.retry-delay-millis", defaultValue = "1000")
    long retryDelayMillis;

    @Inject
    @ConfigProperty(name = "tool-engine.execution.worker-thread-prefix", defaultValue = "tool-worker")
    String workerThreadPrefix;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tool-engine.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "tool-engine.cache.provider", defaultValue = "fifo")
    String cacheProvider;

    @Inject
    @ConfigProperty(name = "tool-engine.cache.max-size", defaultValue = "1000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "tool-engine.cache.ttl-seconds", defaultValue = "3600")
    long cacheTtlSeconds;

    // ── Built-in tools ────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tool-engine.tools.builtin-enabled", defaultValue = "true")
    boolean builtinToolsEnabled;

    @Inject
    @ConfigProperty(name = "tool-engine.tools.file-root", defaultValue = ".")
    String fileRoot;

    // ── Observability ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tool-engine.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "tool-engine.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    // ── CORS ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tool-engine.cors.enabled", defaultValue = "true")
    boolean corsEnabled;

    @Inject
    @ConfigProperty(name = "tool-engine.cors.allowed-origins", defaultValue = "*")
    List<String> corsAllowedOrigins;

    @Inject
    @ConfigProperty(name = "tool-engine.cors.allow-credentials", defaultValue = "true")
    boolean corsAllowCredentials;

    @Inject
    @ConfigProperty(name = "tool-engine.cors.allowed-methods", defaultValue = "GET,POST,OPTIONS")
    String corsAllowedMethods;

    @Inject
    @ConfigProperty(name = "tool-engine.cors.allowed-headers", defaultValue = "Content-Type,Authorization")
    String corsAllowedHeaders;

    @Inject
    @ConfigProperty(name = "tool-engine.cors.max-age", defaultValue = "86400")
    long corsMaxAge;

    @Inject
    Instance<MeterRegistry> meterRegistries;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ToolRegistry toolRegistry() {
        ToolRegistry registry = new ToolRegistry();
        if (builtinToolsEnabled) {
            new BuiltinTools(Clock.systemDefaultZone(), Path.of(fileRoot)).registerAll(registry);
        }
        return registry;
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (!metricsEnabled) {
            return new NoOpMetricsService();
        }
        MeterRegistry registry = meterRegistries.isResolvable() ? meterRegistries.get() : new SimpleMeterRegistry();
        return new MicrometerMetricsService(registry);
    }

    @Produces
    @ApplicationScoped
    public TracingService tracingService() {
        if (!tracingEnabled) {
            return new NoOpTracingService();
        }
        return OpenTelemetryTracingService.fromOpenTelemetry(GlobalOpenTelemetry.get());
    }

    @Produces
    @ApplicationScoped
    public ToolEngine toolEngine(ToolRegistry registry, MetricsService metricsService, TracingService tracingService) {
        CacheConfig cacheConfig = new CacheConfig(cacheMaxSize, Duration.ofSeconds(cacheTtlSeconds),
                cacheEnabled, CacheConfig.Provider.fromString(cacheProvider));
        EngineOptions options = EngineOptions.builder()
                .defaultTimeout(Duration.ofSeconds(timeoutSeconds))
                .defaultMaxRetries(maxRetries)
                .defaultRetryDelay(Duration.ofMillis(retryDelayMillis))
                .cacheConfig(cacheConfig)
                .workerThreadPrefix(workerThreadPrefix)
                .build();
        log.info("Producing ToolEngine: tools={} cache={}({}) timeout={}s maxRetries={}",
                registry.size(), cacheEnabled ? cacheConfig.provider() : "disabled", cacheMaxSize,
                timeoutSeconds, maxRetries);
        return ToolEngine.builder()
                .registry(registry)
                .options(options)
                .metricsService(metricsService)
                .tracingService(tracingService)
                .build();
    }

    public void closeEngine(@Disposes ToolEngine engine) {
        log.info("Closing ToolEngine");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public ProtocolHandler protocolHandler(ToolEngine engine) {
        return new ProtocolHandler(engine);
    }

    @Produces
    @ApplicationScoped
    public SessionRegistry sessionRegistry(ProtocolHandler handler) {
        return new SessionRegistry(handler);
    }

    public void closeSessions(@Disposes SessionRegistry sessions) {
        sessions.closeAll();
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(ToolEngine engine, SessionRegistry sessions) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new ToolRegistryHealthCheck(engine.getRegistry()));
        registry.register(new ResultCacheHealthCheck(engine));
        registry.register(new SessionHealthCheck(sessions, engine));
        return registry;
    }

    @Produces
    @ApplicationScoped
    public CorsConfig corsConfig() {
        return new CorsConfig(corsEnabled, corsAllowedOrigins, corsAllowCredentials,
                corsAllowedMethods, corsAllowedHeaders, corsMaxAge);
    }

    @Produces
    @ApplicationScoped
    public CorsFilter corsFilter(CorsConfig config) {
        return new CorsFilter(config);
    }
}
