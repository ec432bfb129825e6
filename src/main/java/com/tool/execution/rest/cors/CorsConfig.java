package com.tool.execution.rest.cors;

import java.util.List;

/**
 * Configuration for Cross-Origin Resource Sharing (CORS).
 *
 * <pre>
 * tool-engine.cors.enabled=true
 * tool-engine.cors.allowed-origins=*
 * tool-engine.cors.allow-credentials=true
 * </pre>
 *
 * @param enabled          whether CORS filtering is enabled
 * @param allowedOrigins   allowed origins, {@code *} for all
 * @param allowCredentials whether browsers may send credentials
 * @param allowedMethods   comma-separated allowed HTTP methods
 * @param allowedHeaders   comma-separated allowed headers
 * @param maxAge           preflight cache duration in seconds
 */
public record CorsConfig(
        boolean enabled,
        List<String> allowedOrigins,
        boolean allowCredentials,
        String allowedMethods,
        String allowedHeaders,
        long maxAge
) {
    private static final String DEFAULT_METHODS = "GET,POST,OPTIONS";
    private static final String DEFAULT_HEADERS = "Content-Type,Authorization";
    private static final long DEFAULT_MAX_AGE = 86400;

    public CorsConfig {
        allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty()
                ? List.of("*")
                : allowedOrigins.stream().map(String::trim).filter(o -> !o.isEmpty()).toList();
        if (allowedMethods == null || allowedMethods.isBlank()) {
            allowedMethods = DEFAULT_METHODS;
        }
        if (allowedHeaders == null || allowedHeaders.isBlank()) {
            allowedHeaders = DEFAULT_HEADERS;
        }
        if (maxAge < 0) {
            maxAge = DEFAULT_MAX_AGE;
        }
    }

    /**
     * All origins, credentials allowed, 24h preflight cache.
     */
    public static CorsConfig defaults() {
        return new CorsConfig(true, List.of("*"), true, DEFAULT_METHODS, DEFAULT_HEADERS, DEFAULT_MAX_AGE);
    }

    public static CorsConfig disabled() {
        return new CorsConfig(false, List.of("*"), false, DEFAULT_METHODS, DEFAULT_HEADERS, DEFAULT_MAX_AGE);
    }

    public boolean allowsAnyOrigin() {
        return allowedOrigins.contains("*");
    }

    public boolean isAllowed(String origin) {
        return origin != null && (allowsAnyOrigin() || allowedOrigins.contains(origin));
    }
}
