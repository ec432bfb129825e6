package com.tool.execution.rest.cors;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;

/**
 * Jakarta RS filter that handles CORS headers.
 *
 * <p>Answers preflight {@code OPTIONS} requests directly and decorates every other response.
 * The request's {@code Origin} is echoed back when it is allowed, which browsers require
 * whenever credentials are allowed. Requests from origins that are not allowed get no
 * CORS headers.</p>
 */
@Provider
@Priority(Priorities.HEADER_DECORATOR)
public class CorsFilter implements ContainerRequestFilter, ContainerResponseFilter {

    static final String ORIGIN = "Origin";

    private final CorsConfig corsConfig;

    public CorsFilter(CorsConfig corsConfig) {
        this.corsConfig = corsConfig;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!corsConfig.enabled() || !"OPTIONS".equalsIgnoreCase(requestContext.getMethod())) {
            return;
        }
        String origin = requestContext.getHeaderString(ORIGIN);
        Response.ResponseBuilder preflight = Response.ok();
        if (corsConfig.isAllowed(origin)) {
            preflight.header("Access-Control-Allow-Origin", allowOriginValue(origin))
                    .header("Access-Control-Allow-Methods", corsConfig.allowedMethods())
                    .header("Access-Control-Allow-Headers", corsConfig.allowedHeaders())
                    .header("Access-Control-Max-Age", String.valueOf(corsConfig.maxAge()));
            if (corsConfig.allowCredentials()) {
                preflight.header("Access-Control-Allow-Credentials", "true");
            }
        }
        requestContext.abortWith(preflight.build());
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (!corsConfig.enabled()) {
            return;
        }
        String origin = requestContext.getHeaderString(ORIGIN);
        if (!corsConfig.isAllowed(origin)) {
            return;
        }
        MultivaluedMap<String, Object> headers = responseContext.getHeaders();
        headers.putSingle("Access-Control-Allow-Origin", allowOriginValue(origin));
        headers.putSingle("Access-Control-Allow-Methods", corsConfig.allowedMethods());
        headers.putSingle("Access-Control-Allow-Headers", corsConfig.allowedHeaders());
        if (corsConfig.allowCredentials()) {
            headers.putSingle("Access-Control-Allow-Credentials", "true");
        }
        headers.add("Vary", ORIGIN);
    }

    private String allowOriginValue(String origin) {
        // "*" is rejected by browsers on credentialed requests
        if (corsConfig.allowsAnyOrigin() && !corsConfig.allowCredentials()) {
            return "*";
        }
        return origin;
    }
}
