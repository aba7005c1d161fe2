package com.appreview.rest.security;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers CORS preflight requests and decorates responses for allowed origins.
 * Requests from origins outside the allow-list get no CORS headers, so the browser blocks them.
 */
@Provider
@Priority(Priorities.HEADER_DECORATOR)
public class CorsFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger log = LoggerFactory.getLogger(CorsFilter.class);
    private static final String ORIGIN = "Origin";

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
        String allowed = corsConfig.allowOriginFor(origin);
        if (allowed == null) {
            log.debug("cors.preflight.denied origin={}", origin);
            requestContext.abortWith(Response.status(Response.Status.FORBIDDEN).build());
            return;
        }
        Response.ResponseBuilder preflight = Response.ok()
                .header("Access-Control-Allow-Origin", allowed)
                .header("Access-Control-Allow-Methods", corsConfig.allowedMethods())
                .header("Access-Control-Allow-Headers", corsConfig.allowedHeaders())
                .header("Access-Control-Max-Age", String.valueOf(corsConfig.maxAge()));
        if (!"*".equals(allowed)) {
            preflight.header("Vary", ORIGIN);
        }
        requestContext.abortWith(preflight.build());
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (!corsConfig.enabled()) {
            return;
        }
        String allowed = corsConfig.allowOriginFor(requestContext.getHeaderString(ORIGIN));
        if (allowed == null) {
            return;
        }
        MultivaluedMap<String, Object> headers = responseContext.getHeaders();
        headers.putSingle("Access-Control-Allow-Origin", allowed);
        headers.putSingle("Access-Control-Allow-Methods", corsConfig.allowedMethods());
        headers.putSingle("Access-Control-Allow-Headers", corsConfig.allowedHeaders());
        if (!"*".equals(allowed)) {
            headers.putSingle("Vary", ORIGIN);
        }
    }
}
