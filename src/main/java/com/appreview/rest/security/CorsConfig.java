package com.appreview.rest.security;

import java.util.Arrays;
import java.util.List;

/**
 * CORS settings for the single-page client.
 *
 * <pre>
 * review-approval.cors.enabled=true
 * review-approval.cors.allowed-origins=https://reviews.example.com,http://localhost:5173
 * </pre>
 *
 * @param enabled        whether CORS headers are written
 * @param allowedOrigins exact origins allowed, or a single {@code *}
 * @param allowedMethods comma-separated allowed HTTP methods
 * @param allowedHeaders comma-separated allowed request headers
 * @param maxAge         preflight cache duration in seconds
 */
public record CorsConfig(
        boolean enabled,
        List<String> allowedOrigins,
        String allowedMethods,
        String allowedHeaders,
        long maxAge
) {
    private static final String DEFAULT_METHODS = "GET,POST,PUT,DELETE,OPTIONS";
    private static final String DEFAULT_HEADERS = "Content-Type,X-API-Key";

    public CorsConfig {
        allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty()
                ? List.of("*")
                : List.copyOf(allowedOrigins);
        if (allowedMethods == null || allowedMethods.isBlank()) {
            allowedMethods = DEFAULT_METHODS;
        }
        if (allowedHeaders == null || allowedHeaders.isBlank()) {
            allowedHeaders = DEFAULT_HEADERS;
        }
        if (maxAge < 0) {
            maxAge = 3600;
        }
    }

    public static CorsConfig defaults() {
        return new CorsConfig(true, List.of("*"), DEFAULT_METHODS, DEFAULT_HEADERS, 3600);
    }

    public static CorsConfig disabled() {
        return new CorsConfig(false, List.of("*"), DEFAULT_METHODS, DEFAULT_HEADERS, 3600);
    }

    /**
     * Parses a comma-separated origin list.
     */
    public static List<String> parseOrigins(String origins) {
        if (origins == null || origins.isBlank()) {
            return List.of();
        }
        return Arrays.stream(origins.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toList();
    }

    /**
     * Returns the value for {@code Access-Control-Allow-Origin}, or null if the origin is not allowed.
     */
    public String allowOriginFor(String origin) {
        if (allowedOrigins.contains("*")) {
            return "*";
        }
        return origin != null && allowedOrigins.contains(origin) ? origin : null;
    }
}
