package com.appreview.rest.security;

import com.appreview.directory.ActorDirectory;
import com.appreview.rest.dto.ErrorResponse;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jakarta RS filter that maps an API key to the calling actor.
 *
 * <p>The authenticated {@link SecurityContext} carries an {@link ActorPrincipal};
 * {@code isUserInRole("supervisor")} and {@code isUserInRole("admin")} are answered by
 * the {@link ActorDirectory} at call time, so roster changes apply immediately.</p>
 *
 * <p>Returns {@code 401 Unauthorized} for missing or unknown keys while security is enabled.</p>
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class ApiKeyAuthFilter implements ContainerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthFilter.class);

    public static final String SUPERVISOR_ROLE = "supervisor";
    public static final String ADMIN_ROLE = "admin";

    private final SecurityConfig securityConfig;
    private final ActorDirectory directory;

    public ApiKeyAuthFilter(SecurityConfig securityConfig, ActorDirectory directory) {
        this.securityConfig = securityConfig;
        this.directory = directory;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if ("OPTIONS".equalsIgnoreCase(requestContext.getMethod())) {
            return;
        }
        if (!securityConfig.isEnabled()) {
            String actorId = requestContext.getHeaderString(securityConfig.getActorHeader());
            if (actorId != null && !actorId.isBlank()) {
                authenticate(requestContext, actorId.trim(), "HEADER");
            }
            return;
        }

        String path = requestContext.getUriInfo().getPath();
        String apiKey = requestContext.getHeaderString(securityConfig.getApiKeyHeader());
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("auth.rejected reason=missing_api_key path={}", path);
            requestContext.abortWith(unauthorized("Missing API key. Provide a valid key in the '"
                    + securityConfig.getApiKeyHeader() + "' header.", path));
            return;
        }

        String actorId = securityConfig.getActorForKey(apiKey);
        if (actorId == null) {
            log.warn("auth.rejected reason=invalid_api_key path={}", path);
            requestContext.abortWith(unauthorized("Invalid API key.", path));
            return;
        }

        authenticate(requestContext, actorId, "API-KEY");
        log.debug("auth.success actorId={} path={}", actorId, path);
    }

    private void authenticate(ContainerRequestContext requestContext, String actorId, String scheme) {
        SecurityContext original = requestContext.getSecurityContext();
        ActorPrincipal principal = new ActorPrincipal(actorId);
        requestContext.setSecurityContext(new SecurityContext() {
            @Override
            public ActorPrincipal getUserPrincipal() {
                return principal;
            }

            @Override
            public boolean isUserInRole(String role) {
                if (SUPERVISOR_ROLE.equalsIgnoreCase(role)) {
                    return directory.isSupervisor(actorId);
                }
                if (ADMIN_ROLE.equalsIgnoreCase(role)) {
                    return directory.isAdmin(actorId);
                }
                return false;
            }

            @Override
            public boolean isSecure() {
                return original != null && original.isSecure();
            }

            @Override
            public String getAuthenticationScheme() {
                return scheme;
            }
        });
    }

    private static Response unauthorized(String message, String path) {
        return Response.status(Response.Status.UNAUTHORIZED)
                .entity(ErrorResponse.unauthorized(message, path))
                .build();
    }
}
