package com.appreview.rest;

import com.appreview.directory.Actor;
import com.appreview.directory.ActorDirectory;
import com.appreview.error.ReviewApprovalException;
import com.appreview.rest.dto.ErrorResponse;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;

import java.security.Principal;

/**
 * Helpers shared by the review resources: caller resolution and error mapping.
 */
final class ResourceSupport {

    private ResourceSupport() {
    }

    /**
     * Resolves the authenticated caller with its current capabilities.
     *
     * @return the actor, or null if the request is unauthenticated
     */
    static Actor currentActor(SecurityContext securityContext, ActorDirectory directory) {
        if (securityContext == null) {
            return null;
        }
        Principal principal = securityContext.getUserPrincipal();
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            return null;
        }
        return directory.resolve(principal.getName());
    }

    static Response unauthorized(String path) {
        return Response.status(Response.Status.UNAUTHORIZED)
                .entity(ErrorResponse.unauthorized("Authentication required", path))
                .build();
    }

    static Response failure(ReviewApprovalException e, String path) {
        ErrorResponse body = ErrorResponse.of(e, path);
        return Response.status(body.status()).entity(body).build();
    }

    static Response badRequest(String message, String path) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest(message, path))
                .build();
    }

    static Response internalError(Exception e, String path) {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError(e.getMessage(), path))
                .build();
    }
}
