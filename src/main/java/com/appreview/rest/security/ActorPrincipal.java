package com.appreview.rest.security;

import java.security.Principal;

/**
 * Authenticated caller. The name is the actor id used by the approval engine.
 */
public record ActorPrincipal(String actorId) implements Principal {

    @Override
    public String getName() {
        return actorId;
    }
}
