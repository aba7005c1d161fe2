package com.appreview.directory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Source of truth for who is a supervisor and who is an admin.
 * The supervisor roster may change between votes; callers must not cache it.
 */
public interface ActorDirectory {

    boolean isSupervisor(String actorId);

    boolean isAdmin(String actorId);

    /**
     * Returns the ids of every supervisor currently eligible to vote.
     */
    Set<String> listEligibleSupervisors();

    /**
     * Resolves an actor id into an {@link Actor} carrying its current capabilities.
     */
    default Actor resolve(String actorId) {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (isSupervisor(actorId)) {
            capabilities.add(Capability.SUPERVISOR);
        }
        if (isAdmin(actorId)) {
            capabilities.add(Capability.ADMIN);
        }
        return new Actor(actorId, capabilities);
    }
}
