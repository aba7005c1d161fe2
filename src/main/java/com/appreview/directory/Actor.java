package com.appreview.directory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * The caller of an engine operation, with the capability set resolved by the {@link ActorDirectory}.
 * Passed explicitly into every operation.
 *
 * @param id           actor identifier
 * @param capabilities capability set (defensive copy, never null)
 */
public record Actor(String id, Set<Capability> capabilities) {

    public Actor {
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    public static Actor user(String id) {
        return new Actor(id, Set.of());
    }

    public static Actor supervisor(String id) {
        return new Actor(id, Set.of(Capability.SUPERVISOR));
    }

    public static Actor admin(String id) {
        return new Actor(id, Set.of(Capability.ADMIN));
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }

    public boolean isSupervisor() {
        return has(Capability.SUPERVISOR);
    }

    public boolean isAdmin() {
        return has(Capability.ADMIN);
    }

    /**
     * Returns true if this actor may see unsuppressed moderation data.
     */
    public boolean isModerator() {
        return isSupervisor() || isAdmin();
    }
}
