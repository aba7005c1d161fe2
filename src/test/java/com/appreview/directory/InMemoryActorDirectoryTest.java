package com.appreview.directory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryActorDirectoryTest {

    @Test
    @DisplayName("Seeds the roster and resolves capabilities")
    void resolvesCapabilities() {
        InMemoryActorDirectory directory = new InMemoryActorDirectory(List.of("sup-1", "both"), List.of("root", "both"));

        assertEquals(Set.of(Capability.SUPERVISOR), directory.resolve("sup-1").capabilities());
        assertEquals(Set.of(Capability.ADMIN), directory.resolve("root").capabilities());
        Actor both = directory.resolve("both");
        assertTrue(both.isSupervisor());
        assertTrue(both.isAdmin());
        assertFalse(directory.resolve("alice").isModerator());
    }

    @Test
    @DisplayName("Roster changes are visible immediately and snapshots stay stable")
    void rosterChanges() {
        InMemoryActorDirectory directory = new InMemoryActorDirectory();
        directory.addSupervisor("sup-1");
        directory.addSupervisor("sup-2");
        Set<String> snapshot = directory.listEligibleSupervisors();

        directory.removeSupervisor("sup-1");

        assertEquals(Set.of("sup-1", "sup-2"), snapshot);
        assertEquals(Set.of("sup-2"), directory.listEligibleSupervisors());
        assertFalse(directory.isSupervisor("sup-1"));
        assertFalse(directory.isSupervisor(null));
    }

    @Test
    @DisplayName("Actor requires a non-blank id")
    void actorValidation() {
        assertThrows(NullPointerException.class, () -> new Actor(null, Set.of()));
        assertThrows(IllegalArgumentException.class, () -> Actor.user(" "));
        assertTrue(new Actor("x", null).capabilities().isEmpty());
    }
}
