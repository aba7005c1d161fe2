package com.appreview.directory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link ActorDirectory}. Thread-safe; roster changes are visible to the next evaluation.
 */
public class InMemoryActorDirectory implements ActorDirectory {
    private static final Logger log = LoggerFactory.getLogger(InMemoryActorDirectory.class);

    private final Set<String> supervisors = ConcurrentHashMap.newKeySet();
    private final Set<String> admins = ConcurrentHashMap.newKeySet();

    public InMemoryActorDirectory() {
    }

    public InMemoryActorDirectory(Collection<String> supervisors, Collection<String> admins) {
        supervisors.forEach(this::addSupervisor);
        admins.forEach(this::addAdmin);
    }

    public void addSupervisor(String actorId) {
        if (supervisors.add(actorId)) {
            log.info("directory.supervisor.added actorId={} rosterSize={}", actorId, supervisors.size());
        }
    }

    public void removeSupervisor(String actorId) {
        if (supervisors.remove(actorId)) {
            log.info("directory.supervisor.removed actorId={} rosterSize={}", actorId, supervisors.size());
        }
    }

    public void addAdmin(String actorId) {
        if (admins.add(actorId)) {
            log.info("directory.admin.added actorId={}", actorId);
        }
    }

    public void removeAdmin(String actorId) {
        if (admins.remove(actorId)) {
            log.info("directory.admin.removed actorId={}", actorId);
        }
    }

    @Override
    public boolean isSupervisor(String actorId) {
        return actorId != null && supervisors.contains(actorId);
    }

    @Override
    public boolean isAdmin(String actorId) {
        return actorId != null && admins.contains(actorId);
    }

    @Override
    public Set<String> listEligibleSupervisors() {
        return Set.copyOf(supervisors);
    }
}
