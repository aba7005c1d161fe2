package com.appreview.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only store for the audit trail of every state-changing review operation.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        if (entry.isTransition()) {
            log.debug("Audit entry recorded: {} {} -> {} for review {} by {}",
                    entry.action(), entry.fromStatus(), entry.toStatus(), entry.reviewId(), entry.actorId());
        } else {
            log.debug("Audit entry recorded: {} for review {} by {}",
                    entry.action(), entry.reviewId(), entry.actorId());
        }
        return entry;
    }

    /**
     * Gets all audit entries (immutable view).
     */
    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForReview(String reviewId) {
        return entries.stream()
                .filter(e -> reviewId.equals(e.reviewId()))
                .toList();
    }

    /**
     * The review's status transitions in the order they happened.
     */
    public List<AuditEntry> getStatusHistory(String reviewId) {
        return entries.stream()
                .filter(e -> e.isTransition() && reviewId.equals(e.reviewId()))
                .toList();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    public List<AuditEntry> getEntriesByActor(String actorId) {
        return entries.stream()
                .filter(e -> actorId.equals(e.actorId()))
                .toList();
    }

    public int size() {
        return entries.size();
    }
}
