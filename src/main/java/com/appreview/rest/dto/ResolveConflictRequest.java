package com.appreview.rest.dto;

/**
 * Request DTO for resolving a conflicted or escalated review.
 */
public record ResolveConflictRequest(String decision, String notes) {
}
