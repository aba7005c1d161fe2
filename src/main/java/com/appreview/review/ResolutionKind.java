package com.appreview.review;

/**
 * Kind of admin action captured by a {@link ResolutionRecord}.
 */
public enum ResolutionKind {
    OVERRIDE,
    CONFLICT_RESOLUTION,
    ESCALATION
}
