package com.appreview.rest.dto;

/**
 * Request DTO for a supervisor vote: {@code approved} or {@code rejected}.
 */
public record CastVoteRequest(String decision, String comment) {
}
