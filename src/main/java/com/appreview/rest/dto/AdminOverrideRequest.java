package com.appreview.rest.dto;

/**
 * Request DTO for an admin status override.
 */
public record AdminOverrideRequest(String status, String reason) {
}
