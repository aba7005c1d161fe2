package com.appreview.rest.dto;

public record EscalateRequest(String reason) {
}
