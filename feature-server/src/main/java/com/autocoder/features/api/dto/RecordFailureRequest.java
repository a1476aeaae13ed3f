package com.autocoder.features.api.dto;

/**
 * Request body for POST /features/{id}/failures.
 */
public record RecordFailureRequest(String message) {}
