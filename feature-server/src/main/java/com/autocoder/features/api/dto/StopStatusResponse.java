package com.autocoder.features.api.dto;

public record StopStatusResponse(boolean stopRequested, String stopFile) {}
