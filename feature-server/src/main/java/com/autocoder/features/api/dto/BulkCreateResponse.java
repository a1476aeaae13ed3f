package com.autocoder.features.api.dto;

public record BulkCreateResponse(int created) {}
