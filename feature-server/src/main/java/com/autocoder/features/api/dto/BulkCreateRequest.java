package com.autocoder.features.api.dto;

import com.autocoder.features.service.NewFeature;

import java.util.List;

/**
 * Request body for POST /features/bulk.
 *
 * Each entry needs category, name, description and a non-empty steps list.
 * Entries keep their order: the first one gets the lowest new priority.
 */
public record BulkCreateRequest(List<NewFeature> features) {}
