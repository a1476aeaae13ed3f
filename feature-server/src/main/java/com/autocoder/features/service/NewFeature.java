package com.autocoder.features.service;

import java.util.List;

/**
 * One entry of a bulk-create request, before validation.
 * Any field may be null when the caller left it out.
 */
public record NewFeature(String category, String name, String description, List<String> steps) {}
