package com.autocoder.features.api.dto;

import java.util.List;

public record RegressionResponse(List<FeatureResponse> features, int count) {}
