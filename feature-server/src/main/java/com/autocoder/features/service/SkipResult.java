package com.autocoder.features.service;

public record SkipResult(long id, String name, int oldPriority, int newPriority) {}
