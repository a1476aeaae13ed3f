package com.autocoder.features.service;

public record QueueStats(long passing, long total, double percentage) {}
