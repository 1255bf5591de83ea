package com.connectpro.shared.model;

public record OwnerStats(
    long totalUsers,
    long totalMessages
) {}
