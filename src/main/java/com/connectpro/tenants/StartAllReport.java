package com.connectpro.tenants;

public record StartAllReport(
    int started,
    int failed,
    int skipped
) {}
