package com.connectpro.tenants;

public record TrialSweepReport(
    int checked,
    int expired,
    int active,
    int warned
) {}
