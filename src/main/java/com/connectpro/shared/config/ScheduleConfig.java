package com.connectpro.shared.config;

public record ScheduleConfig(
    int retentionDays,
    String retentionCron,
    String trialSweepCron
) {
    public static ScheduleConfig defaults() {
        return new ScheduleConfig(72, "0 0 3 * * *", "0 0 * * * *");
    }
}
