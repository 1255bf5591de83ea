package com.connectpro.shared.config;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Shared front-door limits and dedicated trial length. The active window is
 * {@code [startHour:00, endHour:endMinute)} evaluated in {@code zone}.
 */
public record PolicyConfig(
    int dailyMessageLimit,
    int startHour,
    int endHour,
    int endMinute,
    int trialDays,
    ZoneId zone,
    List<Integer> trialWarningDays
) {
    public PolicyConfig {
        if (dailyMessageLimit < 0) throw new IllegalArgumentException("daily-message-limit must be >= 0");
        if (trialDays < 0) throw new IllegalArgumentException("trial-days must be >= 0");
        trialWarningDays = List.copyOf(trialWarningDays);
    }

    public static PolicyConfig defaults() {
        return new PolicyConfig(2, 9, 23, 50, 120, ZoneId.of("UTC"), List.of(7, 1));
    }

    public LocalTime windowStart() {
        return LocalTime.of(startHour, 0);
    }

    public LocalTime windowEnd() {
        return LocalTime.of(endHour, endMinute);
    }
}
