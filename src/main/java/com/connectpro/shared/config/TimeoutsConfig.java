package com.connectpro.shared.config;

import java.time.Duration;

public record TimeoutsConfig(
    Duration store,
    Duration transport,
    Duration drain
) {
    public static TimeoutsConfig defaults() {
        return new TimeoutsConfig(Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(5));
    }
}
