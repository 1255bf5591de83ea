package com.connectpro.shared.config;

import java.util.List;
import java.util.Map;

public record RelayConfig(
    String frontDoorToken,
    String frontDoorUsername,
    String storeType,
    Map<String, String> database,
    List<Long> adminIds,
    String footerText,
    PolicyConfig policy,
    TimeoutsConfig timeouts,
    ScheduleConfig schedule,
    int dispatchLanes
) {
    public boolean inMemoryStore() {
        return "memory".equalsIgnoreCase(storeType);
    }

    public boolean isAdmin(long userId) {
        return adminIds.contains(userId);
    }
}
