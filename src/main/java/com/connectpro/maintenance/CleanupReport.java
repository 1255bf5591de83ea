package com.connectpro.maintenance;

import java.util.List;

public record CleanupReport(
    long messagesDeleted,
    List<String> errors
) {
    public CleanupReport {
        errors = List.copyOf(errors);
    }
}
