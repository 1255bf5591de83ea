package com.connectpro.shared.model;

import java.time.Instant;

public record User(
    long id,
    String username,
    String displayName,
    Instant createdAt,
    Instant lastActive
) {}
