package com.connectpro.shared.model;

import java.time.Instant;
import java.util.Map;

public record Message(
    long id,
    long conversationId,
    SenderRole role,
    String text,
    MessageKind kind,
    Long originId,
    Map<String, String> metadata,
    Instant createdAt
) {}
