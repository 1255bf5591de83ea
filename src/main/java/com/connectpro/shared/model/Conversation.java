package com.connectpro.shared.model;

import java.time.Instant;
import java.time.LocalDate;

public record Conversation(
    long id,
    long userId,
    long ownerId,
    int messageCountToday,
    LocalDate countDate,
    Instant lastMessageAt,
    Instant createdAt
) {
    /** Counter as seen on {@code today}: a stale date reads as zero. */
    public int countOn(LocalDate today) {
        return today.equals(countDate) ? messageCountToday : 0;
    }
}
