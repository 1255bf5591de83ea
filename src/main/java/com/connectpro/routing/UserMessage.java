package com.connectpro.routing;

/** A user's message addressed to one owner. {@code originId} is the user's own message id. */
public record UserMessage(
    long userId,
    String username,
    String displayName,
    long ownerId,
    String text,
    Long originId
) {}
