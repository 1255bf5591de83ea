package com.connectpro.shared.model;

import java.time.Instant;

/**
 * One inbound chat event. {@code tenantId} is set for events read by a dedicated
 * bot and {@code null} for the front door. {@code replyToMessageId} is the id of
 * the message this one replies to, when the sender used reply.
 */
public record InboundEvent(
    Origin origin,
    Long tenantId,
    long senderId,
    String senderUsername,
    String senderName,
    long chatId,
    String text,
    long messageId,
    Long replyToMessageId,
    Instant timestamp
) {
    public enum Origin {
        FRONT_DOOR,
        DEDICATED
    }

    /** The chat this event's message ids are numbered in. */
    public String channelKey() {
        return origin == Origin.DEDICATED && tenantId != null
                ? ChannelKey.dedicated(tenantId)
                : ChannelKey.FRONT_DOOR;
    }

    public boolean isCommand() {
        return text != null && text.startsWith("/");
    }
}
