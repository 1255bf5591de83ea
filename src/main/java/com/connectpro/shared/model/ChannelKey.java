package com.connectpro.shared.model;

/**
 * Names the bot chat a message id belongs to. Telegram numbers messages per chat,
 * so an owner's chat with the front door and with their own bot reuse ids.
 */
public final class ChannelKey {

    public static final String FRONT_DOOR = "front";

    private ChannelKey() {
    }

    public static String dedicated(long tenantId) {
        return "bot:" + tenantId;
    }
}
