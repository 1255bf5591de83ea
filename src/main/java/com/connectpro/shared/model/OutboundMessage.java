package com.connectpro.shared.model;

import java.util.List;

public record OutboundMessage(
    long chatId,
    String text,
    List<String> attachments
) {
    public OutboundMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public OutboundMessage(long chatId, String text) {
        this(chatId, text, List.of());
    }
}
