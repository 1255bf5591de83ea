package com.connectpro.channels;

import com.connectpro.shared.model.InboundEvent;
import com.connectpro.shared.model.OutboundMessage;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Instant;

public class TelegramTransport implements Transport, LongPollingSingleThreadUpdateConsumer {

    private static final Logger log = LoggerFactory.getLogger(TelegramTransport.class);
    private static final int MAX_MESSAGE_LENGTH = 4096;
    private static final int MAX_CAPTION_LENGTH = 1024;
    // one connection pool and dispatcher for every bot's outbound calls
    private static final OkHttpClient HTTP = new OkHttpClient();

    private final String id;
    private final String botToken;
    private final Long tenantId;
    private TelegramClient telegramClient;
    private TelegramBotsLongPollingApplication bot;
    private volatile EventSink sink;
    private volatile String botUsername;

    private TelegramTransport(String id, String botToken, Long tenantId) {
        this.id = id;
        this.botToken = botToken;
        this.tenantId = tenantId;
    }

    public static TelegramTransport frontDoor(String botToken) {
        return new TelegramTransport("front-door", botToken, null);
    }

    public static TelegramTransport dedicated(long tenantId, String botToken) {
        return new TelegramTransport("tenant:" + tenantId, botToken, tenantId);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String botUsername() {
        return botUsername;
    }

    @Override
    public void open() {
        if (botToken == null || botToken.isBlank()) {
            throw new TransportException(TransportException.Reason.INVALID_CREDENTIAL, "Empty bot token for " + id);
        }
        this.telegramClient = new OkHttpTelegramClient(HTTP, botToken);
        try {
            var me = telegramClient.execute(new GetMe());
            botUsername = me.getUserName();
            log.info("Telegram bot @{} validated for {}", botUsername, id);
        } catch (TelegramApiException e) {
            throw classify(e, "Failed to open " + id);
        }
    }

    @Override
    public void subscribe(EventSink sink) {
        if (telegramClient == null) {
            throw new IllegalStateException("Transport " + id + " is not open");
        }
        this.sink = sink;
        try {
            bot = new TelegramBotsLongPollingApplication();
            bot.registerBot(botToken, this);
            log.info("Telegram polling started for {}", id);
        } catch (TelegramApiException e) {
            throw classify(e, "Failed to start polling for " + id);
        }
    }

    @Override
    public void consume(Update update) {
        if (!update.hasMessage()) return;
        var msg = update.getMessage();
        if (msg.getFrom() == null) return;
        var text = msg.hasText() ? msg.getText() : msg.getCaption();
        if (text == null) return;
        var from = msg.getFrom();
        var replyTo = msg.getReplyToMessage() != null
                ? Long.valueOf(msg.getReplyToMessage().getMessageId())
                : null;
        var event = new InboundEvent(
                tenantId == null ? InboundEvent.Origin.FRONT_DOOR : InboundEvent.Origin.DEDICATED,
                tenantId,
                from.getId(),
                from.getUserName(),
                from.getFirstName(),
                msg.getChatId(),
                text,
                msg.getMessageId(),
                replyTo,
                Instant.now());
        var current = sink;
        if (current == null) return;
        try {
            current.accept(event);
        } catch (Exception e) {
            log.error("Failed to dispatch update {} on {}", update.getUpdateId(), id, e);
        }
    }

    @Override
    public long send(OutboundMessage msg) {
        if (telegramClient == null) {
            throw new TransportException(TransportException.Reason.UNREACHABLE, "Transport " + id + " is not open");
        }
        var chatId = String.valueOf(msg.chatId());
        try {
            if (!msg.attachments().isEmpty()) {
                return sendPhoto(chatId, msg);
            }
            return sendText(chatId, msg.text());
        } catch (TelegramApiException e) {
            throw classify(e, "Failed to send Telegram message to " + chatId + " via " + id);
        }
    }

    private long sendText(String chatId, String text) throws TelegramApiException {
        long firstId = -1;
        // Bot API rejects texts over 4096 chars, split them
        for (int i = 0; i < text.length(); i += MAX_MESSAGE_LENGTH) {
            var chunk = text.substring(i, Math.min(i + MAX_MESSAGE_LENGTH, text.length()));
            var sent = telegramClient.execute(new SendMessage(chatId, chunk));
            if (firstId < 0) firstId = sent.getMessageId();
        }
        return firstId;
    }

    private long sendPhoto(String chatId, OutboundMessage msg) throws TelegramApiException {
        var text = msg.text() == null ? "" : msg.text();
        var caption = text.length() <= MAX_CAPTION_LENGTH ? text : "";
        long firstId = -1;
        for (var fileId : msg.attachments()) {
            var photo = SendPhoto.builder()
                    .chatId(chatId)
                    .photo(new InputFile(fileId))
                    .caption(firstId < 0 ? caption : null)
                    .build();
            var sent = telegramClient.execute(photo);
            if (firstId < 0) firstId = sent.getMessageId();
        }
        if (caption.isEmpty() && !text.isEmpty()) {
            sendText(chatId, text);
        }
        return firstId;
    }

    @Override
    public void close() {
        sink = null;
        if (bot != null) {
            try {
                bot.close();
                log.info("Telegram polling stopped for {}", id);
            } catch (Exception e) {
                log.error("Failed to stop Telegram bot {}", id, e);
            }
        }
    }

    private static TransportException classify(TelegramApiException e, String message) {
        if (e instanceof TelegramApiRequestException req && req.getErrorCode() != null) {
            var retryAfter = req.getParameters() != null ? req.getParameters().getRetryAfter() : null;
            return TransportException.fromStatus(req.getErrorCode(), retryAfter, message + ": " + req.getApiResponse(), e);
        }
        return new TransportException(TransportException.Reason.UNREACHABLE, message + ": " + e.getMessage(), e);
    }
}
