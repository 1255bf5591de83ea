package com.connectpro.store;

import com.connectpro.resilience.BoundedCall;
import com.connectpro.shared.model.Conversation;
import com.connectpro.shared.model.Message;
import com.connectpro.shared.model.MessageKind;
import com.connectpro.shared.model.Owner;
import com.connectpro.shared.model.OwnerMode;
import com.connectpro.shared.model.OwnerStats;
import com.connectpro.shared.model.OwnerUpdate;
import com.connectpro.shared.model.SenderRole;
import com.connectpro.shared.model.User;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Decorator: bounds every store call by a deadline and reports an overrun as
 * {@link StoreException.Reason#TIMEOUT}.
 */
public class TimeLimitedRecordStore implements RecordStore {

    private final RecordStore delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    public TimeLimitedRecordStore(RecordStore delegate, ExecutorService executor, Duration timeout) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
    }

    private <T> T bounded(String operation, Callable<T> call) {
        try {
            return BoundedCall.execute(executor, call, timeout);
        } catch (TimeoutException e) {
            throw new StoreException(StoreException.Reason.TIMEOUT,
                    operation + " exceeded " + timeout.toMillis() + "ms", e);
        }
    }

    @Override
    public User upsertUser(long id, String username, String displayName) {
        return bounded("upsertUser", () -> delegate.upsertUser(id, username, displayName));
    }

    @Override
    public Optional<Owner> getOwner(long id) {
        return bounded("getOwner", () -> delegate.getOwner(id));
    }

    @Override
    public Owner upsertOwner(long id, String username, OwnerMode mode) {
        return bounded("upsertOwner", () -> delegate.upsertOwner(id, username, mode));
    }

    @Override
    public Optional<Owner> updateOwner(long id, OwnerUpdate delta) {
        return bounded("updateOwner", () -> delegate.updateOwner(id, delta));
    }

    @Override
    public List<Owner> listOwners() {
        return bounded("listOwners", delegate::listOwners);
    }

    @Override
    public List<Owner> listActiveDedicatedOwners() {
        return bounded("listActiveDedicatedOwners", delegate::listActiveDedicatedOwners);
    }

    @Override
    public Optional<Conversation> findConversation(long userId, long ownerId) {
        return bounded("findConversation", () -> delegate.findConversation(userId, ownerId));
    }

    @Override
    public Conversation getOrCreateConversation(long userId, long ownerId) {
        return bounded("getOrCreateConversation", () -> delegate.getOrCreateConversation(userId, ownerId));
    }

    @Override
    public Message appendMessage(long conversationId, SenderRole role, String text, MessageKind kind, Long originId,
                                 Map<String, String> metadata) {
        return bounded("appendMessage",
                () -> delegate.appendMessage(conversationId, role, text, kind, originId, metadata));
    }

    @Override
    public List<Message> recentUserMessages(long ownerId, int limit) {
        return bounded("recentUserMessages", () -> delegate.recentUserMessages(ownerId, limit));
    }

    @Override
    public void recordForward(long messageId, String channel, long forwardMessageId) {
        bounded("recordForward", () -> {
            delegate.recordForward(messageId, channel, forwardMessageId);
            return null;
        });
    }

    @Override
    public Optional<Conversation> findConversationByForward(long ownerId, String channel, long forwardMessageId) {
        return bounded("findConversationByForward",
                () -> delegate.findConversationByForward(ownerId, channel, forwardMessageId));
    }

    @Override
    public QuotaResult tryConsumeDailyQuota(long userId, long ownerId, int cap, LocalDate today) {
        return bounded("tryConsumeDailyQuota", () -> delegate.tryConsumeDailyQuota(userId, ownerId, cap, today));
    }

    @Override
    public boolean markTrialExpired(long ownerId) {
        return bounded("markTrialExpired", () -> delegate.markTrialExpired(ownerId));
    }

    @Override
    public long purgeMessagesOlderThan(Duration retention) {
        return bounded("purgeMessagesOlderThan", () -> delegate.purgeMessagesOlderThan(retention));
    }

    @Override
    public OwnerStats ownerStats(long ownerId) {
        return bounded("ownerStats", () -> delegate.ownerStats(ownerId));
    }
}
