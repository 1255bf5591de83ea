package com.connectpro.store;

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

/**
 * Durable users, owners, conversations and messages. Every write on the routing
 * path is an upsert or an append, so callers may retry after a timeout.
 */
public interface RecordStore {

    User upsertUser(long id, String username, String displayName);

    Optional<Owner> getOwner(long id);

    /** Creates the owner or switches its mode; a trial window starts only in dedicated mode. */
    Owner upsertOwner(long id, String username, OwnerMode mode);

    Optional<Owner> updateOwner(long id, OwnerUpdate delta);

    List<Owner> listOwners();

    /** Dedicated mode, credential present, active and not trial-expired. */
    List<Owner> listActiveDedicatedOwners();

    Optional<Conversation> findConversation(long userId, long ownerId);

    /** Atomic upsert on the (user, owner) pairing. */
    Conversation getOrCreateConversation(long userId, long ownerId);

    Message appendMessage(long conversationId, SenderRole role, String text, MessageKind kind, Long originId,
                          Map<String, String> metadata);

    default Message appendMessage(long conversationId, SenderRole role, String text, MessageKind kind, Long originId) {
        return appendMessage(conversationId, role, text, kind, originId, Map.of());
    }

    /** Newest first; user-sent messages across all of the owner's conversations. */
    List<Message> recentUserMessages(long ownerId, int limit);

    /**
     * Links a stored user message to the id of its forwarded copy in the owner's chat.
     * {@code channel} names the bot chat that id was issued in.
     */
    void recordForward(long messageId, String channel, long forwardMessageId);

    Optional<Conversation> findConversationByForward(long ownerId, String channel, long forwardMessageId);

    /**
     * Resets a stale day, then increments the pair's counter when it is below
     * {@code cap}; one atomic step.
     */
    QuotaResult tryConsumeDailyQuota(long userId, long ownerId, int cap, LocalDate today);

    /** One-way. Returns whether this call made the transition. */
    boolean markTrialExpired(long ownerId);

    long purgeMessagesOlderThan(Duration retention);

    OwnerStats ownerStats(long ownerId);
}
