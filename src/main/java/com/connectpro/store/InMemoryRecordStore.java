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

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store for development and tests ({@code store.type: memory}).
 * Per-key atomicity comes from {@link ConcurrentHashMap#compute}.
 */
public class InMemoryRecordStore implements RecordStore {

    private record PairKey(long userId, long ownerId) {}

    private record ForwardRef(String channel, long messageId) {}

    private final Clock clock;
    private final Map<Long, User> users = new ConcurrentHashMap<>();
    private final Map<Long, Owner> owners = new ConcurrentHashMap<>();
    private final Map<PairKey, Conversation> conversations = new ConcurrentHashMap<>();
    private final Map<Long, Message> messages = new ConcurrentHashMap<>();
    // message id -> forwarded copy
    private final Map<Long, ForwardRef> forwards = new ConcurrentHashMap<>();
    private final AtomicLong conversationIds = new AtomicLong();
    private final AtomicLong messageIds = new AtomicLong();

    public InMemoryRecordStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public User upsertUser(long id, String username, String displayName) {
        var now = clock.instant();
        return users.compute(id, (k, existing) -> new User(id, username, displayName,
                existing != null ? existing.createdAt() : now, now));
    }

    public Optional<User> user(long id) {
        return Optional.ofNullable(users.get(id));
    }

    @Override
    public Optional<Owner> getOwner(long id) {
        return Optional.ofNullable(owners.get(id));
    }

    @Override
    public Owner upsertOwner(long id, String username, OwnerMode mode) {
        var now = clock.instant();
        return owners.compute(id, (k, o) -> {
            if (o == null) {
                return new Owner(id, username, null, null, null, null, mode, null, null,
                        mode == OwnerMode.DEDICATED_CHANNEL ? now : null, false, true, null, now);
            }
            var trialStart = mode == OwnerMode.DEDICATED_CHANNEL
                    ? (o.trialStart() != null ? o.trialStart() : now)
                    : null;
            return new Owner(id, o.username(), o.businessName(), o.category(), o.bio(), o.logoRef(), mode,
                    o.credential(), o.botUsername(), trialStart, o.trialExpired(), o.active(), o.onboardingStep(),
                    o.createdAt());
        });
    }

    @Override
    public Optional<Owner> updateOwner(long id, OwnerUpdate d) {
        var now = clock.instant();
        return Optional.ofNullable(owners.computeIfPresent(id, (k, o) -> {
            var mode = d.mode() != null ? d.mode() : o.mode();
            var trialStart = mode == OwnerMode.DEDICATED_CHANNEL
                    ? (o.trialStart() != null ? o.trialStart() : now)
                    : null;
            return new Owner(id, o.username(),
                    d.businessName() != null ? d.businessName() : o.businessName(),
                    d.category() != null ? d.category() : o.category(),
                    d.bio() != null ? d.bio() : o.bio(),
                    d.logoRef() != null ? d.logoRef() : o.logoRef(),
                    mode,
                    d.credential() != null ? d.credential() : o.credential(),
                    d.botUsername() != null ? d.botUsername() : o.botUsername(),
                    trialStart,
                    o.trialExpired(),
                    d.active() != null ? d.active() : o.active(),
                    d.onboardingStep() != null ? d.onboardingStep() : o.onboardingStep(),
                    o.createdAt());
        }));
    }

    /** Replaces an owner wholesale, e.g. to seed a backdated trial. */
    public void putOwner(Owner owner) {
        owners.put(owner.id(), owner);
    }

    @Override
    public List<Owner> listOwners() {
        return owners.values().stream()
                .sorted(Comparator.comparing(Owner::createdAt).reversed())
                .toList();
    }

    @Override
    public List<Owner> listActiveDedicatedOwners() {
        return owners.values().stream().filter(Owner::eligibleForDedicated).toList();
    }

    @Override
    public Optional<Conversation> findConversation(long userId, long ownerId) {
        return Optional.ofNullable(conversations.get(new PairKey(userId, ownerId)));
    }

    @Override
    public Conversation getOrCreateConversation(long userId, long ownerId) {
        var now = clock.instant();
        return conversations.compute(new PairKey(userId, ownerId), (k, c) -> c == null
                ? new Conversation(conversationIds.incrementAndGet(), userId, ownerId, 0, LocalDate.now(clock), now, now)
                : new Conversation(c.id(), userId, ownerId, c.messageCountToday(), c.countDate(), now, c.createdAt()));
    }

    @Override
    public Message appendMessage(long conversationId, SenderRole role, String text, MessageKind kind, Long originId,
                                 Map<String, String> metadata) {
        var known = conversations.values().stream().anyMatch(c -> c.id() == conversationId);
        if (!known) {
            throw new StoreException(StoreException.Reason.CONSTRAINT_VIOLATION,
                    "Unknown conversation: " + conversationId);
        }
        var message = new Message(messageIds.incrementAndGet(), conversationId, role, text, kind, originId,
                metadata == null ? Map.of() : Map.copyOf(metadata), clock.instant());
        messages.put(message.id(), message);
        return message;
    }

    public List<Message> messages(long conversationId) {
        return messages.values().stream()
                .filter(m -> m.conversationId() == conversationId)
                .sorted(Comparator.comparingLong(Message::id))
                .toList();
    }

    @Override
    public List<Message> recentUserMessages(long ownerId, int limit) {
        var ids = conversations.values().stream()
                .filter(c -> c.ownerId() == ownerId)
                .map(Conversation::id)
                .toList();
        return messages.values().stream()
                .filter(m -> m.role() == SenderRole.USER && ids.contains(m.conversationId()))
                .sorted(Comparator.comparingLong(Message::id).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public void recordForward(long messageId, String channel, long forwardMessageId) {
        forwards.put(messageId, new ForwardRef(channel, forwardMessageId));
    }

    @Override
    public Optional<Conversation> findConversationByForward(long ownerId, String channel, long forwardMessageId) {
        var wanted = new ForwardRef(channel, forwardMessageId);
        return forwards.entrySet().stream()
                .filter(e -> e.getValue().equals(wanted))
                .map(e -> messages.get(e.getKey()))
                .filter(m -> m != null)
                .sorted(Comparator.comparingLong(Message::id).reversed())
                .flatMap(m -> conversations.values().stream()
                        .filter(c -> c.id() == m.conversationId() && c.ownerId() == ownerId))
                .findFirst();
    }

    @Override
    public QuotaResult tryConsumeDailyQuota(long userId, long ownerId, int cap, LocalDate today) {
        var allowed = new AtomicBoolean(false);
        conversations.computeIfPresent(new PairKey(userId, ownerId), (k, c) -> {
            int current = c.countOn(today);
            if (current >= cap) return c;
            allowed.set(true);
            return new Conversation(c.id(), userId, ownerId, current + 1, today, clock.instant(), c.createdAt());
        });
        return allowed.get() ? QuotaResult.ALLOWED : QuotaResult.DENIED;
    }

    @Override
    public boolean markTrialExpired(long ownerId) {
        var fresh = new AtomicBoolean(false);
        owners.computeIfPresent(ownerId, (k, o) -> {
            if (o.trialExpired()) return o;
            fresh.set(true);
            return new Owner(o.id(), o.username(), o.businessName(), o.category(), o.bio(), o.logoRef(), o.mode(),
                    o.credential(), o.botUsername(), o.trialStart(), true, o.active(), o.onboardingStep(),
                    o.createdAt());
        });
        return fresh.get();
    }

    @Override
    public long purgeMessagesOlderThan(Duration retention) {
        var cutoff = clock.instant().minus(retention);
        var stale = messages.values().stream()
                .filter(m -> m.createdAt().isBefore(cutoff))
                .map(Message::id)
                .toList();
        stale.forEach(id -> {
            messages.remove(id);
            forwards.remove(id);
        });
        return stale.size();
    }

    @Override
    public OwnerStats ownerStats(long ownerId) {
        var ids = conversations.values().stream()
                .filter(c -> c.ownerId() == ownerId)
                .map(Conversation::id)
                .toList();
        long total = messages.values().stream().filter(m -> ids.contains(m.conversationId())).count();
        return new OwnerStats(ids.size(), total);
    }
}
