package com.connectpro.gateway;

import com.connectpro.channels.BoundedChannel;
import com.connectpro.channels.OutboundChannel;
import com.connectpro.channels.TransportException;
import com.connectpro.maintenance.RetentionSweep;
import com.connectpro.observability.DoctorCommand;
import com.connectpro.policy.MessageCategorizer;
import com.connectpro.routing.MessageRouter;
import com.connectpro.routing.RouteOutcome;
import com.connectpro.routing.UserMessage;
import com.connectpro.shared.model.InboundEvent;
import com.connectpro.shared.model.Owner;
import com.connectpro.shared.model.OwnerMode;
import com.connectpro.shared.model.OutboundMessage;
import com.connectpro.store.RecordStore;
import com.connectpro.store.StoreException;
import com.connectpro.tenants.TenantOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.function.LongPredicate;
import java.util.function.Consumer;

/**
 * Turns inbound chat events into routing calls and acknowledges the sender.
 * <p>
 * Front door: users bind to an owner with {@code /start owner_<id>}, owners sign up
 * with {@code /register} and {@code /token}, answer forwarded messages by replying to
 * them or with {@code /reply}, admins run maintenance commands. Dedicated bots: the tenant's own messages are replies,
 * everyone else's are routed to the tenant.
 */
public class InboundHandler implements Consumer<InboundEvent> {

    private static final Logger log = LoggerFactory.getLogger(InboundHandler.class);
    private static final String OWNER_LINK_PREFIX = "owner_";
    private static final int RECENT_LIMIT = 10;

    private final RecordStore store;
    private final MessageRouter router;
    private final TenantOrchestrator orchestrator;
    private final RetentionSweep retention;
    private final DoctorCommand doctor;
    private final Replies replies;
    private final OutboundChannel frontDoor;
    private final LongPredicate isAdmin;
    private final ExecutorService io;
    private final Duration ackTimeout;
    // front-door user id -> owner they opened a link for
    private final Map<Long, Long> bindings = new ConcurrentHashMap<>();

    public InboundHandler(RecordStore store, MessageRouter router, TenantOrchestrator orchestrator,
                          RetentionSweep retention, DoctorCommand doctor, Replies replies,
                          OutboundChannel frontDoor, LongPredicate isAdmin, ExecutorService io,
                          Duration ackTimeout) {
        this.store = store;
        this.router = router;
        this.orchestrator = orchestrator;
        this.retention = retention;
        this.doctor = doctor;
        this.replies = replies;
        this.frontDoor = frontDoor;
        this.isAdmin = isAdmin;
        this.io = io;
        this.ackTimeout = ackTimeout;
    }

    @Override
    public void accept(InboundEvent event) {
        var channel = ackChannel(event);
        try {
            var answer = switch (event.origin()) {
                case FRONT_DOOR -> handleFrontDoor(event);
                case DEDICATED -> handleDedicated(event);
            };
            if (answer != null) ack(channel, event.chatId(), answer);
        } catch (StoreException e) {
            log.warn("Store unavailable while handling event {} from {}: {}",
                    event.messageId(), event.senderId(), e.getMessage());
            ack(channel, event.chatId(), "⏳ We're having trouble right now. Please try again.");
        }
    }

    Optional<Long> boundOwner(long userId) {
        return Optional.ofNullable(bindings.get(userId));
    }

    private String handleFrontDoor(InboundEvent event) {
        var text = event.text().trim();
        if (text.startsWith("/start")) {
            return start(event, text.substring("/start".length()).trim());
        }
        if (text.equals("/register") || text.startsWith("/register ")) {
            return register(event, text.substring("/register".length()).trim());
        }
        if (text.equals("/token") || text.startsWith("/token ")) {
            return token(event, text.substring("/token".length()).trim());
        }
        if (isAdmin.test(event.senderId()) && text.startsWith("/")) {
            var admin = adminCommand(text);
            if (admin != null) return admin;
        }
        var asOwner = store.getOwner(event.senderId());
        if (asOwner.isPresent()) {
            var ownerAnswer = ownerCommand(asOwner.get(), event, text);
            if (ownerAnswer != null) return ownerAnswer;
        }
        var ownerId = bindings.get(event.senderId());
        if (ownerId == null) {
            return asOwner.isPresent() ? Replies.OWNER_HINT : Replies.UNBOUND;
        }
        return replies.forUser(routeToOwner(event, ownerId));
    }

    private String start(InboundEvent event, String payload) {
        if (payload.startsWith(OWNER_LINK_PREFIX)) {
            long ownerId;
            try {
                ownerId = Long.parseLong(payload.substring(OWNER_LINK_PREFIX.length()));
            } catch (NumberFormatException e) {
                return "❌ Invalid link.";
            }
            var owner = store.getOwner(ownerId).orElse(null);
            if (owner == null) return "❌ This business is no longer available.";
            if (!owner.active()) return "❌ This business is currently inactive.";
            store.upsertUser(event.senderId(), event.senderUsername(), event.senderName());
            bindings.put(event.senderId(), ownerId);
            log.info("User {} connected to owner {} via front door", event.senderId(), ownerId);
            return replies.connected(owner);
        }
        return store.getOwner(event.senderId()).isPresent() ? Replies.OWNER_HINT : Replies.INTRO;
    }

    private String register(InboundEvent event, String choice) {
        OwnerMode mode;
        switch (choice) {
            case "shared":
                mode = OwnerMode.SHARED_FRONT_DOOR;
                break;
            case "dedicated":
                mode = OwnerMode.DEDICATED_CHANNEL;
                break;
            default:
                return Replies.REGISTER_USAGE;
        }
        var existing = store.getOwner(event.senderId()).orElse(null);
        if (existing != null && existing.mode() == mode) {
            return mode == OwnerMode.SHARED_FRONT_DOOR ? replies.registeredShared(existing) : Replies.TOKEN_PROMPT;
        }
        var owner = store.upsertOwner(event.senderId(), event.senderUsername(), mode);
        log.info("Owner {} registered in {} mode", owner.id(), mode);
        if (mode == OwnerMode.SHARED_FRONT_DOOR) {
            orchestrator.deregister(owner.id());
            return replies.registeredShared(owner);
        }
        return Replies.TOKEN_PROMPT;
    }

    private String token(InboundEvent event, String credential) {
        var owner = store.getOwner(event.senderId()).orElse(null);
        if (owner == null || owner.mode() != OwnerMode.DEDICATED_CHANNEL) {
            return "First choose your own bot with /register dedicated.";
        }
        if (credential.isEmpty()) return "Usage: /token <bot token>";
        try {
            var provisioned = orchestrator.provisionDedicated(owner.id(), credential);
            return "🎉 Your bot @" + provisioned.botUsername() + " is live!\n\n"
                    + "Messages to it will be forwarded here by the bot itself.";
        } catch (TransportException e) {
            if (e.reason() == TransportException.Reason.INVALID_CREDENTIAL) {
                return Replies.INVALID_TOKEN;
            }
            log.warn("Could not start bot for owner {} ({})", owner.id(), e.reason());
            return "⚠️ Could not reach Telegram to start your bot. Please try again later.";
        } catch (IllegalStateException e) {
            return Replies.TRIAL_ENDED;
        }
    }

    private String handleDedicated(InboundEvent event) {
        long tenantId = event.tenantId();
        var text = event.text().trim();
        var owner = store.getOwner(tenantId).orElse(null);
        if (owner == null) return "❌ This business is no longer available.";

        if (event.senderId() == tenantId) {
            var answer = ownerCommand(owner, event, text);
            return answer != null ? answer : Replies.OWNER_HINT;
        }
        if (text.equals("/start") || text.startsWith("/start ")) {
            return owner.trialExpired() ? Replies.TRIAL_ENDED : replies.welcome(owner);
        }
        var outcome = routeToOwner(event, tenantId);
        var answer = replies.forUser(outcome);
        return outcome.isDelivered() ? replies.footer().add(answer) : answer;
    }

    private RouteOutcome routeToOwner(InboundEvent event, long ownerId) {
        return router.routeUserMessage(new UserMessage(event.senderId(), event.senderUsername(),
                event.senderName(), ownerId, event.text(), event.messageId()));
    }

    /** Returns {@code null} when the text is not an owner action. */
    private String ownerCommand(Owner owner, InboundEvent event, String text) {
        if (event.replyToMessageId() != null && !event.isCommand()) {
            return replies.forOwner(router.routeOwnerReplyTo(owner.id(), event.channelKey(), event.replyToMessageId(),
                    event.text(), event.messageId()));
        }
        if (text.startsWith("/reply")) {
            var parts = text.split("\\s+", 3);
            if (parts.length < 3) return "Usage: /reply <user id> <text>";
            long userId;
            try {
                userId = Long.parseLong(parts[1]);
            } catch (NumberFormatException e) {
                return "Usage: /reply <user id> <text>";
            }
            return replies.forOwner(router.routeOwnerReply(owner.id(), userId, parts[2], event.messageId()));
        }
        if (text.equals("/messages") || text.startsWith("/messages ")) {
            var category = text.substring("/messages".length()).trim();
            return recentMessages(owner, category.isEmpty() ? MessageCategorizer.ALL : category);
        }
        if (text.equals("/stats")) {
            var stats = store.ownerStats(owner.id());
            return "📊 " + owner.displayName() + "\n\n"
                    + "Users: " + stats.totalUsers() + "\n"
                    + "Messages: " + stats.totalMessages();
        }
        return null;
    }

    private String recentMessages(Owner owner, String category) {
        var recent = MessageCategorizer.filter(store.recentUserMessages(owner.id(), RECENT_LIMIT), category);
        if (recent.isEmpty()) return "📭 No recent messages in " + category + ".";
        var sb = new StringBuilder("📋 Recent messages (" + category + "):\n");
        for (var m : recent) {
            sb.append("\n• ").append(m.text());
        }
        return sb.toString();
    }

    /** Returns {@code null} for unknown commands so they fall through. */
    private String adminCommand(String text) {
        var parts = text.split("\\s+");
        switch (parts[0]) {
            case "/doctor":
                return doctor.run();
            case "/trials": {
                var r = orchestrator.checkTrials();
                return "Trial sweep: " + r.checked() + " checked, " + r.expired() + " expired, "
                        + r.active() + " active, " + r.warned() + " warned";
            }
            case "/cleanup": {
                var r = retention.run();
                var stats = retention.stats();
                return "Cleanup: " + r.messagesDeleted() + " messages deleted"
                        + (r.errors().isEmpty() ? "" : ", errors: " + String.join("; ", r.errors()))
                        + "\nRetention: " + stats.get("retentionDays") + " days (" + stats.get("schedule") + ")";
            }
            case "/pause":
            case "/resume":
                return ownerAdmin(parts);
            default:
                return null;
        }
    }

    private String ownerAdmin(String[] parts) {
        if (parts.length < 2) return "Usage: " + parts[0] + " <owner id>";
        long ownerId;
        try {
            ownerId = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return "Usage: " + parts[0] + " <owner id>";
        }
        try {
            if (parts[0].equals("/pause")) {
                orchestrator.pause(ownerId);
                return "⏸ Owner " + ownerId + " paused.";
            }
            orchestrator.resume(ownerId);
            return "▶️ Owner " + ownerId + " resumed.";
        } catch (IllegalArgumentException e) {
            return "❌ Unknown owner: " + ownerId;
        } catch (TransportException e) {
            return "⚠️ Owner " + ownerId + " resumed, but the bot did not start (" + e.reason() + ").";
        }
    }

    private OutboundChannel ackChannel(InboundEvent event) {
        if (event.origin() == InboundEvent.Origin.DEDICATED && event.tenantId() != null) {
            var handle = orchestrator.registry().get(event.tenantId());
            if (handle.isPresent()) return handle.get();
        }
        return frontDoor;
    }

    private void ack(OutboundChannel channel, long chatId, String text) {
        try {
            new BoundedChannel(channel, io, ackTimeout).send(new OutboundMessage(chatId, text));
        } catch (TransportException e) {
            log.warn("Ack to chat {} failed ({})", chatId, e.reason());
        }
    }
}
