package com.connectpro.routing;

import com.connectpro.channels.BoundedChannel;
import com.connectpro.channels.OutboundChannel;
import com.connectpro.channels.TransportException;
import com.connectpro.observability.RelayMetrics;
import com.connectpro.policy.Footer;
import com.connectpro.policy.MessageCategorizer;
import com.connectpro.policy.PolicyEngine;
import com.connectpro.policy.RejectReason;
import com.connectpro.shared.model.ChannelKey;
import com.connectpro.shared.model.MessageKind;
import com.connectpro.shared.model.Owner;
import com.connectpro.shared.model.OwnerMode;
import com.connectpro.shared.model.OutboundMessage;
import com.connectpro.shared.model.SenderRole;
import com.connectpro.store.QuotaResult;
import com.connectpro.store.RecordStore;
import com.connectpro.store.StoreException;
import com.connectpro.tenants.TenantRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Routes user messages to owners and owner replies back to users.
 * <p>
 * User to owner: resolve owner, check policy, upsert the conversation, persist,
 * forward, then commit the shared-mode daily quota. Persistence is authoritative:
 * a failed forward keeps the stored message but consumes no quota. All steps for
 * one (user, owner) pair run under that pair's lock.
 */
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);
    private static final int LOCK_STRIPES = 64;

    private final RecordStore store;
    private final PolicyEngine policy;
    private final TenantRegistry registry;
    private final OutboundChannel frontDoor;
    private final Footer footer;
    private final ExecutorService io;
    private final Duration transportTimeout;
    private final Clock clock;
    private final RelayMetrics metrics;
    private final PairLocks pairLocks = new PairLocks(LOCK_STRIPES);

    /** An outbound channel and the key of the chat its message ids belong to. */
    record Route(OutboundChannel channel, String key) {}

    public MessageRouter(RecordStore store, PolicyEngine policy, TenantRegistry registry,
                         OutboundChannel frontDoor, Footer footer, ExecutorService io,
                         Duration transportTimeout, Clock clock, RelayMetrics metrics) {
        this.store = store;
        this.policy = policy;
        this.registry = registry;
        this.frontDoor = frontDoor;
        this.footer = footer;
        this.io = io;
        this.transportTimeout = transportTimeout;
        this.clock = clock;
        this.metrics = metrics;
    }

    public RouteOutcome routeUserMessage(UserMessage msg) {
        var sample = Timer.start();
        try {
            return count(guardStore(() -> routeInbound(msg)));
        } finally {
            sample.stop(metrics.routeLatency());
        }
    }

    private RouteOutcome routeInbound(UserMessage msg) {
        var owner = store.getOwner(msg.ownerId()).orElse(null);
        if (owner == null) return RouteOutcome.rejected(RejectReason.OWNER_NOT_FOUND);
        if (!owner.active()) return RouteOutcome.rejected(RejectReason.OWNER_INACTIVE);

        var lock = pairLocks.lockFor(msg.userId(), owner.id());
        lock.lock();
        try {
            var now = clock.instant();
            var existing = store.findConversation(msg.userId(), owner.id()).orElse(null);
            var decision = policy.admits(owner, existing, now);
            if (!decision.allowed()) {
                if (decision.freshExpiry() && store.markTrialExpired(owner.id())) {
                    log.info("Trial expired for tenant {} on first message after {}", owner.id(), policy.trialEnd(owner));
                }
                return RouteOutcome.rejected(decision.reason());
            }

            store.upsertUser(msg.userId(), msg.username(), msg.displayName());
            var conversation = store.getOrCreateConversation(msg.userId(), owner.id());
            var category = MessageCategorizer.categorize(msg.text());
            var stored = store.appendMessage(conversation.id(), SenderRole.USER, msg.text(), MessageKind.TEXT,
                    msg.originId(), Map.of("category", category));

            var route = routeFor(owner);
            long forwardId;
            try {
                forwardId = deliver(route.channel(),
                        new OutboundMessage(owner.id(), forwardText(msg, category)));
            } catch (TransportException e) {
                log.warn("Forward to owner {} failed ({}), message {} kept", owner.id(), e.reason(), stored.id());
                return RouteOutcome.deliveryFailed(e.reason(), conversation.id(), stored.id());
            }

            recordForward(stored.id(), route.key(), forwardId);
            if (owner.mode() == OwnerMode.SHARED_FRONT_DOOR) {
                var quota = store.tryConsumeDailyQuota(msg.userId(), owner.id(),
                        policy.config().dailyMessageLimit(), policy.today(now));
                if (quota == QuotaResult.DENIED) {
                    log.warn("Quota for {}/{} was exhausted concurrently", msg.userId(), owner.id());
                }
            }
            return RouteOutcome.delivered(conversation.id(), stored.id());
        } finally {
            lock.unlock();
        }
    }

    /** Owner reply to a known user; the conversation must already exist. */
    public RouteOutcome routeOwnerReply(long ownerId, long userId, String text, Long originId) {
        return count(guardStore(() -> {
            var owner = store.getOwner(ownerId).orElse(null);
            if (owner == null) return RouteOutcome.rejected(RejectReason.OWNER_NOT_FOUND);
            return reply(owner, userId, text, originId);
        }));
    }

    /**
     * Owner reply made on the forwarded copy with id {@code forwardMessageId} in the
     * chat named by {@code channel}.
     */
    public RouteOutcome routeOwnerReplyTo(long ownerId, String channel, long forwardMessageId, String text,
                                          Long originId) {
        return count(guardStore(() -> {
            var owner = store.getOwner(ownerId).orElse(null);
            if (owner == null) return RouteOutcome.rejected(RejectReason.OWNER_NOT_FOUND);
            var conversation = store.findConversationByForward(ownerId, channel, forwardMessageId).orElse(null);
            if (conversation == null) return RouteOutcome.rejected(RejectReason.CONVERSATION_NOT_FOUND);
            return reply(owner, conversation.userId(), text, originId);
        }));
    }

    private RouteOutcome reply(Owner owner, long userId, String text, Long originId) {
        var lock = pairLocks.lockFor(userId, owner.id());
        lock.lock();
        try {
            var conversation = store.findConversation(userId, owner.id()).orElse(null);
            if (conversation == null) return RouteOutcome.rejected(RejectReason.CONVERSATION_NOT_FOUND);
            var stored = store.appendMessage(conversation.id(), SenderRole.OWNER, text, MessageKind.TEXT, originId);
            try {
                deliver(outboundFor(owner), new OutboundMessage(userId, replyText(owner, text)));
            } catch (TransportException e) {
                log.warn("Reply from owner {} to user {} failed ({})", owner.id(), userId, e.reason());
                return RouteOutcome.deliveryFailed(e.reason(), conversation.id(), stored.id());
            }
            return RouteOutcome.delivered(conversation.id(), stored.id());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Shared owners are reached through the front door. Dedicated owners through their
     * own bot while it runs, else the front door.
     */
    public OutboundChannel outboundFor(Owner owner) {
        return routeFor(owner).channel();
    }

    Route routeFor(Owner owner) {
        var frontRoute = new Route(frontDoor, ChannelKey.FRONT_DOOR);
        return switch (owner.mode()) {
            case SHARED_FRONT_DOOR -> frontRoute;
            case DEDICATED_CHANNEL -> registry.get(owner.id())
                    .map(h -> new Route(h, ChannelKey.dedicated(owner.id())))
                    .orElse(frontRoute);
        };
    }

    String replyText(Owner owner, String text) {
        var body = "📬 Reply from " + owner.displayName() + ":\n\n" + text;
        return switch (owner.mode()) {
            case SHARED_FRONT_DOOR -> body;
            case DEDICATED_CHANNEL -> footer.add(footer.remove(body));
        };
    }

    static String forwardText(UserMessage msg, String category) {
        var from = msg.displayName() != null && !msg.displayName().isBlank() ? msg.displayName() : "User";
        var handle = msg.username() != null ? " (@" + msg.username() + ")" : "";
        return "📩 New Message\n\n"
                + "From: " + from + handle + "\n"
                + "Category: " + category + "\n"
                + "Message: " + msg.text() + "\n\n"
                + "Reply to this message to respond";
    }

    private long deliver(OutboundChannel channel, OutboundMessage message) {
        return new BoundedChannel(channel, io, transportTimeout).send(message);
    }

    private void recordForward(long messageId, String channel, long forwardId) {
        if (forwardId < 0) return;
        try {
            store.recordForward(messageId, channel, forwardId);
        } catch (StoreException e) {
            log.warn("Forward mapping for message {} not saved ({}), replies to it need /reply", messageId, e.reason());
        }
    }

    private RouteOutcome guardStore(Supplier<RouteOutcome> route) {
        try {
            return route.get();
        } catch (StoreException e) {
            if (e.reason() == StoreException.Reason.TIMEOUT) {
                log.warn("Store timeout while routing: {}", e.getMessage());
                return RouteOutcome.rejected(RejectReason.STORE_TIMEOUT);
            }
            log.error("Store failure while routing", e);
            return RouteOutcome.rejected(RejectReason.STORE_FAILURE);
        }
    }

    private RouteOutcome count(RouteOutcome outcome) {
        switch (outcome.status()) {
            case DELIVERED -> metrics.delivered().increment();
            case REJECTED -> metrics.rejected(outcome.reason()).increment();
            case DELIVERY_FAILED -> metrics.deliveryFailed().increment();
        }
        return outcome;
    }
}
