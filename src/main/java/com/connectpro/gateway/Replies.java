package com.connectpro.gateway;

import com.connectpro.policy.Footer;
import com.connectpro.routing.RouteOutcome;
import com.connectpro.shared.config.PolicyConfig;
import com.connectpro.shared.model.Owner;

import java.util.function.Supplier;

/** User- and owner-facing texts for routing outcomes. */
public class Replies {

    static final String INTRO = "👋 Welcome to ConnectPro!\n\n"
            + "Businesses use ConnectPro to talk to their customers.\n"
            + "Open a business's link to start a conversation.";
    static final String UNBOUND = "👋 Welcome! Use /start to begin or use a channel's direct link.";
    static final String TRIAL_ENDED = "⚠️ This bot's trial has ended.\n\nSubscription Coming Soon.\nPlease wait for update.";
    static final String OWNER_HINT = "↩️ Reply to a forwarded message to answer, or use /reply <user id> <text>.";
    static final String REGISTER_USAGE = "Choose your option:\n\n"
            + "/register shared - use ConnectPro directly (free with limits)\n"
            + "/register dedicated - run your own branded bot (4 months free trial)";
    static final String TOKEN_PROMPT = "🚀 You'll get 4 months completely free!\n\n"
            + "Create a bot with @BotFather, then send its token here:\n/token <bot token>\n\n"
            + "⚠️ Keep your token private!";
    static final String INVALID_TOKEN = "❌ Invalid token! Please check and try again.\n\n"
            + "Make sure you copied the full token from @BotFather.";

    private final PolicyConfig policy;
    private final Footer footer;
    private final Supplier<String> frontDoorName;

    public Replies(PolicyConfig policy, Footer footer) {
        this(policy, footer, () -> "ConnectProBot");
    }

    public Replies(PolicyConfig policy, Footer footer, Supplier<String> frontDoorName) {
        this.policy = policy;
        this.footer = footer;
        this.frontDoorName = frontDoorName;
    }

    public String forUser(RouteOutcome outcome) {
        return switch (outcome.status()) {
            case DELIVERED -> "✅ Message sent! The owner will reply soon.";
            case DELIVERY_FAILED -> "❌ Failed to deliver message. Please try again.";
            case REJECTED -> switch (outcome.reason()) {
                case OWNER_NOT_FOUND -> "❌ This business is no longer available.";
                case OWNER_INACTIVE -> "❌ This business is currently inactive.";
                case TRIAL_EXPIRED -> TRIAL_ENDED;
                case OUTSIDE_ACTIVE_WINDOW -> String.format(
                        "⏰ Free mode is active only from %02d:00 to %02d:%02d (%s).\n\nPlease try again during active hours!",
                        policy.startHour(), policy.endHour(), policy.endMinute(), policy.zone().getId());
                case DAILY_LIMIT_REACHED -> "📫 You've reached your daily limit of " + policy.dailyMessageLimit()
                        + " messages.\n\nTry again tomorrow!";
                case CONVERSATION_NOT_FOUND -> "❌ Conversation not found.";
                case STORE_TIMEOUT, STORE_FAILURE -> "⏳ We're having trouble right now. Please try again.";
            };
        };
    }

    public String forOwner(RouteOutcome outcome) {
        return switch (outcome.status()) {
            case DELIVERED -> "✅ Reply sent!";
            case DELIVERY_FAILED -> "❌ Failed to send reply (" + outcome.failure().name().toLowerCase() + ").";
            case REJECTED -> switch (outcome.reason()) {
                case CONVERSATION_NOT_FOUND -> "❌ Could not find who that message came from.";
                case STORE_TIMEOUT, STORE_FAILURE -> "⏳ We're having trouble right now. Please try again.";
                default -> "❌ Reply not sent.";
            };
        };
    }

    /** Greeting for a user who opened an owner's front-door link. */
    public String connected(Owner owner) {
        return "👋 Welcome! You're connected to " + owner.displayName() + ".\n\n"
                + "📝 " + (owner.bio() != null ? owner.bio() : "No bio set") + "\n\n"
                + "Send your message below and the owner will reply soon!";
    }

    public String registeredShared(Owner owner) {
        return "✅ You're set up on ConnectPro!\n\n"
                + "• " + policy.dailyMessageLimit() + " messages per user per day\n"
                + String.format("• Active %02d:00 to %02d:%02d", policy.startHour(), policy.endHour(),
                        policy.endMinute()) + "\n\n"
                + "Share your link: https://t.me/" + frontDoorName.get() + "?start=owner_" + owner.id();
    }

    /** Greeting on a dedicated bot's /start. */
    public String welcome(Owner owner) {
        return footer.add("👋 Welcome to " + owner.displayName() + "!\n\n"
                + "📝 " + (owner.bio() != null ? owner.bio() : "Send us a message!") + "\n\n"
                + "Your messages will be forwarded to the owner.");
    }

    public Footer footer() {
        return footer;
    }
}
