package com.connectpro.policy;

import com.connectpro.shared.config.PolicyConfig;
import com.connectpro.shared.model.Conversation;
import com.connectpro.shared.model.Owner;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Admission rules for user-to-owner messages. Side-effect free: persisting the
 * expired flag and consuming quota are the caller's job.
 */
public class PolicyEngine {

    private final PolicyConfig config;

    public PolicyEngine(PolicyConfig config) {
        this.config = config;
    }

    public PolicyConfig config() {
        return config;
    }

    /**
     * @param conversation the pair's conversation, or {@code null} before first contact
     */
    public Decision admits(Owner owner, Conversation conversation, Instant now) {
        return switch (owner.mode()) {
            case DEDICATED_CHANNEL -> admitsDedicated(owner, now);
            case SHARED_FRONT_DOOR -> admitsShared(conversation, now);
        };
    }

    private Decision admitsDedicated(Owner owner, Instant now) {
        if (owner.trialExpired()) return Decision.trialExpired(false);
        if (isTrialOver(owner, now)) return Decision.trialExpired(true);
        return Decision.allow();
    }

    private Decision admitsShared(Conversation conversation, Instant now) {
        if (!withinActiveWindow(now)) return Decision.deny(RejectReason.OUTSIDE_ACTIVE_WINDOW);
        int sent = conversation == null ? 0 : conversation.countOn(today(now));
        if (sent >= config.dailyMessageLimit()) return Decision.deny(RejectReason.DAILY_LIMIT_REACHED);
        return Decision.allow();
    }

    public boolean withinActiveWindow(Instant now) {
        var time = now.atZone(config.zone()).toLocalTime();
        return !time.isBefore(config.windowStart()) && time.isBefore(config.windowEnd());
    }

    public LocalDate today(Instant now) {
        return now.atZone(config.zone()).toLocalDate();
    }

    /** Computed from the trial start; ignores the persisted flag. */
    public boolean isTrialOver(Owner owner, Instant now) {
        var end = trialEnd(owner);
        return end != null && now.isAfter(end);
    }

    public Instant trialEnd(Owner owner) {
        if (owner.trialStart() == null) return null;
        return owner.trialStart().plus(Duration.ofDays(config.trialDays()));
    }

    /** Whole days left in the trial, never negative; zero without a trial window. */
    public long daysRemaining(Owner owner, Instant now) {
        var end = trialEnd(owner);
        if (end == null) return 0;
        return Math.max(0, Duration.between(now, end).toDays());
    }
}
