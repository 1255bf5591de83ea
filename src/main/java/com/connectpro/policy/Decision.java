package com.connectpro.policy;

/**
 * Outcome of {@link PolicyEngine#admits}. {@code freshExpiry} is set on the first
 * trial-expiry denial computed from the clock, telling the caller to persist the
 * expired flag.
 */
public record Decision(
    boolean allowed,
    RejectReason reason,
    boolean freshExpiry
) {
    private static final Decision ALLOW = new Decision(true, null, false);

    public static Decision allow() {
        return ALLOW;
    }

    public static Decision deny(RejectReason reason) {
        return new Decision(false, reason, false);
    }

    public static Decision trialExpired(boolean fresh) {
        return new Decision(false, RejectReason.TRIAL_EXPIRED, fresh);
    }
}
