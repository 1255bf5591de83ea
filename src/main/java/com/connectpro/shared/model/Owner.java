package com.connectpro.shared.model;

import java.time.Instant;

/**
 * A business owner (tenant). {@code id} is the owner's chat identity, which is
 * also the chat forwards are delivered to.
 */
public record Owner(
    long id,
    String username,
    String businessName,
    String category,
    String bio,
    String logoRef,
    OwnerMode mode,
    String credential,
    String botUsername,
    Instant trialStart,
    boolean trialExpired,
    boolean active,
    OnboardingStep onboardingStep,
    Instant createdAt
) {
    public Owner {
        if (mode == null) mode = OwnerMode.SHARED_FRONT_DOOR;
        if (onboardingStep == null) onboardingStep = OnboardingStep.NAME;
        if (mode == OwnerMode.SHARED_FRONT_DOOR && trialStart != null) {
            throw new IllegalArgumentException("Shared front-door owner " + id + " cannot carry a trial window");
        }
        if (mode == OwnerMode.DEDICATED_CHANNEL && onboardingStep.reached(OnboardingStep.DONE)
                && (credential == null || credential.isBlank())) {
            throw new IllegalArgumentException("Dedicated owner " + id + " finished onboarding without a credential");
        }
    }

    public boolean hasCredential() {
        return credential != null && !credential.isBlank();
    }

    /** Active, not expired, dedicated and holding a credential. */
    public boolean eligibleForDedicated() {
        return active && !trialExpired && mode == OwnerMode.DEDICATED_CHANNEL && hasCredential();
    }

    public String displayName() {
        return businessName != null && !businessName.isBlank() ? businessName : "Business #" + id;
    }
}
