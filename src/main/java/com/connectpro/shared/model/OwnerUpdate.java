package com.connectpro.shared.model;

/**
 * Field delta for {@code updateOwner}; {@code null} components are left untouched.
 */
public record OwnerUpdate(
    String businessName,
    String category,
    String bio,
    String logoRef,
    OwnerMode mode,
    String credential,
    String botUsername,
    Boolean active,
    OnboardingStep onboardingStep
) {
    public static OwnerUpdate active(boolean active) {
        return new OwnerUpdate(null, null, null, null, null, null, null, active, null);
    }

    public static OwnerUpdate dedicated(String credential, String botUsername) {
        return new OwnerUpdate(null, null, null, null, OwnerMode.DEDICATED_CHANNEL, credential, botUsername,
                null, OnboardingStep.DONE);
    }

    public boolean isEmpty() {
        return businessName == null && category == null && bio == null && logoRef == null && mode == null
                && credential == null && botUsername == null && active == null && onboardingStep == null;
    }
}
