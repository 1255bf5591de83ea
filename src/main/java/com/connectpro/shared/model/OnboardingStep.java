package com.connectpro.shared.model;

public enum OnboardingStep {
    NAME,
    CATEGORY,
    BIO,
    LOGO,
    TOKEN,
    DONE;

    public boolean reached(OnboardingStep other) {
        return ordinal() >= other.ordinal();
    }
}
