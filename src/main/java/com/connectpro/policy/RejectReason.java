package com.connectpro.policy;

public enum RejectReason {
    OWNER_NOT_FOUND,
    OWNER_INACTIVE,
    TRIAL_EXPIRED,
    OUTSIDE_ACTIVE_WINDOW,
    DAILY_LIMIT_REACHED,
    CONVERSATION_NOT_FOUND,
    STORE_TIMEOUT,
    STORE_FAILURE
}
