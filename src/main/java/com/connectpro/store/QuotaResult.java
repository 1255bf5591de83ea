package com.connectpro.store;

public enum QuotaResult {
    ALLOWED,
    DENIED
}
