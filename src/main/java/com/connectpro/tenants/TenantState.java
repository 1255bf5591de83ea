package com.connectpro.tenants;

/**
 * Lifecycle of a tenant's dedicated bot. There is no crashed state: losing a
 * handle returns the tenant to {@link #UNREGISTERED}.
 */
public enum TenantState {
    UNREGISTERED,
    STARTING,
    RUNNING,
    STOPPING
}
