package com.connectpro.shared.model;

/**
 * How a tenant is reached: through the shared front-door bot or through a bot
 * opened with the tenant's own credential.
 */
public enum OwnerMode {
    SHARED_FRONT_DOOR,
    DEDICATED_CHANNEL
}
