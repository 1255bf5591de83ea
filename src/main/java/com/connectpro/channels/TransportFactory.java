package com.connectpro.channels;

@FunctionalInterface
public interface TransportFactory {
    Transport create(long tenantId, String credential);
}
