package com.connectpro.channels;

/**
 * One bot connection. {@link #open()} validates the credential and must succeed
 * before {@link #subscribe} starts the inbound stream.
 */
public interface Transport extends OutboundChannel {
    String id();

    void open();

    void subscribe(EventSink sink);

    void close();

    /** Public handle of the bot behind this transport, once opened. */
    default String botUsername() {
        return null;
    }
}
