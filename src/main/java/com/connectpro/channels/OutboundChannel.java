package com.connectpro.channels;

import com.connectpro.shared.model.OutboundMessage;

@FunctionalInterface
public interface OutboundChannel {
    /** Returns the transport message id of the (first) delivered message. */
    long send(OutboundMessage msg);
}
