package com.connectpro.channels;

import com.connectpro.shared.model.InboundEvent;

@FunctionalInterface
public interface EventSink {
    void accept(InboundEvent event);
}
