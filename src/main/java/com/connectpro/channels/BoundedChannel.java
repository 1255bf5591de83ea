package com.connectpro.channels;

import com.connectpro.resilience.BoundedCall;
import com.connectpro.shared.model.OutboundMessage;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every send of the wrapped channel. A send that overruns is cancelled and
 * reported as {@link TransportException.Reason#UNREACHABLE}.
 */
public class BoundedChannel implements OutboundChannel {

    private final OutboundChannel delegate;
    private final ExecutorService io;
    private final Duration timeout;

    public BoundedChannel(OutboundChannel delegate, ExecutorService io, Duration timeout) {
        this.delegate = delegate;
        this.io = io;
        this.timeout = timeout;
    }

    @Override
    public long send(OutboundMessage msg) {
        try {
            return BoundedCall.execute(io, () -> delegate.send(msg), timeout);
        } catch (TimeoutException e) {
            throw new TransportException(TransportException.Reason.UNREACHABLE,
                    "Send to " + msg.chatId() + " exceeded " + timeout.toMillis() + "ms", e);
        }
    }
}
