package com.connectpro.routing;

import com.connectpro.channels.TransportException;
import com.connectpro.policy.RejectReason;

/**
 * Terminal result of routing one message. {@code conversationId} and
 * {@code messageId} are set whenever the message was persisted, including
 * failed deliveries.
 */
public record RouteOutcome(
    Status status,
    RejectReason reason,
    TransportException.Reason failure,
    Long conversationId,
    Long messageId
) {
    public enum Status {
        DELIVERED,
        REJECTED,
        DELIVERY_FAILED
    }

    public static RouteOutcome delivered(long conversationId, long messageId) {
        return new RouteOutcome(Status.DELIVERED, null, null, conversationId, messageId);
    }

    public static RouteOutcome rejected(RejectReason reason) {
        return new RouteOutcome(Status.REJECTED, reason, null, null, null);
    }

    public static RouteOutcome deliveryFailed(TransportException.Reason failure, long conversationId, long messageId) {
        return new RouteOutcome(Status.DELIVERY_FAILED, null, failure, conversationId, messageId);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
