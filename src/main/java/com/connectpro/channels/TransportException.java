package com.connectpro.channels;

public class TransportException extends RuntimeException {

    public enum Reason {
        UNREACHABLE,
        BLOCKED,
        RATE_LIMITED,
        INVALID_CREDENTIAL
    }

    private final Reason reason;
    private final int retryAfterSeconds;

    public TransportException(Reason reason, String message) {
        this(reason, message, 0, null);
    }

    public TransportException(Reason reason, String message, Throwable cause) {
        this(reason, message, 0, cause);
    }

    public TransportException(Reason reason, String message, int retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public Reason reason() {
        return reason;
    }

    public int retryAfterSeconds() {
        return retryAfterSeconds;
    }

    /** Maps a Bot API error code onto the delivery-layer taxonomy. */
    public static TransportException fromStatus(int code, Integer retryAfter, String message, Throwable cause) {
        var reason = switch (code) {
            case 401, 404 -> Reason.INVALID_CREDENTIAL;
            case 403 -> Reason.BLOCKED;
            case 429 -> Reason.RATE_LIMITED;
            default -> Reason.UNREACHABLE;
        };
        return new TransportException(reason, message, retryAfter != null ? retryAfter : 0, cause);
    }
}
