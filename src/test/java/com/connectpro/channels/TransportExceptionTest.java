package com.connectpro.channels;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransportExceptionTest {

    @Test
    void mapsBotApiCodes() {
        assertEquals(TransportException.Reason.INVALID_CREDENTIAL,
                TransportException.fromStatus(401, null, "unauthorized", null).reason());
        assertEquals(TransportException.Reason.INVALID_CREDENTIAL,
                TransportException.fromStatus(404, null, "not found", null).reason());
        assertEquals(TransportException.Reason.BLOCKED,
                TransportException.fromStatus(403, null, "bot was blocked by the user", null).reason());
        assertEquals(TransportException.Reason.UNREACHABLE,
                TransportException.fromStatus(502, null, "bad gateway", null).reason());
    }

    @Test
    void rateLimitCarriesRetryAfter() {
        var e = TransportException.fromStatus(429, 7, "too many requests", null);
        assertEquals(TransportException.Reason.RATE_LIMITED, e.reason());
        assertEquals(7, e.retryAfterSeconds());
    }
}
