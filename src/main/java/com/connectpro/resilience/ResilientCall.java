package com.connectpro.resilience;

import com.connectpro.channels.TransportException;

import java.util.concurrent.Callable;

/**
 * Retries transport calls with exponential backoff. Credential and blocked-chat
 * failures are final; rate limits wait at least the server's retry-after.
 */
public class ResilientCall {

    private static final int MAX_RETRIES = 2;
    private static final long INITIAL_DELAY_MS = 500;
    private static final long MAX_BACKOFF_MS = 10_000;
    private static final long RETRY_AFTER_CAP_MS = 30_000;

    public static <T> T execute(Callable<T> action) {
        return execute(action, MAX_RETRIES, INITIAL_DELAY_MS);
    }

    public static <T> T execute(Callable<T> action, int maxRetries, long baseDelayMs) {
        RuntimeException last = null;
        long delay = baseDelayMs;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return action.call();
            } catch (RuntimeException e) {
                last = e;
                if (isNonRetryable(e)) throw e;
                if (attempt < maxRetries) {
                    long wait = isRateLimited(e)
                            ? Math.max(delay, retryAfterMs(e))
                            : delay;
                    sleep(wait);
                    delay = Math.min(delay * 2, MAX_BACKOFF_MS);
                }
            } catch (Exception e) {
                last = new RuntimeException(e);
                if (attempt < maxRetries) {
                    sleep(delay);
                    delay = Math.min(delay * 2, MAX_BACKOFF_MS);
                }
            }
        }
        throw last;
    }

    static boolean isNonRetryable(Exception e) {
        return e instanceof TransportException te
                && (te.reason() == TransportException.Reason.INVALID_CREDENTIAL
                    || te.reason() == TransportException.Reason.BLOCKED);
    }

    static boolean isRateLimited(Exception e) {
        return e instanceof TransportException te && te.reason() == TransportException.Reason.RATE_LIMITED;
    }

    static long retryAfterMs(Exception e) {
        if (e instanceof TransportException te && te.retryAfterSeconds() > 0) {
            return Math.min(te.retryAfterSeconds() * 1000L, RETRY_AFTER_CAP_MS);
        }
        return 0;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted during retry", ie);
        }
    }
}
