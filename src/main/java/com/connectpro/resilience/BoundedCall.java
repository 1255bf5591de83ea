package com.connectpro.resilience;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking call on an executor and gives up after a deadline. The worker is
 * interrupted on timeout; unchecked failures of the call are rethrown as-is.
 */
public class BoundedCall {

    public static <T> T execute(ExecutorService executor, Callable<T> action, Duration timeout)
            throws TimeoutException {
        Future<T> future = executor.submit(action);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new RuntimeException("Bounded call failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for bounded call", e);
        }
    }

    public static void run(ExecutorService executor, Runnable action, Duration timeout) throws TimeoutException {
        execute(executor, () -> {
            action.run();
            return null;
        }, timeout);
    }
}
