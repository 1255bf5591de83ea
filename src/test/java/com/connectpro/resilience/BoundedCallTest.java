package com.connectpro.resilience;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class BoundedCallTest {

    private final java.util.concurrent.ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void returnsResultWithinDeadline() throws Exception {
        assertEquals(42, BoundedCall.execute(executor, () -> 42, Duration.ofSeconds(1)));
    }

    @Test
    void timesOutSlowCall() {
        assertThrows(TimeoutException.class, () -> BoundedCall.execute(executor, () -> {
            Thread.sleep(2_000);
            return 1;
        }, Duration.ofMillis(50)));
    }

    @Test
    void rethrowsUncheckedFailureAsIs() {
        var ex = assertThrows(IllegalStateException.class, () -> BoundedCall.execute(executor, () -> {
            throw new IllegalStateException("broken");
        }, Duration.ofSeconds(1)));
        assertEquals("broken", ex.getMessage());
    }
}
