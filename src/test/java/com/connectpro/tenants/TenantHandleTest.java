package com.connectpro.tenants;

import com.connectpro.channels.FakeTransport;
import com.connectpro.channels.TransportException;
import com.connectpro.shared.model.OutboundMessage;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TenantHandleTest {

    static class BlockingTransport extends FakeTransport {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        BlockingTransport() {
            super("slow");
        }

        @Override
        public long send(OutboundMessage msg) {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return super.send(msg);
        }
    }

    @Test
    void stopWaitsForInFlightSend() throws Exception {
        var transport = new BlockingTransport();
        var handle = new TenantHandle(1, "slow", transport, Instant.now());

        var send = CompletableFuture.supplyAsync(() -> handle.send(new OutboundMessage(9, "hi")));
        assertTrue(transport.entered.await(5, TimeUnit.SECONDS));
        var stop = CompletableFuture.runAsync(() -> handle.stop(Duration.ofSeconds(5)));

        Thread.sleep(100);
        assertFalse(transport.closed());
        transport.release.countDown();

        send.get(5, TimeUnit.SECONDS);
        stop.get(5, TimeUnit.SECONDS);
        assertTrue(transport.closed());
        assertEquals(1, transport.sent.size());
    }

    @Test
    void sendAfterStopIsUnreachable() {
        var transport = new FakeTransport("a");
        var handle = new TenantHandle(1, "a", transport, Instant.now());
        handle.stop(Duration.ofMillis(100));

        var ex = assertThrows(TransportException.class, () -> handle.send(new OutboundMessage(9, "hi")));
        assertEquals(TransportException.Reason.UNREACHABLE, ex.reason());
        assertFalse(handle.isLive());
    }

    @Test
    void stopIsIdempotent() {
        var transport = new FakeTransport("a");
        var handle = new TenantHandle(1, "a", transport, Instant.now());
        handle.stop(Duration.ofMillis(100));
        handle.stop(Duration.ofMillis(100));
        assertEquals(1, transport.closes.get());
    }
}
