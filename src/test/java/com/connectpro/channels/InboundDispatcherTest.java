package com.connectpro.channels;

import com.connectpro.shared.model.InboundEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InboundDispatcherTest {

    private static InboundEvent event(long sender, Long tenant, long messageId) {
        return new InboundEvent(tenant == null ? InboundEvent.Origin.FRONT_DOOR : InboundEvent.Origin.DEDICATED,
                tenant, sender, "u" + sender, "User", sender, "hi " + messageId, messageId, null, Instant.now());
    }

    @Test
    void sameSenderAlwaysLandsOnSameLane() {
        var a = InboundDispatcher.laneOf(event(42, 7L, 1), 8);
        var b = InboundDispatcher.laneOf(event(42, 7L, 2), 8);
        assertEquals(a, b);
        assertTrue(a >= 0 && a < 8);
    }

    @Test
    void preservesPerSenderOrder() throws Exception {
        Map<Long, List<Long>> seen = new ConcurrentHashMap<>();
        var done = new CountDownLatch(300);
        try (var dispatcher = new InboundDispatcher(4)) {
            dispatcher.start(e -> {
                seen.computeIfAbsent(e.senderId(), k -> new ArrayList<>()).add(e.messageId());
                done.countDown();
            });
            for (long i = 0; i < 100; i++) {
                for (long sender = 1; sender <= 3; sender++) {
                    dispatcher.accept(event(sender, null, i));
                }
            }
            assertTrue(done.await(5, TimeUnit.SECONDS));
        }
        for (long sender = 1; sender <= 3; sender++) {
            var ids = seen.get(sender);
            assertEquals(100, ids.size());
            for (int i = 0; i < ids.size(); i++) {
                assertEquals(i, ids.get(i));
            }
        }
    }

    @Test
    void handlerFailureDoesNotStopTheLane() throws Exception {
        var done = new CountDownLatch(1);
        try (var dispatcher = new InboundDispatcher(1)) {
            dispatcher.start(e -> {
                if (e.messageId() == 1) throw new IllegalStateException("boom");
                done.countDown();
            });
            dispatcher.accept(event(5, null, 1));
            dispatcher.accept(event(5, null, 2));
            assertTrue(done.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void dropsEventsBeforeStart() {
        try (var dispatcher = new InboundDispatcher(2)) {
            assertDoesNotThrow(() -> dispatcher.accept(event(1, null, 1)));
        }
    }
}
