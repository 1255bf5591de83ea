package com.connectpro.tenants;

import com.connectpro.channels.FakeTransport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TenantRegistryTest {

    private final TenantRegistry registry = new TenantRegistry(Duration.ofMillis(200));

    private static TenantHandle handle(long ownerId, FakeTransport transport) {
        return new TenantHandle(ownerId, transport.credential, transport, Instant.now());
    }

    @Test
    void replaceStopsPreviousHandle() {
        var first = new FakeTransport("a");
        var second = new FakeTransport("b");
        registry.replace(1, () -> handle(1, first));
        registry.replace(1, () -> handle(1, second));

        assertTrue(first.closed());
        assertFalse(second.closed());
        assertEquals("b", registry.get(1).orElseThrow().credential());
        assertEquals(1, registry.size());
        assertEquals(TenantState.RUNNING, registry.state(1));
    }

    @Test
    void failedStarterLeavesTenantUnregistered() {
        assertThrows(IllegalStateException.class, () -> registry.replace(1, () -> {
            throw new IllegalStateException("no");
        }));
        assertEquals(TenantState.UNREGISTERED, registry.state(1));
        assertTrue(registry.get(1).isEmpty());
    }

    @Test
    void concurrentReplaceAndRemoveLeaveAtMostOneLiveTransport() throws Exception {
        var transports = new CopyOnWriteArrayList<FakeTransport>();
        var pool = Executors.newFixedThreadPool(8);
        var gate = new CountDownLatch(1);
        var futures = new ArrayList<Future<Void>>();
        try {
            for (int i = 0; i < 40; i++) {
                var credential = "c" + i;
                var removeAfter = i % 3 == 0;
                Callable<Void> task = () -> {
                    gate.await();
                    registry.replace(1, () -> {
                        var t = new FakeTransport(credential);
                        transports.add(t);
                        return handle(1, t);
                    });
                    if (removeAfter) registry.remove(1);
                    return null;
                };
                futures.add(pool.submit(task));
            }
            gate.countDown();
            for (var f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(40, transports.size());
        List<FakeTransport> open = transports.stream().filter(t -> !t.closed()).toList();
        assertTrue(open.size() <= 1);
        assertTrue(registry.size() <= 1);
        var live = registry.get(1);
        if (live.isPresent()) {
            assertEquals(1, open.size());
            assertSame(open.get(0), live.get().transport());
            assertEquals(TenantState.RUNNING, registry.state(1));
        } else {
            assertTrue(open.isEmpty());
            assertEquals(TenantState.UNREGISTERED, registry.state(1));
        }
        transports.forEach(t -> assertTrue(t.closes.get() <= 1));
    }

    @Test
    void removeIsIdempotent() {
        var transport = new FakeTransport("a");
        registry.replace(1, () -> handle(1, transport));

        assertTrue(registry.remove(1));
        assertFalse(registry.remove(1));
        assertEquals(1, transport.closes.get());
        assertEquals(TenantState.UNREGISTERED, registry.state(1));
    }

    @Test
    void removeAllStopsEveryTenant() {
        var a = new FakeTransport("a");
        var b = new FakeTransport("b");
        registry.replace(1, () -> handle(1, a));
        registry.replace(2, () -> handle(2, b));

        registry.removeAll();
        assertTrue(a.closed());
        assertTrue(b.closed());
        assertEquals(0, registry.size());
    }
}
