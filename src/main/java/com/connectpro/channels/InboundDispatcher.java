package com.connectpro.channels;

import com.connectpro.shared.model.InboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Shared inbound channel for every bot. Events are partitioned onto single-thread
 * lanes by (sender, tenant), so one sender's events are handled in arrival order
 * while different senders proceed in parallel.
 */
public class InboundDispatcher implements EventSink, Closeable {

    private static final Logger log = LoggerFactory.getLogger(InboundDispatcher.class);

    private final List<ExecutorService> lanes;
    private volatile Consumer<InboundEvent> handler;

    public InboundDispatcher(int laneCount) {
        if (laneCount < 1) throw new IllegalArgumentException("laneCount must be >= 1");
        var lanes = new ArrayList<ExecutorService>(laneCount);
        for (int i = 0; i < laneCount; i++) {
            lanes.add(Executors.newSingleThreadExecutor(new CustomizableThreadFactory("inbound-lane-" + i + "-")));
        }
        this.lanes = List.copyOf(lanes);
    }

    public void start(Consumer<InboundEvent> handler) {
        this.handler = handler;
    }

    @Override
    public void accept(InboundEvent event) {
        if (handler == null) {
            log.warn("Dispatcher not started, dropping event {} from {}", event.messageId(), event.senderId());
            return;
        }
        var lane = lanes.get(laneOf(event, lanes.size()));
        try {
            lane.execute(() -> handle(event));
        } catch (RejectedExecutionException e) {
            log.warn("Dispatcher closed, dropping event {} from {}", event.messageId(), event.senderId());
        }
    }

    private void handle(InboundEvent event) {
        try {
            handler.accept(event);
        } catch (Exception e) {
            log.error("Inbound handling failed for event {} from {}", event.messageId(), event.senderId(), e);
        }
    }

    static int laneOf(InboundEvent event, int laneCount) {
        long tenant = event.tenantId() == null ? 0L : event.tenantId();
        int hash = 31 * Long.hashCode(event.senderId()) + Long.hashCode(tenant);
        return Math.floorMod(hash, laneCount);
    }

    @Override
    public void close() {
        lanes.forEach(ExecutorService::shutdown);
        for (var lane : lanes) {
            try {
                if (!lane.awaitTermination(5, TimeUnit.SECONDS)) {
                    lane.shutdownNow();
                }
            } catch (InterruptedException e) {
                lane.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
