package com.connectpro.observability;

import com.connectpro.policy.RejectReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class RelayMetrics {

    private final MeterRegistry registry;

    public RelayMetrics() {
        this(new SimpleMeterRegistry());
    }

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Timer routeLatency() {
        return Timer.builder("connectpro.route.latency").register(registry);
    }

    public Counter delivered() {
        return Counter.builder("connectpro.route.delivered").register(registry);
    }

    public Counter rejected(RejectReason reason) {
        return Counter.builder("connectpro.route.rejected")
                .tag("reason", reason.name().toLowerCase())
                .register(registry);
    }

    public Counter deliveryFailed() {
        return Counter.builder("connectpro.route.failed").register(registry);
    }

    public Counter tenantsStarted() {
        return Counter.builder("connectpro.tenants.started").register(registry);
    }

    public Counter tenantsStopped() {
        return Counter.builder("connectpro.tenants.stopped").register(registry);
    }

    public void bindLiveTenants(Supplier<Number> live) {
        Gauge.builder("connectpro.tenants.live", live).register(registry);
    }
}
