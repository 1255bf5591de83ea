package com.connectpro.tenants;

import com.connectpro.channels.BoundedChannel;
import com.connectpro.channels.EventSink;
import com.connectpro.channels.OutboundChannel;
import com.connectpro.channels.TransportException;
import com.connectpro.channels.TransportFactory;
import com.connectpro.observability.RelayMetrics;
import com.connectpro.policy.PolicyEngine;
import com.connectpro.resilience.BoundedCall;
import com.connectpro.resilience.ResilientCall;
import com.connectpro.shared.model.Owner;
import com.connectpro.shared.model.OwnerMode;
import com.connectpro.shared.model.OwnerUpdate;
import com.connectpro.shared.model.OutboundMessage;
import com.connectpro.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Starts and stops tenants' dedicated bots. Every registry mutation goes through
 * {@link TenantRegistry}, so registration, the trial sweep and admin actions can
 * run concurrently.
 */
public class TenantOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TenantOrchestrator.class);
    private static final int OPEN_RETRIES = 2;
    private static final long OPEN_BACKOFF_MS = 500;

    private final RecordStore store;
    private final TenantRegistry registry;
    private final TransportFactory transports;
    private final EventSink sink;
    private final PolicyEngine policy;
    private final OutboundChannel frontDoor;
    private final ExecutorService io;
    private final Duration openTimeout;
    private final Clock clock;
    private final RelayMetrics metrics;
    // owner id -> days-remaining value last warned about
    private final Map<Long, Long> warned = new ConcurrentHashMap<>();

    public TenantOrchestrator(RecordStore store, TenantRegistry registry, TransportFactory transports,
                              EventSink sink, PolicyEngine policy, OutboundChannel frontDoor,
                              ExecutorService io, Duration openTimeout, Clock clock, RelayMetrics metrics) {
        this.store = store;
        this.registry = registry;
        this.transports = transports;
        this.sink = sink;
        this.policy = policy;
        this.frontDoor = frontDoor;
        this.io = io;
        this.openTimeout = openTimeout;
        this.clock = clock;
        this.metrics = metrics;
        metrics.bindLiveTenants(registry::size);
    }

    public TenantRegistry registry() {
        return registry;
    }

    /**
     * Opens a dedicated bot for the tenant, replacing any running one.
     *
     * @throws TransportException when the credential is rejected or the bot API stays unreachable
     */
    public TenantHandle register(long ownerId, String credential) {
        var handle = registry.replace(ownerId, () -> start(ownerId, credential));
        metrics.tenantsStarted().increment();
        log.info("Tenant {} running on {}", ownerId, handle.transport().id());
        return handle;
    }

    private TenantHandle start(long ownerId, String credential) {
        var transport = transports.create(ownerId, credential);
        try {
            ResilientCall.execute(() -> {
                openBounded(transport::open);
                return null;
            }, OPEN_RETRIES, OPEN_BACKOFF_MS);
            transport.subscribe(sink);
        } catch (RuntimeException e) {
            transport.close();
            if (e instanceof TransportException te) throw te;
            throw new TransportException(TransportException.Reason.UNREACHABLE,
                    "Failed to open dedicated bot for tenant " + ownerId, e);
        }
        return new TenantHandle(ownerId, credential, transport, clock.instant());
    }

    private void openBounded(Runnable open) {
        try {
            BoundedCall.run(io, open, openTimeout);
        } catch (TimeoutException e) {
            throw new TransportException(TransportException.Reason.UNREACHABLE,
                    "Opening transport exceeded " + openTimeout.toMillis() + "ms", e);
        }
    }

    /** Idempotent: returns {@code false} when nothing was running. */
    public boolean deregister(long ownerId) {
        var removed = registry.remove(ownerId);
        if (removed) {
            metrics.tenantsStopped().increment();
            log.info("Tenant {} stopped", ownerId);
        }
        return removed;
    }

    /** Bootstrap: registers every eligible tenant; one failure never stops the batch. */
    public StartAllReport startAll() {
        int started = 0, failed = 0, skipped = 0;
        var now = clock.instant();
        for (var owner : store.listActiveDedicatedOwners()) {
            try {
                if (policy.isTrialOver(owner, now)) {
                    store.markTrialExpired(owner.id());
                    log.info("Skipping tenant {}: trial ended {}", owner.id(), policy.trialEnd(owner));
                    skipped++;
                    continue;
                }
                register(owner.id(), owner.credential());
                started++;
            } catch (Exception e) {
                failed++;
                log.warn("Failed to start dedicated bot for tenant {}: {}", owner.id(), e.getMessage());
            }
        }
        log.info("Dedicated bots started: {} ok, {} failed, {} skipped", started, failed, skipped);
        return new StartAllReport(started, failed, skipped);
    }

    /**
     * Expires trials that ran out, stopping their bots, and warns owners whose trial
     * is about to end.
     */
    public TrialSweepReport checkTrials() {
        int checked = 0, expired = 0, active = 0, warnings = 0;
        var now = clock.instant();
        for (var owner : store.listOwners()) {
            if (owner.mode() != OwnerMode.DEDICATED_CHANNEL) continue;
            checked++;
            try {
                if (owner.trialExpired() || policy.isTrialOver(owner, now)) {
                    expired++;
                    if (!owner.trialExpired() && store.markTrialExpired(owner.id())) {
                        log.info("Trial expired for tenant {}", owner.id());
                    }
                    deregister(owner.id());
                    warned.remove(owner.id());
                    continue;
                }
                active++;
                if (warnIfExpiring(owner, policy.daysRemaining(owner, now))) warnings++;
            } catch (Exception e) {
                log.warn("Trial check failed for tenant {}: {}", owner.id(), e.getMessage());
            }
        }
        log.info("Trial sweep: {} checked, {} expired, {} active, {} warned", checked, expired, active, warnings);
        return new TrialSweepReport(checked, expired, active, warnings);
    }

    private boolean warnIfExpiring(Owner owner, long daysRemaining) {
        if (!policy.config().trialWarningDays().contains((int) daysRemaining)) return false;
        var previous = warned.put(owner.id(), daysRemaining);
        if (previous != null && previous == daysRemaining) return false;
        var text = daysRemaining <= 1
                ? "🚨 Last Day of Trial!\n\nYour free trial ends tomorrow.\n\n"
                  + "After expiration, your bot will be paused.\nSubscription options coming soon!"
                : "⚠️ Trial Expiring Soon!\n\nYour free trial ends in " + daysRemaining + " days.\n\n"
                  + "Subscription options coming soon!";
        try {
            new BoundedChannel(outboundFor(owner.id()), io, openTimeout).send(new OutboundMessage(owner.id(), text));
            return true;
        } catch (TransportException e) {
            warned.remove(owner.id());
            log.warn("Failed to warn tenant {} about trial end: {}", owner.id(), e.reason());
            return false;
        }
    }

    private OutboundChannel outboundFor(long ownerId) {
        return registry.get(ownerId).<OutboundChannel>map(h -> h).orElse(frontDoor);
    }

    /** Admin pause: soft-deactivates the owner and stops any dedicated bot. */
    public void pause(long ownerId) {
        store.updateOwner(ownerId, OwnerUpdate.active(false))
                .orElseThrow(() -> new IllegalArgumentException("Unknown owner: " + ownerId));
        deregister(ownerId);
    }

    /** Reactivates the owner; restarts the dedicated bot when still eligible. */
    public void resume(long ownerId) {
        var owner = store.updateOwner(ownerId, OwnerUpdate.active(true))
                .orElseThrow(() -> new IllegalArgumentException("Unknown owner: " + ownerId));
        if (owner.eligibleForDedicated() && !policy.isTrialOver(owner, clock.instant())) {
            register(ownerId, owner.credential());
        }
    }

    /**
     * Onboarding token step. The bot is opened first; the credential is persisted
     * only once it is known to work.
     */
    public Owner provisionDedicated(long ownerId, String credential) {
        var owner = store.getOwner(ownerId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown owner: " + ownerId));
        if (owner.trialExpired()) {
            throw new IllegalStateException("Trial already expired for owner " + ownerId);
        }
        var handle = register(ownerId, credential);
        try {
            return store.updateOwner(ownerId, OwnerUpdate.dedicated(credential, handle.transport().botUsername()))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown owner: " + ownerId));
        } catch (RuntimeException e) {
            deregister(ownerId);
            throw e;
        }
    }

    public void shutdown() {
        registry.removeAll();
        log.info("All dedicated bots stopped");
    }
}
