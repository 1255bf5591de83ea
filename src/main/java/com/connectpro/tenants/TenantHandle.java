package com.connectpro.tenants;

import com.connectpro.channels.OutboundChannel;
import com.connectpro.channels.Transport;
import com.connectpro.channels.TransportException;
import com.connectpro.shared.model.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runtime reference to one tenant's open transport. Sends share the read lock;
 * {@link #stop} takes the write lock, so it waits for sends already in flight
 * before closing. Callers holding the handle after stop get
 * {@link TransportException.Reason#UNREACHABLE}.
 */
public class TenantHandle implements OutboundChannel {

    private static final Logger log = LoggerFactory.getLogger(TenantHandle.class);

    private final long ownerId;
    private final String credential;
    private final Transport transport;
    private final Instant startedAt;
    private final ReentrantReadWriteLock inFlight = new ReentrantReadWriteLock();
    private volatile boolean stopped;

    public TenantHandle(long ownerId, String credential, Transport transport, Instant startedAt) {
        this.ownerId = ownerId;
        this.credential = credential;
        this.transport = transport;
        this.startedAt = startedAt;
    }

    public long ownerId() { return ownerId; }

    public String credential() { return credential; }

    public Transport transport() { return transport; }

    public Instant startedAt() { return startedAt; }

    public boolean isLive() { return !stopped; }

    @Override
    public long send(OutboundMessage msg) {
        var lock = inFlight.readLock();
        lock.lock();
        try {
            if (stopped) {
                throw new TransportException(TransportException.Reason.UNREACHABLE,
                        "Dedicated bot for tenant " + ownerId + " is stopped");
            }
            return transport.send(msg);
        } finally {
            lock.unlock();
        }
    }

    /** Stops accepting sends, drains in-flight ones for up to {@code drain}, then closes. Idempotent. */
    public void stop(Duration drain) {
        if (stopped) return;
        stopped = true;
        var lock = inFlight.writeLock();
        boolean drained = false;
        try {
            drained = lock.tryLock(drain.toMillis(), TimeUnit.MILLISECONDS);
            if (!drained) {
                log.warn("Tenant {} still had sends in flight after {}ms, closing anyway", ownerId, drain.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            try {
                transport.close();
            } finally {
                if (drained) lock.unlock();
            }
        }
    }
}
