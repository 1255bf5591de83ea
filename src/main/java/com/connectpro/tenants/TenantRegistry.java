package com.connectpro.tenants;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Tenant id to live dedicated-bot handle. All mutations for one tenant run under
 * that tenant's lock; different tenants never contend. Reads are lock-free.
 */
public class TenantRegistry {

    private static final Logger log = LoggerFactory.getLogger(TenantRegistry.class);

    private final Map<Long, TenantHandle> handles = new ConcurrentHashMap<>();
    private final Map<Long, TenantState> states = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration drainTimeout;

    public TenantRegistry(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Optional<TenantHandle> get(long ownerId) {
        return Optional.ofNullable(handles.get(ownerId));
    }

    public TenantState state(long ownerId) {
        return states.getOrDefault(ownerId, TenantState.UNREGISTERED);
    }

    public Set<Long> liveTenants() {
        return Set.copyOf(handles.keySet());
    }

    public int size() {
        return handles.size();
    }

    /**
     * Stops any existing handle, then inserts the one produced by {@code starter}.
     * If the starter throws, the tenant is left unregistered and the failure
     * propagates.
     */
    public TenantHandle replace(long ownerId, Supplier<TenantHandle> starter) {
        var lock = lockFor(ownerId);
        lock.lock();
        try {
            stopExisting(ownerId);
            states.put(ownerId, TenantState.STARTING);
            TenantHandle handle;
            try {
                handle = starter.get();
            } catch (RuntimeException e) {
                states.remove(ownerId);
                throw e;
            }
            handles.put(ownerId, handle);
            states.put(ownerId, TenantState.RUNNING);
            return handle;
        } finally {
            lock.unlock();
        }
    }

    /** Returns {@code false} when the tenant had no handle. */
    public boolean remove(long ownerId) {
        var lock = lockFor(ownerId);
        lock.lock();
        try {
            return stopExisting(ownerId);
        } finally {
            lock.unlock();
        }
    }

    public void removeAll() {
        for (var ownerId : liveTenants()) {
            try {
                remove(ownerId);
            } catch (RuntimeException e) {
                log.error("Failed to stop tenant {}", ownerId, e);
            }
        }
    }

    private boolean stopExisting(long ownerId) {
        var existing = handles.get(ownerId);
        if (existing == null) return false;
        states.put(ownerId, TenantState.STOPPING);
        try {
            existing.stop(drainTimeout);
        } finally {
            handles.remove(ownerId);
            states.remove(ownerId);
        }
        return true;
    }

    private ReentrantLock lockFor(long ownerId) {
        return locks.computeIfAbsent(ownerId, k -> new ReentrantLock());
    }
}
