package com.connectpro.routing;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped fair locks keyed by (user, owner). Fairness keeps waiting messages of one
 * pair in arrival order; unrelated pairs only collide when they share a stripe.
 */
class PairLocks {

    private final ReentrantLock[] stripes;

    PairLocks(int stripeCount) {
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
    }

    ReentrantLock lockFor(long userId, long ownerId) {
        int hash = 31 * Long.hashCode(userId) + Long.hashCode(ownerId);
        return stripes[Math.floorMod(hash, stripes.length)];
    }
}
