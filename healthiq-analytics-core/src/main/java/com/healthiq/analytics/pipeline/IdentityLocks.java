package com.healthiq.analytics.pipeline;

import com.google.common.util.concurrent.Striped;

import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Per-identity locking over a fixed set of lazily created, weakly held stripes. Work for the same
 * identity is serialized; locks for idle identities are reclaimed.
 */
public class IdentityLocks {

    static final int DEFAULT_STRIPES = 64;

    private final Striped<Lock> stripes;

    public IdentityLocks() {
        this(DEFAULT_STRIPES);
    }

    public IdentityLocks(int stripes) {
        this.stripes = Striped.lazyWeakLock(stripes);
    }

    public <T> T withLock(String identity, Supplier<T> work) {
        Lock lock = stripes.get(identity);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
