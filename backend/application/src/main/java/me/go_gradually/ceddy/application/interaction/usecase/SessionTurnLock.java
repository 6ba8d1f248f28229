package me.go_gradually.ceddy.application.interaction.usecase;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes turns that share a session key. Keys are hashed onto a fixed set of lock
 * stripes, so unrelated sessions may occasionally wait on each other.
 */
public class SessionTurnLock {
    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;
    private final boolean enabled;

    public SessionTurnLock(boolean enabled) {
        this(enabled, DEFAULT_STRIPES);
    }

    SessionTurnLock(boolean enabled, int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        this.enabled = enabled;
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String sessionKey, Supplier<T> work) {
        if (!enabled || sessionKey == null) {
            return work.get();
        }
        ReentrantLock lock = stripeFor(sessionKey);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stripeFor(String sessionKey) {
        return stripes[Math.floorMod(sessionKey.hashCode(), stripes.length)];
    }
}
