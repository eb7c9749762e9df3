package com.marketsync.common;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process single-writer-per-key guards.
 * <ul>
 *   <li>{@link #withLock} blocks: used to serialize short writes (bucket rebuilds).</li>
 *   <li>{@link #tryClaimAll} never blocks and is not bound to a thread: used for run-level ownership
 *       that is released from whichever thread finishes the run.</li>
 * </ul>
 */
public class KeyedLocks {

    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
    private final Set<String> claims = ConcurrentHashMap.newKeySet();

    /** A lock plus the number of threads holding or waiting for it; the count only changes inside compute. */
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    /**
     * Runs {@code action} while holding the lock for {@code key}. The key's entry is dropped once no thread holds or
     * waits for it.
     */
    public <T> T withLock(String key, Supplier<T> action) {
        KeyLock keyLock = locks.compute(key, (k, existing) -> {
            KeyLock l = existing != null ? existing : new KeyLock();
            l.users++;
            return l;
        });
        keyLock.lock.lock();
        try {
            return action.get();
        } finally {
            keyLock.lock.unlock();
            locks.computeIfPresent(key, (k, l) -> --l.users == 0 ? null : l);
        }
    }

    int lockedKeyCount() {
        return locks.size();
    }

    /**
     * Claims every key or none. Returns false when any key is already claimed.
     */
    public boolean tryClaimAll(Collection<String> keys) {
        List<String> claimed = new ArrayList<>();
        for (String key : new TreeSet<>(keys)) {
            if (!claims.add(key)) {
                claims.removeAll(claimed);
                return false;
            }
            claimed.add(key);
        }
        return true;
    }

    public void releaseAll(Collection<String> keys) {
        claims.removeAll(keys);
    }

    public boolean isClaimed(String key) {
        return claims.contains(key);
    }
}
