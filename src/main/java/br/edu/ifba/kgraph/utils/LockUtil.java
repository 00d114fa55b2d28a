package br.edu.ifba.kgraph.utils;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collection;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keyed lock pool for graph mutations.
 * Keys are chunk ids and entity canonical ids; a mutation locks every key it touches.
 * Locks are always taken in sorted key order so overlapping mutations cannot deadlock.
 *
 * <p>A pooled lock is reference counted and leaves the pool when its last user releases
 * it, so the pool only holds keys that are currently locked or waited on.</p>
 */
public final class LockUtil {

    private static final ConcurrentHashMap<String, PooledLock> LOCK_POOL = new ConcurrentHashMap<>();

    private LockUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Acquires locks for multiple keys in sorted order.
     * Duplicate keys are locked once.
     *
     * @param keys Keys to lock
     * @return Array of acquired locks in sorted key order
     */
    @NotNull
    public static ReentrantLock[] acquireLocksInOrder(@NotNull Collection<String> keys) {
        TreeSet<String> sortedKeys = new TreeSet<>(keys);

        ReentrantLock[] locks = new ReentrantLock[sortedKeys.size()];
        int i = 0;
        try {
            for (String key : sortedKeys) {
                PooledLock lock = checkOut(key);
                locks[i++] = lock;
                lock.lock();
            }
        } catch (RuntimeException e) {
            ReentrantLock last = i > 0 ? locks[i - 1] : null;
            if (last instanceof PooledLock pooled && !pooled.isHeldByCurrentThread()) {
                locks[i - 1] = null;
                checkIn(pooled);
            }
            releaseLocks(locks);
            throw e;
        }
        return locks;
    }

    /**
     * Varargs form of {@link #acquireLocksInOrder(Collection)}.
     */
    @NotNull
    public static ReentrantLock[] acquireLocksInOrder(@NotNull String... keys) {
        return acquireLocksInOrder(Arrays.asList(keys));
    }

    /**
     * Releases an array of locks in reverse acquisition order.
     * Locks not held by the calling thread are skipped, so releasing twice is harmless.
     *
     * @param locks Locks to release
     */
    public static void releaseLocks(@NotNull ReentrantLock... locks) {
        for (int i = locks.length - 1; i >= 0; i--) {
            ReentrantLock lock = locks[i];
            if (lock == null) {
                continue;
            }
            if (!lock.isHeldByCurrentThread()) {
                continue;
            }
            lock.unlock();
            if (lock instanceof PooledLock pooled) {
                checkIn(pooled);
            }
        }
    }

    /**
     * Number of keys currently in the pool.
     */
    public static int poolSize() {
        return LOCK_POOL.size();
    }

    private static PooledLock checkOut(String key) {
        return LOCK_POOL.compute(key, (k, existing) -> {
            PooledLock lock = existing != null ? existing : new PooledLock(k);
            lock.users++;
            return lock;
        });
    }

    private static void checkIn(PooledLock lock) {
        LOCK_POOL.computeIfPresent(lock.key, (k, current) -> {
            if (current != lock) {
                return current;
            }
            current.users--;
            return current.users == 0 ? null : current;
        });
    }

    /**
     * Fair lock with a user count guarded by the pool's per-key compute.
     */
    private static final class PooledLock extends ReentrantLock {
        private final String key;
        private int users;

        private PooledLock(String key) {
            super(true);
            this.key = key;
        }
    }
}
