package org.carball.pivot.cache;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per content hash. Locks are reference counted and dropped from the table
 * once no thread holds or waits for them.
 */
public class HashLockTable {

    private final ConcurrentHashMap<String, LockHolder> locks = new ConcurrentHashMap<>();

    public Handle acquire(String hash) {
        LockHolder holder = locks.compute(hash, (key, existing) -> {
            LockHolder current = existing != null ? existing : new LockHolder();
            current.references++;
            return current;
        });
        holder.lock.lock();
        return new Handle(hash, holder);
    }

    /**
     * Number of hashes with a live lock. Zero once every handle is closed.
     */
    public int size() {
        return locks.size();
    }

    private void release(String hash, LockHolder holder) {
        holder.lock.unlock();
        locks.computeIfPresent(hash, (key, existing) -> {
            existing.references--;
            return existing.references == 0 ? null : existing;
        });
    }

    private static final class LockHolder {
        private final ReentrantLock lock = new ReentrantLock();
        // Guarded by the map's compute for this key
        private int references;
    }

    public final class Handle implements AutoCloseable {

        private final String hash;
        private final LockHolder holder;
        private boolean released;

        private Handle(String hash, LockHolder holder) {
            this.hash = hash;
            this.holder = holder;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                release(hash, holder);
            }
        }
    }
}
