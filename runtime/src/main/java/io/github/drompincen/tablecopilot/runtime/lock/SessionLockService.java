package io.github.drompincen.tablecopilot.runtime.lock;

import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per session id, so callers that address the same session from
 * different connections append to its history in arrival order. A lock is
 * dropped by {@link #release(String)} once its session is removed and nobody
 * holds or waits on it.
 */
@Service
public class SessionLockService {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        ReentrantLock lock = acquire(sessionId);
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** @return true if the lock was dropped, false if it is missing or in use */
    public boolean release(String sessionId) {
        boolean[] dropped = {false};
        locks.computeIfPresent(sessionId, (id, lock) -> {
            if (lock.isLocked() || lock.hasQueuedThreads()) return lock;
            dropped[0] = true;
            return null;
        });
        return dropped[0];
    }

    public int size() {
        return locks.size();
    }

    public boolean isLocked(String sessionId) {
        ReentrantLock lock = locks.get(sessionId);
        return lock != null && lock.isLocked();
    }

    // A lock dropped between lookup and lock() is stale; retry on the current one.
    private ReentrantLock acquire(String sessionId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock(true));
            lock.lock();
            if (locks.get(sessionId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }
}
