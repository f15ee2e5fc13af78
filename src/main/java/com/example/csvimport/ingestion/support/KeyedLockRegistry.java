package com.example.csvimport.ingestion.support;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Mutual exclusion per string key. Entries are reference counted and dropped once no thread holds
 * or waits for them, so the map only grows with the number of keys in flight.
 */
@Slf4j
@Component
public class KeyedLockRegistry {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry acquired = existing == null ? new LockEntry() : existing;
            acquired.holders++;
            return acquired;
        });

        if (entry.lock.isLocked()) {
            log.debug("Waiting for lock on key={}", key);
        }
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, existing) -> --existing.holders == 0 ? null : existing);
        }
    }

    int activeKeys() {
        return locks.size();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by ConcurrentHashMap.compute on the owning key
        private int holders;
    }
}
