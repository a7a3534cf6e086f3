package com.ztverify.riskauth.application;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per username, created on demand and dropped once nobody holds or waits for it.
 * Operations for different users never contend.
 */
@Component
public class UserLockRegistry {

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int holders; // guarded by the map's per-key compute
    }

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withUserLock(String username, Supplier<T> action) {
        Entry entry = locks.compute(username, (k, e) -> {
            Entry current = e != null ? e : new Entry();
            current.holders++;
            return current;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(username, (k, e) -> --e.holders == 0 ? null : e);
        }
    }

    int trackedUsers() {
        return locks.size();
    }
}
