package com.groupwatch.service.store;

import com.groupwatch.collectors.api.SeenStore;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime registry of announced items. Nothing survives a restart, so the first poll after start-up
 * primes it again.
 */
public class InMemorySeenStore implements SeenStore {
    private final Map<String, Set<String>> seenBySource = new ConcurrentHashMap<>();

    @Override
    public boolean register(String source) {
        return seenBySource.putIfAbsent(source, ConcurrentHashMap.newKeySet()) == null;
    }

    @Override
    public boolean markSeen(String source, String key) {
        return seenBySource.computeIfAbsent(source, ignored -> ConcurrentHashMap.newKeySet()).add(key);
    }

    public int size(String source) {
        Set<String> keys = seenBySource.get(source);
        return keys == null ? 0 : keys.size();
    }

    public Set<String> sources() {
        return Set.copyOf(seenBySource.keySet());
    }
}
