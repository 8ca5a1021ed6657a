package com.groupwatch.collectors.support;

import com.groupwatch.collectors.api.SeenStore;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySeenStore implements SeenStore {
    private final Map<String, Set<String>> seen = new ConcurrentHashMap<>();

    @Override
    public boolean register(String source) {
        return seen.putIfAbsent(source, ConcurrentHashMap.newKeySet()) == null;
    }

    @Override
    public boolean markSeen(String source, String key) {
        return seen.computeIfAbsent(source, ignored -> ConcurrentHashMap.newKeySet()).add(key);
    }
}
