package org.netpreserve.crawlguard.store;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Store that keeps documents in process memory only.
 */
public class MemoryStore implements KeyValueStore {
    private final Map<String, String> documents = new ConcurrentHashMap<>();

    @Override
    public @Nullable String get(String key) {
        return documents.get(key);
    }

    @Override
    public void put(String key, String document) {
        documents.put(key, document);
    }

    @Override
    public boolean delete(String key) {
        return documents.remove(key) != null;
    }

    @Override
    public List<String> list() {
        var keys = new ArrayList<>(documents.keySet());
        Collections.sort(keys);
        return keys;
    }
}
