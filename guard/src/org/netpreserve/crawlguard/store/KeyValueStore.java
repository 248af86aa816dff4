package org.netpreserve.crawlguard.store;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * Minimal persistent map of string keys to JSON documents.
 */
public interface KeyValueStore extends AutoCloseable {
    @Nullable String get(String key) throws IOException;

    void put(String key, String document) throws IOException;

    /**
     * @return true if a document was stored under the key
     */
    boolean delete(String key) throws IOException;

    List<String> list() throws IOException;

    @Override
    default void close() throws IOException {
    }
}
