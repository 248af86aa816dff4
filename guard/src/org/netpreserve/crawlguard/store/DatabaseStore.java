package org.netpreserve.crawlguard.store;

import org.jdbi.v3.core.JdbiException;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Keeps documents as rows of a shared SQLite table, partitioned by namespace so several components can share one
 * database file. Closing the store leaves the database open; the database's owner closes it.
 */
public class DatabaseStore implements KeyValueStore {
    private final Database db;
    private final String namespace;

    public DatabaseStore(Database db, String namespace) {
        this.db = db;
        this.namespace = namespace;
    }

    @Override
    public @Nullable String get(String key) throws IOException {
        try {
            return db.documents().find(namespace, key);
        } catch (JdbiException e) {
            throw new IOException("Failed to read " + namespace + "/" + key, e);
        }
    }

    @Override
    public void put(String key, String document) throws IOException {
        try {
            db.documents().upsert(namespace, key, document, Instant.now());
        } catch (JdbiException e) {
            throw new IOException("Failed to write " + namespace + "/" + key, e);
        }
    }

    @Override
    public boolean delete(String key) throws IOException {
        try {
            return db.documents().delete(namespace, key) > 0;
        } catch (JdbiException e) {
            throw new IOException("Failed to delete " + namespace + "/" + key, e);
        }
    }

    @Override
    public List<String> list() throws IOException {
        try {
            return db.documents().keys(namespace);
        } catch (JdbiException e) {
            throw new IOException("Failed to list " + namespace, e);
        }
    }
}
