package org.netpreserve.crawlguard.store;

import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;

public interface DocumentDAO {
    @SqlQuery("SELECT document FROM documents WHERE namespace = :namespace AND key = :key")
    @Nullable String find(String namespace, String key);

    @SqlUpdate("""
            INSERT INTO documents (namespace, key, document, updated)
            VALUES (:namespace, :key, :document, :updated)
            ON CONFLICT (namespace, key) DO UPDATE SET document = excluded.document, updated = excluded.updated
            """)
    void upsert(String namespace, String key, String document, Instant updated);

    @SqlUpdate("DELETE FROM documents WHERE namespace = :namespace AND key = :key")
    int delete(String namespace, String key);

    @SqlQuery("SELECT key FROM documents WHERE namespace = :namespace ORDER BY key")
    List<String> keys(String namespace);

    @SqlQuery("SELECT COUNT(*) FROM documents WHERE namespace = :namespace")
    long count(String namespace);
}
