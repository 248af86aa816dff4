package org.netpreserve.crawlguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Storage configuration.
 *
 * @param type backend holding cache entries and selectors between sessions
 */
public record StorageConfig(Type type) {
    public StorageConfig {
        if (type == null) type = Type.MEMORY;
    }

    public enum Type {
        /** Nothing survives the session. */
        @JsonProperty("memory") MEMORY,
        /** A directory of JSON documents. */
        @JsonProperty("json") JSON,
        /** A single SQLite database file. */
        @JsonProperty("sqlite") SQLITE
    }
}
