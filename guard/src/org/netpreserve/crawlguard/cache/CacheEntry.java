package org.netpreserve.crawlguard.cache;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * A cached model response.
 *
 * @param key        identifies the entry, derived from the request, its context and the model
 * @param requestKey derived from the request and its context only, shared by entries from different models
 * @param promptHash short hash of the request text alone
 * @param response   the stored response
 * @param model      model (and version) that produced the response
 * @param createdAt  when the entry was stored
 * @param expiresAt  first instant at which the entry is no longer served
 * @param hitCount   number of times the entry has been served
 * @param lastHit    when the entry was last served
 */
public record CacheEntry(
        String key,
        String requestKey,
        String promptHash,
        JsonNode response,
        String model,
        Instant createdAt,
        Instant expiresAt,
        long hitCount,
        @Nullable Instant lastHit
) {
    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(requestKey, "requestKey");
        Objects.requireNonNull(promptHash, "promptHash");
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public CacheEntry withHit(Instant now) {
        return new CacheEntry(key, requestKey, promptHash, response, model, createdAt, expiresAt, hitCount + 1, now);
    }

    /**
     * When the entry was last served, or stored if it has never been served.
     */
    public Instant lastUsed() {
        return lastHit != null ? lastHit : createdAt;
    }

    public CacheEntrySummary summary() {
        return new CacheEntrySummary(key, promptHash, model, createdAt, hitCount);
    }
}
