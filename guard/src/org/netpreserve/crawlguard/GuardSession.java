package org.netpreserve.crawlguard;

import org.jdbi.v3.core.JdbiException;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.crawlguard.cache.ResponseCache;
import org.netpreserve.crawlguard.config.GuardConfig;
import org.netpreserve.crawlguard.ratelimit.AdaptiveRateLimiter;
import org.netpreserve.crawlguard.ratelimit.TokenBucketLimiter;
import org.netpreserve.crawlguard.selector.SelectorLibrary;
import org.netpreserve.crawlguard.store.Database;
import org.netpreserve.crawlguard.store.DatabaseStore;
import org.netpreserve.crawlguard.store.JsonDirectoryStore;
import org.netpreserve.crawlguard.store.KeyValueStore;
import org.netpreserve.crawlguard.store.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * The resilience services of one crawl session: a rate limiter and token bucket for outbound requests, a response
 * cache for model calls and a selector library for DOM interaction.
 * <p>
 * The services don't know about each other; the session only constructs them from one configuration, points the
 * cache and library at the configured store and closes everything at the end. Each session owns its own instances.
 */
public class GuardSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GuardSession.class);
    static final String DATABASE_FILE = "crawlguard.sqlite3";
    static final String CACHE_NAMESPACE = "cache";
    static final String SELECTORS_NAMESPACE = "selectors";

    private final GuardConfig config;
    private final AdaptiveRateLimiter rateLimiter;
    private final TokenBucketLimiter tokenBucket;
    private final ResponseCache cache;
    private final SelectorLibrary selectors;
    private final @Nullable Database database;

    private GuardSession(GuardConfig config, KeyValueStore cacheStore, KeyValueStore selectorStore,
                         @Nullable Database database) {
        this.config = config;
        this.database = database;
        this.rateLimiter = new AdaptiveRateLimiter(config.rateLimit());
        this.tokenBucket = new TokenBucketLimiter(config.tokenBucket());
        this.cache = new ResponseCache(config.cache(), cacheStore);
        this.selectors = new SelectorLibrary(selectorStore);
        config.selectorsOrDefault().globalPatterns().forEach((purpose, patterns) -> {
            for (String pattern : patterns) {
                selectors.addGlobalPattern(purpose, pattern);
            }
        });
    }

    /**
     * Opens a session keeping its state in memory only.
     */
    public static GuardSession inMemory(GuardConfig config) {
        return new GuardSession(config, new MemoryStore(), new MemoryStore(), null);
    }

    /**
     * Opens a session using the configured storage backend, creating {@code dataDir} if needed.
     *
     * @throws CrawlGuardException if the backend can't be opened
     */
    public static GuardSession open(Path dataDir, GuardConfig config) {
        var type = config.storageOrDefault().type();
        log.info("Opening session in {} with {} storage", dataDir, type);
        try {
            return switch (type) {
                case MEMORY -> inMemory(config);
                case JSON -> new GuardSession(config,
                        new JsonDirectoryStore(dataDir.resolve(CACHE_NAMESPACE)),
                        new JsonDirectoryStore(dataDir.resolve(SELECTORS_NAMESPACE)), null);
                case SQLITE -> {
                    Files.createDirectories(dataDir);
                    Database db = Database.open(dataDir.resolve(DATABASE_FILE));
                    yield new GuardSession(config, new DatabaseStore(db, CACHE_NAMESPACE),
                            new DatabaseStore(db, SELECTORS_NAMESPACE), db);
                }
            };
        } catch (IOException | JdbiException e) {
            throw new CrawlGuardException("Failed to open " + type + " storage in " + dataDir, e);
        }
    }

    public GuardConfig config() {
        return config;
    }

    public AdaptiveRateLimiter rateLimiter() {
        return rateLimiter;
    }

    public TokenBucketLimiter tokenBucket() {
        return tokenBucket;
    }

    public ResponseCache cache() {
        return cache;
    }

    public SelectorLibrary selectors() {
        return selectors;
    }

    /**
     * Summary of the cache and selector library, as printed by {@code --stats}.
     */
    public Map<String, Object> stats() {
        return Map.of("cache", cache.stats(),
                "selectors", selectors.stats(),
                "rateLimit", rateLimiter.getMetrics(),
                "availableTokens", tokenBucket.availableTokens());
    }

    @Override
    public void close() {
        for (var closeable : List.<AutoCloseable>of(cache, selectors)) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.error("Failed to close {}", closeable.getClass().getSimpleName(), e);
            }
        }
        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.error("Failed to close database", e);
            }
        }
        log.info("Session closed");
    }
}
