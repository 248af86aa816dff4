package org.netpreserve.crawlguard;

import com.fasterxml.jackson.databind.JsonMappingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.crawlguard.config.GuardConfig;
import org.netpreserve.crawlguard.config.RateLimitConfig;
import org.netpreserve.crawlguard.config.StorageConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CrawlGuardTest {
    @TempDir
    Path dataDir;

    @Test
    void defaultsApplyWithoutConfigFile() throws IOException {
        GuardConfig config = CrawlGuard.loadConfig(dataDir);

        assertEquals(RateLimitConfig.defaults(), config.rateLimit());
        assertEquals(1.0, config.tokenBucket().rate());
        assertEquals(5, config.tokenBucket().capacity());
        assertTrue(config.cache().enabled());
        assertEquals(Duration.ofHours(24), config.cache().ttl());
        assertEquals(100L * 1024 * 1024, config.cache().maxSize());
        assertEquals(StorageConfig.Type.JSON, config.storage().type());
        assertTrue(config.selectors().globalPatterns().get("checkout").contains(".checkout-btn"));
    }

    @Test
    void configFileIsMergedOverDefaults() throws IOException {
        Files.writeString(dataDir.resolve("config.yaml"), """
                rateLimit:
                  maxDelay: 30s
                  windowSize: 50
                cache:
                  ttl: 90m
                  maxSize: 512K
                selectors:
                  globalPatterns:
                    checkout: [".pay-now"]
                storage:
                  type: sqlite
                """);

        GuardConfig config = CrawlGuard.loadConfig(dataDir);

        assertEquals(Duration.ofSeconds(30), config.rateLimit().maxDelay());
        assertEquals(50, config.rateLimit().windowSize());
        assertEquals(Duration.ofMillis(500), config.rateLimit().minDelay());
        assertEquals(Duration.ofMinutes(90), config.cache().ttl());
        assertEquals(512 * 1024L, config.cache().maxSize());
        assertTrue(config.cache().enabled());
        assertEquals(List.of(".pay-now"), config.selectors().globalPatterns().get("checkout"));
        assertTrue(config.selectors().globalPatterns().containsKey("search"));
        assertEquals(StorageConfig.Type.SQLITE, config.storage().type());
    }

    @Test
    void malformedConfigIsRejected() throws IOException {
        Files.writeString(dataDir.resolve("config.yaml"), """
                rateLimit:
                  minDelay: 20s
                """);
        Throwable e = assertThrows(JsonMappingException.class, () -> CrawlGuard.loadConfig(dataDir));
        while (e.getCause() != null && !(e instanceof IllegalArgumentException)) {
            e = e.getCause();
        }
        assertInstanceOf(IllegalArgumentException.class, e);
    }

    @Test
    void unparseableDurationIsRejected() throws IOException {
        Files.writeString(dataDir.resolve("config.yaml"), """
                cache:
                  ttl: soon
                """);
        assertThrows(JsonMappingException.class, () -> CrawlGuard.loadConfig(dataDir));
    }
}
