package org.netpreserve.crawlguard.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class DatabaseStoreTest {
    private final Database database;

    DatabaseStoreTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() {
        database.useHandle(handle -> handle.execute("DELETE FROM documents"));
    }

    @Test
    void storesDocumentsPerNamespace() throws IOException {
        var cache = new DatabaseStore(database, "cache");
        var selectors = new DatabaseStore(database, "selectors");

        cache.put("a", "{\"v\":1}");
        cache.put("b", "{\"v\":2}");
        selectors.put("a", "{\"v\":3}");
        cache.put("a", "{\"v\":4}");

        assertEquals("{\"v\":4}", cache.get("a"));
        assertEquals("{\"v\":3}", selectors.get("a"));
        assertNull(selectors.get("b"));
        assertEquals(List.of("a", "b"), cache.list());
        assertEquals(List.of("a"), selectors.list());
        assertEquals(2, database.documents().count("cache"));

        assertTrue(cache.delete("a"));
        assertFalse(cache.delete("a"));
        assertEquals(List.of("b"), cache.list());
        assertEquals("{\"v\":3}", selectors.get("a"));
    }
}
