package com.cachedb.core;

import com.cachedb.TestClock;
import com.cachedb.cache.CacheRecord;
import com.cachedb.config.CacheDBConfig;
import com.cachedb.exception.CacheDBException;
import com.cachedb.exception.KeyNotFoundException;
import com.cachedb.exception.TypeMismatchException;
import com.cachedb.exception.ValidationException;
import com.cachedb.store.OverflowFileStore;
import com.cachedb.store.StoreFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cache engine")
class CacheEngineTest {
    private static final int RAW_MAX = 64;

    @TempDir
    Path tempDir;

    private TestClock clock;
    private CacheEngine engine;

    @BeforeEach
    void setUp() throws CacheDBException {
        clock = new TestClock();
        engine = open(builder());
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private CacheDBConfig.Builder builder() {
        return CacheDBConfig.builder().directory(tempDir).rawMaxSize(RAW_MAX).clock(clock);
    }

    private CacheEngine open(CacheDBConfig.Builder builder) throws CacheDBException {
        return new CacheEngine(builder.build());
    }

    private CacheEngine reopen(CacheDBConfig.Builder builder) throws CacheDBException {
        engine.close();
        engine = open(builder);
        return engine;
    }

    @Nested
    @DisplayName("basic operations")
    class BasicOperations {

        @Test
        @DisplayName("values round-trip in their stored form")
        void testRoundTrip() throws Exception {
            assertTrue(engine.set("text", "value"));
            assertTrue(engine.set("int", 42));
            assertTrue(engine.set("double", 1.5));
            assertTrue(engine.set("bytes", new byte[]{1, 2, 3}));
            assertTrue(engine.set("list", Arrays.asList("a", "b")));
            assertTrue(engine.set("nothing", null));
            assertTrue(engine.set(7, "numeric key"));

            assertEquals("value", engine.get("text"));
            assertEquals(42L, engine.get("int"));
            assertEquals(1.5, engine.get("double"));
            assertArrayEquals(new byte[]{1, 2, 3}, (byte[]) engine.get("bytes"));
            assertEquals(Arrays.asList("a", "b"), engine.get("list"));
            assertNull(engine.get("nothing", "default"));
            assertEquals("numeric key", engine.get(7L));
        }

        @Test
        @DisplayName("narrow number types load back widened")
        void testNumberWidening() throws Exception {
            engine.set("int", Integer.valueOf(5));
            engine.set("short", (short) 6);
            engine.set("float", 2.5f);

            assertEquals(Long.valueOf(5), engine.get("int"));
            assertNotEquals(Integer.valueOf(5), engine.get("int"));
            assertEquals(6L, engine.get("short"));
            assertEquals(Double.valueOf(2.5), engine.get("float"));
        }

        @Test
        @DisplayName("misses return the default")
        void testMiss() throws Exception {
            assertNull(engine.get("missing"));
            assertEquals("fallback", engine.get("missing", "fallback"));
            assertFalse(engine.exists("missing"));
        }

        @Test
        @DisplayName("set replaces the value and keeps the first store time")
        void testOverwrite() throws Exception {
            engine.set("k", "v1");
            double firstStore = engine.inspect("k").orElseThrow().getStoreTime();
            clock.advanceSeconds(5);
            engine.set("k", "v2");

            CacheRecord record = engine.inspect("k").orElseThrow();
            assertEquals("v2", record.getValue());
            assertEquals(firstStore, record.getStoreTime());
            assertEquals(firstStore + 5, record.getLastAccessTime(), 1e-6);
            assertEquals(1L, record.getAccessCount());
            assertEquals(1L, engine.size());
        }

        @Test
        @DisplayName("reads record the access")
        void testAccessStatistics() throws Exception {
            engine.set("k", "v");
            clock.advanceSeconds(3);
            engine.get("k");
            engine.get("k");

            CacheRecord record = engine.inspect("k").orElseThrow();
            assertEquals(2L, record.getAccessCount());
            assertEquals(record.getStoreTime() + 3, record.getLastAccessTime(), 1e-6);
        }

        @Test
        @DisplayName("exSet only writes absent keys")
        void testExSet() throws Exception {
            assertTrue(engine.exSet("k", "first"));
            assertFalse(engine.exSet("k", "second"));
            assertEquals("first", engine.get("k"));
        }

        @Test
        @DisplayName("delete and pop remove the entry")
        void testDeleteAndPop() throws Exception {
            engine.set("a", 1);
            engine.set("b", "two");

            assertTrue(engine.delete("a"));
            assertFalse(engine.delete("a"));
            assertEquals("two", engine.pop("b"));
            assertEquals("gone", engine.pop("b", "gone"));
            assertEquals(0L, engine.size());
        }

        @Test
        @DisplayName("getMany leaves out missing keys")
        void testGetMany() throws Exception {
            engine.set("a", 1);
            engine.set("c", 3);

            Map<Object, Object> expected = new LinkedHashMap<>();
            expected.put("a", 1L);
            expected.put("c", 3L);
            assertEquals(expected, engine.getMany(Arrays.asList("a", "b", "c")));
        }

        @Test
        @DisplayName("clear removes every entry")
        void testClear() throws Exception {
            for (int i = 0; i < 5; i++) {
                engine.set("k" + i, i);
            }

            assertTrue(engine.clear());
            assertEquals(0L, engine.size());
            assertFalse(engine.keys().iterator().hasNext());
        }

        @Test
        @DisplayName("the live count survives a restart")
        void testSizeAfterReopen() throws Exception {
            engine.set("a", 1);
            engine.set("b", 2);
            engine.set("c", 3, Duration.ofSeconds(1));
            clock.advanceSeconds(2);

            reopen(builder());
            assertEquals(2L, engine.size());
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("entries disappear once their timeout passes but stay on disk")
        void testLazyExpiry() throws Exception {
            engine.set("k", "v", Duration.ofSeconds(10));
            clock.advanceSeconds(5);
            assertEquals("v", engine.get("k"));
            assertEquals(5.0, engine.ttl("k"), 1e-6);

            clock.advanceSeconds(6);
            assertNull(engine.get("k"));
            assertFalse(engine.exists("k"));
            assertEquals(-1.0, engine.ttl("k"));
            assertTrue(engine.inspect("k").orElseThrow().isExpired(clock.millis() / 1000.0));
        }

        @Test
        @DisplayName("ttl is null for entries without a timeout")
        void testTtlWithoutTimeout() throws Exception {
            engine.set("k", "v");

            assertNull(engine.ttl("k"));
            assertEquals(-1.0, engine.ttl("missing"));
        }

        @Test
        @DisplayName("an expired key behaves as absent for exSet and is fully reset")
        void testExSetAfterExpiry() throws Exception {
            engine.set("k", "old", Duration.ofSeconds(1));
            engine.get("k");
            clock.advanceSeconds(2);

            assertTrue(engine.exSet("k", "new"));
            CacheRecord record = engine.inspect("k").orElseThrow();
            assertEquals("new", record.getValue());
            assertEquals(0L, record.getAccessCount());
            assertEquals(clock.millis() / 1000.0, record.getStoreTime(), 1e-6);
            assertNull(record.getExpireTime());
        }

        @Test
        @DisplayName("touch moves the expiry of live entries only")
        void testTouch() throws Exception {
            engine.set("k", "v", Duration.ofSeconds(1));
            assertTrue(engine.touch("k", Duration.ofSeconds(100)));
            clock.advanceSeconds(50);
            assertEquals("v", engine.get("k"));

            assertTrue(engine.touch("k", null));
            assertNull(engine.ttl("k"));

            engine.set("short", "v", Duration.ofSeconds(1));
            clock.advanceSeconds(2);
            assertFalse(engine.touch("short", Duration.ofSeconds(100)));
            assertFalse(engine.touch("missing", Duration.ofSeconds(100)));
        }

        @Test
        @DisplayName("pop ignores expired entries")
        void testPopExpired() throws Exception {
            engine.set("k", "v", Duration.ofSeconds(1));
            clock.advanceSeconds(1);

            assertEquals("default", engine.pop("k", "default"));
        }
    }

    @Nested
    @DisplayName("counters")
    class Counters {

        @Test
        @DisplayName("incr and decr keep the numeric type")
        void testIncrDecr() throws Exception {
            engine.set("n", 1);

            assertEquals(2L, engine.incr("n"));
            assertEquals(12L, engine.incr("n", 10));
            assertEquals(9L, engine.decr("n", 3));
            assertEquals(9.5, engine.incr("n", 0.5));
            assertEquals(8.5, engine.decr("n"));
            assertEquals(8.5, engine.get("n"));
        }

        @Test
        @DisplayName("missing and expired keys raise KeyNotFoundException")
        void testIncrMissing() throws Exception {
            KeyNotFoundException e = assertThrows(KeyNotFoundException.class, () -> engine.incr("nope"));
            assertEquals("nope", e.getKey());

            engine.set("n", 1, Duration.ofSeconds(1));
            clock.advanceSeconds(2);
            assertThrows(KeyNotFoundException.class, () -> engine.incr("n"));
        }

        @Test
        @DisplayName("non-numeric values raise TypeMismatchException")
        void testIncrNonNumeric() throws Exception {
            engine.set("s", "text");

            assertThrows(TypeMismatchException.class, () -> engine.incr("s"));
            assertThrows(TypeMismatchException.class, () -> engine.incr("s", null));
            assertEquals("text", engine.get("s"));
        }

        @Test
        @DisplayName("concurrent increments are never lost")
        void testConcurrentIncrements() throws Exception {
            engine.set("counter", 0);
            int threads = 8;
            int perThread = 50;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    futures.add(executor.submit(() -> {
                        for (int i = 0; i < perThread; i++) {
                            engine.incr("counter");
                        }
                        return null;
                    }));
                }
                for (Future<?> future : futures) {
                    future.get();
                }
            } finally {
                executor.shutdown();
            }

            assertEquals((long) threads * perThread, engine.get("counter"));
        }
    }

    @Nested
    @DisplayName("overflow files")
    class OverflowFiles {

        @Test
        @DisplayName("large values live in one shared file until the last reference goes")
        void testSharedOverflow() throws Exception {
            String big = repeat('x', RAW_MAX * 10);
            engine.set("a", big);
            engine.set("b", big);

            assertEquals(1, overflowFiles().size());
            assertEquals(StoreFormat.FILE_STRING, engine.inspect("a").orElseThrow().getValueFormat());
            assertEquals(big, engine.get("b"));

            engine.delete("a");
            assertEquals(1, overflowFiles().size());
            engine.set("b", "small");
            assertTrue(overflowFiles().isEmpty());
        }

        @Test
        @DisplayName("large keys are stored in files and found again")
        void testLargeKey() throws Exception {
            String key = repeat('k', RAW_MAX * 2);
            engine.set(key, "v");
            engine.set(key, "w");

            assertEquals("w", engine.get(key));
            assertEquals(1, overflowFiles().size());
            assertTrue(engine.delete(key));
            assertTrue(overflowFiles().isEmpty());
        }

        @Test
        @DisplayName("lookups of large keys never create files")
        void testLookupCreatesNoFile() throws Exception {
            assertNull(engine.get(repeat('q', RAW_MAX * 2)));
            assertFalse(engine.exists(repeat('q', RAW_MAX * 2)));
            assertTrue(overflowFiles().isEmpty());
        }

        @Test
        @DisplayName("a row whose file vanished reads as a miss and is removed")
        void testVanishedFile() throws Exception {
            engine.set("k", repeat('v', RAW_MAX * 2));
            for (Path file : overflowFiles()) {
                Files.delete(file);
            }

            assertEquals("default", engine.get("k", "default"));
            assertFalse(engine.inspect("k").isPresent());
            assertEquals(0L, engine.size());
        }

        @Test
        @DisplayName("upgrading an old store releases the files of collapsed duplicates")
        void testMigrationReleasesDuplicateFiles() throws Exception {
            CacheDBConfig legacy = builder().name("legacy").build();
            String hash = new OverflowFileStore(tempDir).write(
                    repeat('o', RAW_MAX * 2).getBytes(StandardCharsets.UTF_8));
            try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + legacy.getStorePath());
                 Statement statement = connection.createStatement()) {
                statement.execute("CREATE TABLE cache(key BLOB NOT NULL, key_format INTEGER NOT NULL, value BLOB, "
                        + "value_format INTEGER NOT NULL, store_time REAL NOT NULL, expire_time REAL, "
                        + "last_access_time REAL NOT NULL, access_count INTEGER NOT NULL DEFAULT 0)");
                statement.execute("INSERT INTO cache VALUES ('k', 0, '" + hash + "', "
                        + StoreFormat.FILE_STRING.getCode() + ", 1, NULL, 1, 0)");
                statement.execute("INSERT INTO cache VALUES ('k', 0, 'new', 0, 2, NULL, 2, 0)");
            }
            assertEquals(1, overflowFiles().size());

            reopen(builder().name("legacy"));

            assertEquals("new", engine.get("k"));
            assertTrue(overflowFiles().isEmpty());
            assertFalse(Files.exists(tempDir.resolve(hash + ".ref")));
        }

        @Test
        @DisplayName("clear releases every file")
        void testClearReleasesFiles() throws Exception {
            engine.set("a", repeat('a', RAW_MAX * 2));
            engine.set("b", repeat('b', RAW_MAX * 2));

            engine.clear();
            assertTrue(overflowFiles().isEmpty());
        }
    }

    @Nested
    @DisplayName("iteration")
    class Iteration {

        @Test
        @DisplayName("keys, values and items page through live rows in store order")
        void testScanOrder() throws Exception {
            reopen(builder().iterSize(2));
            for (String key : Arrays.asList("a", "b", "c", "d", "e")) {
                engine.set(key, key.toUpperCase());
                clock.advanceSeconds(1);
            }
            engine.set("expired", "x", Duration.ofMillis(10));
            clock.advanceSeconds(1);

            assertEquals(Arrays.asList("a", "b", "c", "d", "e"), collect(engine.keys()));
            assertEquals(Arrays.asList("A", "B", "C", "D", "E"), collect(engine.values()));

            List<Map.Entry<Object, Object>> items = new ArrayList<>();
            engine.items().forEach(items::add);
            assertEquals(5, items.size());
            assertEquals("c", items.get(2).getKey());
            assertEquals("C", items.get(2).getValue());
        }

        @Test
        @DisplayName("rows with vanished files are skipped and removed during a scan")
        void testScanSkipsTombstones() throws Exception {
            reopen(builder().iterSize(1));
            engine.set("a", "1");
            clock.advanceSeconds(1);
            engine.set("broken", repeat('z', RAW_MAX * 2));
            clock.advanceSeconds(1);
            engine.set("c", "3");
            for (Path file : overflowFiles()) {
                Files.delete(file);
            }

            assertEquals(Arrays.asList("1", "3"), collect(engine.values()));
            assertFalse(engine.inspect("broken").isPresent());
            assertEquals(Arrays.asList("a", "c"), collect(engine.keys()));
        }

        @Test
        @DisplayName("key scans drop rows whose value file vanished without reading it")
        void testKeyScanSkipsVanishedValues() throws Exception {
            engine.set("small", "v");
            clock.advanceSeconds(1);
            engine.set("big", repeat('b', RAW_MAX * 2));
            for (Path file : overflowFiles()) {
                Files.delete(file);
            }

            assertEquals(Collections.singletonList("small"), collect(engine.keys()));
            assertFalse(engine.inspect("big").isPresent());
            assertNull(engine.get("big"));
        }

        @Test
        @DisplayName("value scans drop rows whose key file vanished")
        void testValueScanSkipsVanishedKeys() throws Exception {
            String bigKey = repeat('k', RAW_MAX * 2);
            engine.set("small", "v");
            clock.advanceSeconds(1);
            engine.set(bigKey, "w");
            for (Path file : overflowFiles()) {
                Files.delete(file);
            }

            assertEquals(Collections.singletonList("v"), collect(engine.values()));
            assertEquals(1L, engine.size());
        }
    }

    @Nested
    @DisplayName("eviction")
    class Eviction {

        @Test
        @DisplayName("fifo evicts the oldest entries once full")
        void testFifo() throws Exception {
            reopen(builder().maxSize(10).evictionPolicy("fifo"));
            for (int i = 0; i < 12; i++) {
                engine.set("k" + i, i);
            }

            assertFalse(engine.exists("k0"));
            assertFalse(engine.exists("k1"));
            for (int i = 2; i < 12; i++) {
                assertTrue(engine.exists("k" + i), "k" + i + " should survive");
            }
            assertEquals(10L, engine.size());
            assertEquals(10, collect(engine.keys()).size());
        }

        @Test
        @DisplayName("lru spares recently read entries")
        void testLru() throws Exception {
            reopen(builder().maxSize(10).evictionPolicy("lru"));
            for (int i = 0; i < 10; i++) {
                engine.set("k" + i, i);
            }
            clock.advanceSeconds(1);
            engine.get("k0");
            engine.set("k10", 10);

            assertTrue(engine.exists("k0"));
            assertFalse(engine.exists("k1"));
            assertFalse(engine.exists("k2"));
            assertTrue(engine.exists("k10"));
        }

        @Test
        @DisplayName("lfu spares frequently read entries")
        void testLfu() throws Exception {
            reopen(builder().maxSize(10).evictionPolicy("lfu"));
            for (int i = 0; i < 10; i++) {
                engine.set("k" + i, i);
            }
            for (int i = 2; i < 10; i++) {
                engine.get("k" + i);
            }
            engine.set("k10", 10);

            assertFalse(engine.exists("k0"));
            assertFalse(engine.exists("k1"));
            assertTrue(engine.exists("k2"));
            assertTrue(engine.exists("k10"));
        }

        @Test
        @DisplayName("expired rows are swept before anything live is evicted")
        void testExpiredSweptFirst() throws Exception {
            reopen(builder().maxSize(10).evictionPolicy("fifo"));
            for (int i = 0; i < 10; i++) {
                engine.set("short" + i, i, Duration.ofSeconds(1));
            }
            clock.advanceSeconds(2);
            engine.set("keep", "v");

            assertTrue(engine.exists("keep"));
            assertFalse(engine.inspect("short0").isPresent());
            assertEquals(1L, engine.size());
        }

        @Test
        @DisplayName("the active policy is persisted and its index replaces the old one")
        void testPolicySwitch() throws Exception {
            assertEquals(Optional.of("lru"), engine.getStorage().meta(CacheEngine.POLICY_KEY));
            assertEquals(Collections.singletonList("idx_evict_lru"), evictionIndexes());

            reopen(builder().evictionPolicy("fifo"));
            assertEquals(Optional.of("fifo"), engine.getStorage().meta(CacheEngine.POLICY_KEY));
            assertEquals(Collections.singletonList("idx_evict_fifo"), evictionIndexes());
        }

        @Test
        @DisplayName("unknown policies are rejected at open")
        void testUnknownPolicy() {
            assertThrows(ValidationException.class, () -> open(builder().evictionPolicy("random")));
        }

        private List<String> evictionIndexes() throws CacheDBException {
            return engine.getStorage().read(connection -> {
                List<String> names = new ArrayList<>();
                try (Statement statement = connection.createStatement();
                     ResultSet rs = statement.executeQuery(
                             "SELECT name FROM sqlite_master WHERE type = 'index' AND name LIKE 'idx_evict_%'")) {
                    while (rs.next()) {
                        names.add(rs.getString(1));
                    }
                }
                return names;
            });
        }
    }

    private List<Path> overflowFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.filter(p -> p.getFileName().toString().matches("[0-9a-f]{32}"))
                    .collect(Collectors.toList());
        }
    }

    private static List<Object> collect(Iterable<Object> iterable) {
        List<Object> result = new ArrayList<>();
        iterable.forEach(result::add);
        return result;
    }

    private static String repeat(char c, int count) {
        char[] chars = new char[count];
        Arrays.fill(chars, c);
        return new String(chars);
    }
}
