package com.cachedb.config;

import com.cachedb.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CacheDB configuration")
class CacheDBConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("defaults match the documented values")
    void testDefaults() {
        CacheDBConfig config = CacheDBConfig.builder().directory(tempDir).build();

        assertEquals(CacheDBConfig.DEFAULT_NAME, config.getName());
        assertEquals(1L << 30, config.getMaxSize());
        assertEquals(256, config.getIterSize());
        assertEquals("lru", config.getEvictionPolicy());
        assertEquals(1 << 17, config.getRawMaxSize());
        assertNull(config.getLockTimeout());
        assertEquals(Duration.ofSeconds(5), config.getBusyTimeout());
        assertEquals("wal", config.getPragmas().get("journal_mode"));
        assertEquals(tempDir.resolve(CacheDBConfig.DEFAULT_NAME), config.getStorePath());
    }

    @Test
    @DisplayName("missing directories are created")
    void testCreatesDirectory() {
        Path nested = tempDir.resolve("a").resolve("b");
        CacheDBConfig config = CacheDBConfig.builder().directory(nested).build();

        assertTrue(Files.isDirectory(nested));
        assertTrue(config.getDirectory().isAbsolute());
    }

    @Test
    @DisplayName("a regular file is rejected as directory")
    void testRejectsFileAsDirectory() throws IOException {
        Path file = Files.createFile(tempDir.resolve("plain"));

        assertThrows(ValidationException.class, () -> CacheDBConfig.builder().directory(file).build());
    }

    @Test
    @DisplayName("invalid sizes and names are rejected")
    void testRejectsInvalidValues() {
        assertThrows(ValidationException.class,
                () -> CacheDBConfig.builder().directory(tempDir).maxSize(0).build());
        assertThrows(ValidationException.class,
                () -> CacheDBConfig.builder().directory(tempDir).iterSize(-1).build());
        assertThrows(ValidationException.class,
                () -> CacheDBConfig.builder().directory(tempDir).name("a/b").build());
        assertThrows(ValidationException.class,
                () -> CacheDBConfig.builder().directory(tempDir).lockTimeout(Duration.ofSeconds(-1)).build());
    }

    @Test
    @DisplayName("pragmas must be a map of simple names and values")
    void testPragmaValidation() {
        assertThrows(ValidationException.class, () -> CacheDBConfig.builder().pragmas(null));
        assertThrows(ValidationException.class,
                () -> CacheDBConfig.builder().directory(tempDir).pragma("cache_size; DROP", 1).build());
        assertThrows(ValidationException.class,
                () -> CacheDBConfig.builder().directory(tempDir).pragma("journal_mode", "wal; --").build());

        CacheDBConfig config = CacheDBConfig.builder().directory(tempDir)
                .pragmas(Collections.singletonMap("cache_size", -2000))
                .build();
        assertEquals(Collections.singletonMap("cache_size", -2000), config.getPragmas());
    }

    @Test
    @DisplayName("withName keeps every other setting")
    void testWithName() {
        CacheDBConfig config = CacheDBConfig.builder().directory(tempDir).maxSize(10).evictionPolicy("fifo").build();
        CacheDBConfig renamed = config.withName("tag:" + config.getName());

        assertEquals("tag:default.sqlite3", renamed.getName());
        assertEquals(10, renamed.getMaxSize());
        assertEquals("fifo", renamed.getEvictionPolicy());
        assertEquals(config.getDirectory(), renamed.getDirectory());
    }
}
