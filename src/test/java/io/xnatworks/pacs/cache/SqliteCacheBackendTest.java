/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.pacs.cache;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SqliteCacheBackend.
 */
@DisplayName("SqliteCacheBackend Tests")
class SqliteCacheBackendTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteCacheBackend backend;

    @BeforeEach
    void setUp() throws Exception {
        backend = new SqliteCacheBackend(tempDir.toString());
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Test
    @DisplayName("Should store and read an entry")
    void shouldStoreAndRead() throws Exception {
        backend.write(new CacheEntry("image:1.2.3", new byte[]{7, 8}, NOW, 120, NOW));

        CacheEntry read = backend.read("image:1.2.3").orElseThrow();

        assertArrayEquals(new byte[]{7, 8}, read.getPayload());
        assertEquals(NOW, read.getInsertedAt());
        assertEquals(120, read.getTtlSeconds());
        assertEquals(NOW.plusSeconds(120), read.getExpiresAt());
    }

    @Test
    @DisplayName("Should replace an entry on conflicting key")
    void shouldUpsert() throws Exception {
        backend.write(new CacheEntry("k", new byte[]{1}, NOW, 10, NOW));
        backend.write(new CacheEntry("k", new byte[]{2, 3}, NOW.plusSeconds(5), 20, NOW.plusSeconds(5)));

        List<CacheEntry> entries = backend.scan();

        assertEquals(1, entries.size());
        assertArrayEquals(new byte[]{2, 3}, entries.get(0).getPayload());
        assertEquals(20, entries.get(0).getTtlSeconds());
    }

    @Test
    @DisplayName("Should scan in last-accessed order")
    void shouldScanInAccessOrder() throws Exception {
        backend.write(new CacheEntry("late", new byte[]{1}, NOW, 10, NOW.plusSeconds(30)));
        backend.write(new CacheEntry("early", new byte[]{1}, NOW, 10, NOW.plusSeconds(10)));

        List<CacheEntry> entries = backend.scan();

        assertEquals("early", entries.get(0).getKey());
        assertEquals("late", entries.get(1).getKey());
    }

    @Test
    @DisplayName("Should remove entries")
    void shouldRemoveEntries() throws Exception {
        backend.write(new CacheEntry("a", new byte[]{1}, NOW, 10, NOW));
        backend.write(new CacheEntry("b", new byte[]{1}, NOW, 10, NOW));

        assertTrue(backend.remove("a"));
        assertFalse(backend.remove("a"));
        backend.removeAll();

        assertTrue(backend.read("b").isEmpty());
    }

    @Test
    @DisplayName("Should keep entries across reopen")
    void shouldPersistAcrossReopen() throws Exception {
        backend.write(new CacheEntry("study:9", new byte[]{9}, NOW, 10, NOW));
        backend.close();

        backend = new SqliteCacheBackend(tempDir.toString());

        assertTrue(backend.read("study:9").isPresent());
    }

    @Test
    @DisplayName("Should report failures after close as backend errors")
    void shouldFailAfterClose() {
        backend.close();

        assertThrows(CacheBackendException.class, () -> backend.read("k"));
    }
}
