/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.pacs.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import io.xnatworks.pacs.config.AppConfig;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CacheService.
 */
@DisplayName("CacheService Tests")
class CacheServiceTest {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private CacheService cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        cache = new CacheService(new MemoryCacheBackend(), 1024 * 1024, 1000, 60, 0, clock);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Nested
    @DisplayName("Read and Write Tests")
    class ReadWriteTests {

        @Test
        @DisplayName("Should round-trip JSON values and raw bytes")
        void shouldStoreValues() {
            assertTrue(cache.set("json", Map.of("modality", "CT")));
            assertTrue(cache.set("bytes", new byte[]{1, 2, 3}));

            Optional<Map<String, String>> json = cache.get("json", new TypeReference<Map<String, String>>() {});
            assertEquals("CT", json.orElseThrow().get("modality"));
            assertArrayEquals(new byte[]{1, 2, 3}, cache.get("bytes", byte[].class).orElseThrow());
        }

        @Test
        @DisplayName("Should return copies that callers cannot mutate")
        void shouldReturnCopies() {
            byte[] original = {1, 2, 3};
            cache.set("bytes", original);
            original[0] = 9;

            byte[] first = cache.get("bytes", byte[].class).orElseThrow();
            first[1] = 9;

            assertArrayEquals(new byte[]{1, 2, 3}, cache.get("bytes", byte[].class).orElseThrow());
        }

        @Test
        @DisplayName("Should replace an existing value")
        void shouldReplaceValue() {
            cache.set("k", "first");
            cache.set("k", "second");

            assertEquals("second", cache.get("k", String.class).orElseThrow());
            assertEquals(1, cache.getStats().getItemCount());
        }

        @Test
        @DisplayName("Should reject a non-positive TTL")
        void shouldRejectNonPositiveTtl() {
            assertThrows(IllegalArgumentException.class, () -> cache.set("k", "v", 0));
            assertThrows(IllegalArgumentException.class, () -> cache.set("k", "v", -5));
        }

        @Test
        @DisplayName("Should refuse values larger than the cache bound")
        void shouldRefuseOversizedValues() {
            CacheService small = new CacheService(new MemoryCacheBackend(), 16, 10, 60, 0, clock);

            assertFalse(small.set("big", new byte[17]));
            assertFalse(small.contains("big"));
            assertEquals(0, small.getStats().getWrites());
        }

        @Test
        @DisplayName("Should delete and clear entries")
        void shouldDeleteAndClear() {
            cache.set("a", "1");
            cache.set("b", "2");
            cache.set("c", "3");

            assertTrue(cache.delete("a"));
            assertFalse(cache.delete("a"));
            cache.clear();

            assertEquals(0, cache.getStats().getItemCount());
            assertEquals(0, cache.getStats().getCacheSize());
            assertEquals(0, cache.getStats().getDeletes());
            assertEquals(0, cache.getStats().getWrites());
            assertNull(cache.getStats().getNewestItem());
        }

        @Test
        @DisplayName("Should start counting afresh after a clear")
        void shouldResetStatsOnClear() {
            cache.set("a", "1");
            cache.get("a", String.class);
            cache.get("missing", String.class);
            cache.clear();

            cache.get("a", String.class);

            CacheStats stats = cache.getStats();
            assertEquals(0, stats.getHits());
            assertEquals(1, stats.getMisses());
            assertEquals(0, stats.getWrites());
            assertEquals(0.0, stats.getHitRate());
        }

        @Test
        @DisplayName("Should list live keys by prefix in sorted order")
        void shouldListKeysByPrefix() {
            cache.set("study:2", "b");
            cache.set("study:1", "a");
            cache.set("image:1", "x");
            cache.set("study:3", "c", 1);
            clock.advance(Duration.ofSeconds(2));

            assertEquals(Arrays.asList("study:1", "study:2"), cache.keys("study:"));
        }
    }

    @Nested
    @DisplayName("Expiry Tests")
    class ExpiryTests {

        @Test
        @DisplayName("Should expire entries after their TTL and count a miss")
        void shouldExpireEntries() {
            cache.set("k", "v", 10);

            clock.advance(Duration.ofSeconds(9));
            assertTrue(cache.get("k", String.class).isPresent());

            clock.advance(Duration.ofSeconds(1));
            assertTrue(cache.get("k", String.class).isEmpty());

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.getHits());
            assertEquals(1, stats.getMisses());
            assertEquals(1, stats.getExpirations());
            assertEquals(0, stats.getItemCount());
        }

        @Test
        @DisplayName("Should expire with the wall clock")
        void shouldExpireWithWallClock() throws InterruptedException {
            CacheService real = new CacheService(new MemoryCacheBackend(), 1024, 10, 60, 0, Clock.systemUTC());
            real.set("k", "v", 1);

            Thread.sleep(1100);

            assertTrue(real.get("k", String.class).isEmpty());
            assertEquals(1, real.getStats().getMisses());
        }

        @Test
        @DisplayName("Should not report expired entries as present")
        void shouldNotContainExpiredEntries() {
            cache.set("k", "v", 5);
            clock.advance(Duration.ofSeconds(5));

            assertFalse(cache.contains("k"));
            assertFalse(cache.touch("k"));
        }

        @Test
        @DisplayName("Should sweep expired entries")
        void shouldSweepExpiredEntries() {
            cache.set("short", "v", 5);
            cache.set("long", "v", 500);
            clock.advance(Duration.ofSeconds(10));

            assertEquals(1, cache.sweepExpired());
            assertEquals(1, cache.getStats().getItemCount());
            assertEquals(1, cache.getStats().getExpirations());
            assertEquals(0, cache.getStats().getEvictions());
        }

        @Test
        @DisplayName("Should extend expiry from now when touched with a TTL")
        void shouldExtendExpiry() {
            cache.set("k", "v", 10);
            clock.advance(Duration.ofSeconds(8));

            assertTrue(cache.touch("k", 10));
            clock.advance(Duration.ofSeconds(9));

            assertTrue(cache.get("k", String.class).isPresent());
            clock.advance(Duration.ofSeconds(1));
            assertTrue(cache.get("k", String.class).isEmpty());
        }

        @Test
        @DisplayName("Should count a touched TTL from the exact touch instant")
        void shouldExtendExpiryFromSubSecondTouch() {
            cache.set("k", "v", 10);
            clock.advance(Duration.ofMillis(8900));

            assertTrue(cache.touch("k", 10));
            clock.advance(Duration.ofMillis(9500));

            assertTrue(cache.get("k", String.class).isPresent());
            clock.advance(Duration.ofMillis(500));
            assertTrue(cache.get("k", String.class).isEmpty());
        }

        @Test
        @DisplayName("Should report a touched entry as the newest insertion")
        void shouldTreatTouchAsInsertion() {
            cache.set("a", "1");
            clock.advance(Duration.ofSeconds(5));
            cache.set("b", "2");
            clock.advance(Duration.ofSeconds(5));

            assertTrue(cache.touch("a", 30));

            assertEquals(START.plusSeconds(5), cache.getStats().getOldestItem());
            assertEquals(START.plusSeconds(10), cache.getStats().getNewestItem());
        }
    }

    @Nested
    @DisplayName("Eviction Tests")
    class EvictionTests {

        @Test
        @DisplayName("Should evict the least recently used entry when over the entry bound")
        void shouldEvictLeastRecentlyUsed() {
            CacheService bounded = new CacheService(new MemoryCacheBackend(), 1024, 3, 60, 0, clock);
            bounded.set("a", "1");
            bounded.set("b", "2");
            bounded.set("c", "3");

            bounded.get("a", String.class);
            bounded.set("d", "4");

            assertTrue(bounded.contains("a"));
            assertFalse(bounded.contains("b"));
            assertTrue(bounded.contains("c"));
            assertTrue(bounded.contains("d"));
            assertEquals(1, bounded.getStats().getEvictions());
        }

        @Test
        @DisplayName("Should evict until the byte bound holds")
        void shouldEvictToByteBound() {
            CacheService bounded = new CacheService(new MemoryCacheBackend(), 100, 100, 60, 0, clock);
            bounded.set("a", new byte[40]);
            bounded.set("b", new byte[40]);
            bounded.touch("a");
            bounded.set("c", new byte[40]);

            assertTrue(bounded.contains("a"));
            assertFalse(bounded.contains("b"));
            assertTrue(bounded.getStats().getCacheSize() <= 100);
        }

        @Test
        @DisplayName("Should not refresh recency on contains")
        void shouldNotRefreshOnContains() {
            CacheService bounded = new CacheService(new MemoryCacheBackend(), 1024, 2, 60, 0, clock);
            bounded.set("a", "1");
            bounded.set("b", "2");

            bounded.contains("a");
            bounded.set("c", "3");

            assertFalse(bounded.contains("a"));
            assertEquals(0, bounded.getStats().getTotalRequests());
        }
    }

    @Nested
    @DisplayName("Statistics Tests")
    class StatisticsTests {

        @Test
        @DisplayName("Should compute hit and miss rates")
        void shouldComputeRates() {
            cache.set("k", "v");
            cache.get("k", String.class);
            cache.get("k", String.class);
            cache.get("k", String.class);
            cache.get("missing", String.class);

            CacheStats stats = cache.getStats();

            assertEquals(4, stats.getTotalRequests());
            assertEquals(0.75, stats.getHitRate(), 1e-9);
            assertEquals(0.25, stats.getMissRate(), 1e-9);
        }

        @Test
        @DisplayName("Should report zero rates for an unused cache")
        void shouldReportZeroRates() {
            CacheStats stats = cache.getStats();

            assertEquals(0.0, stats.getHitRate());
            assertNull(stats.getOldestItem());
            assertNull(stats.getNewestItem());
        }

        @Test
        @DisplayName("Should track oldest and newest insertion times")
        void shouldTrackInsertionTimes() {
            cache.set("a", "1");
            clock.advance(Duration.ofSeconds(5));
            cache.set("b", "2");

            assertEquals(START, cache.getStats().getOldestItem());
            assertEquals(START.plusSeconds(5), cache.getStats().getNewestItem());
        }

        @Test
        @DisplayName("Should fall back to the previous insertion when the newest entry goes")
        void shouldRecomputeNewestAfterRemoval() {
            cache.set("a", "1");
            clock.advance(Duration.ofSeconds(5));
            cache.set("b", "2");
            clock.advance(Duration.ofSeconds(5));
            cache.set("c", "3");

            cache.delete("a");
            assertEquals(START.plusSeconds(10), cache.getStats().getNewestItem());

            cache.delete("c");
            assertEquals(START.plusSeconds(5), cache.getStats().getOldestItem());
            assertEquals(START.plusSeconds(5), cache.getStats().getNewestItem());

            cache.delete("b");
            assertNull(cache.getStats().getNewestItem());
        }
    }

    @Nested
    @DisplayName("Configuration Tests")
    class ConfigurationTests {

        @Test
        @DisplayName("Should create the configured backend")
        void shouldCreateConfiguredBackend() throws Exception {
            AppConfig config = new AppConfig();
            config.setDataDirectory(tempDir.toString());

            try (CacheService memory = CacheService.create(config)) {
                assertEquals("memory", memory.getBackendName());
                assertEquals(2L * 1024 * 1024 * 1024, memory.getMaxBytes());
            }

            config.getCache().setProvider("FileSystem");
            try (CacheService fs = CacheService.create(config)) {
                assertEquals("filesystem", fs.getBackendName());
            }

            config.getCache().setProvider(AppConfig.CacheConfig.PROVIDER_SQLITE);
            try (CacheService sqlite = CacheService.create(config)) {
                assertEquals("sqlite", sqlite.getBackendName());
            }
            assertTrue(tempDir.resolve("cache").resolve(SqliteCacheBackend.DB_FILE).toFile().exists());
        }

        @Test
        @DisplayName("Should store nothing when the cache is disabled")
        void shouldStoreNothingWhenDisabled() throws Exception {
            AppConfig config = new AppConfig();
            config.setDataDirectory(tempDir.toString());
            config.getCache().setProvider(AppConfig.CacheConfig.PROVIDER_SQLITE);
            config.getCache().setEnabled(false);

            try (CacheService disabled = CacheService.create(config)) {
                assertFalse(disabled.isEnabled());
                assertFalse(disabled.set("k", "v"));
                assertTrue(disabled.get("k", String.class).isEmpty());
                assertFalse(disabled.contains("k"));
                assertFalse(disabled.touch("k", 60));

                CacheStats stats = disabled.getStats();
                assertEquals(0, stats.getItemCount());
                assertEquals(0, stats.getWrites());
                assertEquals(0, stats.getMisses());
            }
            assertFalse(tempDir.resolve("cache").resolve(SqliteCacheBackend.DB_FILE).toFile().exists());
        }

        @Test
        @DisplayName("Should sweep expired entries in the background once created")
        void shouldSweepInBackground() throws Exception {
            AppConfig config = new AppConfig();
            config.setDataDirectory(tempDir.toString());
            config.getCache().setSweepInterval(1);

            try (CacheService swept = CacheService.create(config)) {
                assertTrue(swept.set("k", "v", 1));

                long deadline = System.currentTimeMillis() + 5000;
                while (swept.getStats().getItemCount() > 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(50);
                }

                CacheStats stats = swept.getStats();
                assertEquals(0, stats.getItemCount());
                assertEquals(1, stats.getExpirations());
                assertEquals(0, stats.getMisses());
            }
        }

        @Test
        @DisplayName("Should reject an unknown provider")
        void shouldRejectUnknownProvider() {
            AppConfig config = new AppConfig();
            config.getCache().setProvider("redis");

            assertThrows(IllegalArgumentException.class, () -> CacheService.create(config));
        }

        @Test
        @DisplayName("Should reject non-positive bounds")
        void shouldRejectBadBounds() {
            assertThrows(IllegalArgumentException.class,
                    () -> new CacheService(new MemoryCacheBackend(), 0, 10, 60, 0, clock));
            assertThrows(IllegalArgumentException.class,
                    () -> new CacheService(new MemoryCacheBackend(), 10, 0, 60, 0, clock));
            assertThrows(IllegalArgumentException.class,
                    () -> new CacheService(new MemoryCacheBackend(), 10, 10, 0, 0, clock));
        }
    }

    @Nested
    @DisplayName("Concurrency Tests")
    class ConcurrencyTests {

        private static final int THREADS = 8;
        private static final int VALUE_SIZE = 256;

        /**
         * Hammer one key from several threads. Every successful read must hold bytes from a
         * single writer and every read must be counted as exactly one hit or one miss.
         */
        private void hammer(CacheService shared, int opsPerThread) throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(THREADS);
            CountDownLatch startGate = new CountDownLatch(1);
            AtomicLong reads = new AtomicLong();
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < THREADS; t++) {
                    final byte writer = (byte) (t + 1);
                    futures.add(pool.submit(() -> {
                        startGate.await();
                        byte[] value = new byte[VALUE_SIZE];
                        Arrays.fill(value, writer);
                        for (int i = 0; i < opsPerThread; i++) {
                            switch (i % 4) {
                                case 0:
                                    shared.set("shared", value);
                                    break;
                                case 3:
                                    shared.delete("shared");
                                    break;
                                default:
                                    reads.incrementAndGet();
                                    Optional<byte[]> read = shared.get("shared", byte[].class);
                                    if (read.isPresent()) {
                                        byte[] bytes = read.get();
                                        assertEquals(VALUE_SIZE, bytes.length);
                                        for (byte b : bytes) {
                                            assertEquals(bytes[0], b, "read mixed bytes from two writers");
                                        }
                                    }
                                    break;
                            }
                        }
                        return null;
                    }));
                }
                startGate.countDown();
                for (Future<?> future : futures) {
                    future.get(60, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            CacheStats stats = shared.getStats();
            assertEquals(reads.get(), stats.getHits() + stats.getMisses());
            assertTrue(stats.getItemCount() <= 1);
            assertEquals(stats.getItemCount() == 0 ? 0 : VALUE_SIZE, stats.getCacheSize());
        }

        @Test
        @DisplayName("Should keep reads whole under concurrent writes in memory")
        void shouldStayConsistentInMemory() throws Exception {
            try (CacheService shared = new CacheService(new MemoryCacheBackend(), 1024 * 1024, 100, 3600, 0,
                    Clock.systemUTC())) {
                hammer(shared, 2000);
            }
        }

        @Test
        @DisplayName("Should keep reads whole under concurrent writes on disk")
        void shouldStayConsistentOnDisk() throws Exception {
            try (CacheService shared = new CacheService(new FileSystemCacheBackend(tempDir.resolve("shared")),
                    1024 * 1024, 100, 3600, 0, Clock.systemUTC())) {
                hammer(shared, 200);
            }
        }
    }

    @Nested
    @DisplayName("Persistence Tests")
    class PersistenceTests {

        @Test
        @DisplayName("Should reload live entries and drop expired ones on restart")
        void shouldReloadFromBackend() throws Exception {
            Path dir = tempDir.resolve("persist");
            try (CacheService first = new CacheService(new FileSystemCacheBackend(dir), 1024, 10, 60, 0, clock)) {
                first.set("keep", List.of("a", "b"), 100);
                first.set("drop", "x", 5);
            }

            clock.advance(Duration.ofSeconds(10));
            try (CacheService second = new CacheService(new FileSystemCacheBackend(dir), 1024, 10, 60, 0, clock)) {
                assertTrue(second.contains("keep"));
                assertFalse(second.contains("drop"));
                assertEquals(List.of("a", "b"), second.get("keep", new TypeReference<List<String>>() {}).orElseThrow());
                assertEquals(1, second.getStats().getItemCount());
            }
        }
    }
}
