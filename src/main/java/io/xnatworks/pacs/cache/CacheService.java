/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.xnatworks.pacs.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Typed key/value cache with per-entry time-to-live and a size bound, over a pluggable
 * {@link CacheBackend}.
 *
 * <p>Values are stored as JSON (byte arrays are stored as-is), so every read returns a fresh
 * copy. Expired entries are removed lazily when read and by an optional periodic sweep.
 * When the byte or entry bound is exceeded the least recently used entries are evicted.
 * Backend failures are logged and the affected entry is treated as absent.</p>
 *
 * <p>All index and backend access is serialized by one lock. A disabled cache stores nothing:
 * writes return false and reads are empty.</p>
 */
public class CacheService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CacheService.class);

    private final CacheBackend backend;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long maxBytes;
    private final int maxEntries;
    private final long defaultTtlSeconds;
    private final int sweepIntervalSeconds;
    private final boolean enabled;

    private final ReentrantLock lock = new ReentrantLock();
    // Least recently used first
    private final LinkedHashMap<String, IndexEntry> index = new LinkedHashMap<>();
    // Oldest insertion first
    private final LinkedHashMap<String, Instant> insertions = new LinkedHashMap<>();
    private String newestKey;
    private Instant newestInsertion;
    private long currentBytes;

    private long hits;
    private long misses;
    private long writes;
    private long deletes;
    private long evictions;
    private long expirations;

    private ScheduledExecutorService scheduler;

    public CacheService(CacheBackend backend, AppConfig.CacheConfig config) {
        this(backend, config.getMaxCacheSizeBytes(), config.getMaxEntries(), config.getDefaultTtl(),
                config.getSweepInterval(), Clock.systemUTC(), config.isEnabled());
    }

    public CacheService(CacheBackend backend, long maxBytes, int maxEntries, long defaultTtlSeconds,
                        int sweepIntervalSeconds, Clock clock) {
        this(backend, maxBytes, maxEntries, defaultTtlSeconds, sweepIntervalSeconds, clock, true);
    }

    public CacheService(CacheBackend backend, long maxBytes, int maxEntries, long defaultTtlSeconds,
                        int sweepIntervalSeconds, Clock clock, boolean enabled) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("Cache size bound must be positive: " + maxBytes);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Entry bound must be positive: " + maxEntries);
        }
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException("Default TTL must be positive: " + defaultTtlSeconds);
        }
        this.backend = Objects.requireNonNull(backend, "backend");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxBytes = maxBytes;
        this.maxEntries = maxEntries;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.sweepIntervalSeconds = sweepIntervalSeconds;
        this.enabled = enabled;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        if (enabled) {
            loadIndex();
        } else {
            log.info("Cache is disabled; nothing will be stored");
        }
    }

    /**
     * Create the cache described by the configuration, including its backend, and start the
     * periodic sweep when {@code sweep_interval} is positive. A disabled cache gets an in-memory
     * backend so no persistent store is opened.
     *
     * @throws CacheBackendException if a persistent backend cannot be opened
     * @throws IllegalArgumentException if the provider is unknown
     */
    public static CacheService create(AppConfig config) throws CacheBackendException {
        CacheBackend backend = config.getCache().isEnabled() ? createBackend(config) : new MemoryCacheBackend();
        CacheService service = new CacheService(backend, config.getCache());
        service.start();
        return service;
    }

    static CacheBackend createBackend(AppConfig config) throws CacheBackendException {
        AppConfig.CacheConfig cacheConfig = config.getCache();
        String provider = cacheConfig.getProvider() == null
                ? AppConfig.CacheConfig.PROVIDER_MEMORY
                : cacheConfig.getProvider().toLowerCase(Locale.ROOT);

        Path directory = Paths.get(cacheConfig.getDirectory());
        if (!directory.isAbsolute()) {
            directory = Paths.get(config.getDataDirectory()).resolve(directory);
        }

        switch (provider) {
            case AppConfig.CacheConfig.PROVIDER_MEMORY:
                return new MemoryCacheBackend();
            case AppConfig.CacheConfig.PROVIDER_FILESYSTEM:
                return new FileSystemCacheBackend(directory);
            case AppConfig.CacheConfig.PROVIDER_SQLITE:
                return new SqliteCacheBackend(directory.toString());
            default:
                throw new IllegalArgumentException("Unknown cache provider: " + cacheConfig.getProvider());
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Start the periodic sweep of expired entries, if a sweep interval is configured.
     */
    public void start() {
        if (!enabled || sweepIntervalSeconds <= 0 || scheduler != null) {
            return;
        }
        log.info("Starting cache sweep every {} seconds ({} backend)", sweepIntervalSeconds, backend.getName());
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-sweep");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::runSweep, sweepIntervalSeconds, sweepIntervalSeconds, TimeUnit.SECONDS);
    }

    @Override
    public void close() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
        lock.lock();
        try {
            backend.close();
        } finally {
            lock.unlock();
        }
        log.info("Cache closed: {}", getStats());
    }

    private void runSweep() {
        try {
            int removed = sweepExpired();
            if (removed > 0) {
                log.debug("Cache sweep removed {} expired entries", removed);
            }
        } catch (RuntimeException e) {
            log.error("Cache sweep failed: {}", e.getMessage(), e);
        }
    }

    // ========================================================================
    // Reads
    // ========================================================================

    public <T> Optional<T> get(String key, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return lookup(key, payload -> {
            if (type == byte[].class) {
                return type.cast(payload);
            }
            return objectMapper.readValue(payload, type);
        });
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        Objects.requireNonNull(type, "type");
        return lookup(key, payload -> objectMapper.readValue(payload, type));
    }

    /**
     * True if a live entry exists. Does not count as a request and does not refresh recency.
     */
    public boolean contains(String key) {
        if (!enabled) {
            return false;
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            IndexEntry entry = index.get(key);
            return entry != null && now.isBefore(entry.expiresAt);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Live keys starting with the prefix, sorted.
     */
    public List<String> keys(String prefix) {
        Instant now = clock.instant();
        List<String> result = new ArrayList<>();
        lock.lock();
        try {
            for (Map.Entry<String, IndexEntry> e : index.entrySet()) {
                if (e.getKey().startsWith(prefix) && now.isBefore(e.getValue().expiresAt)) {
                    result.add(e.getKey());
                }
            }
        } finally {
            lock.unlock();
        }
        Collections.sort(result);
        return result;
    }

    private <T> Optional<T> lookup(String key, PayloadReader<T> reader) {
        Objects.requireNonNull(key, "key");
        if (!enabled) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            IndexEntry entry = index.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (!now.isBefore(entry.expiresAt)) {
                log.debug("Cache entry {} expired at {}", key, entry.expiresAt);
                removeEntry(key);
                expirations++;
                misses++;
                return Optional.empty();
            }

            Optional<CacheEntry> stored;
            try {
                stored = backend.read(key);
            } catch (CacheBackendException e) {
                log.warn("Cache backend read failed for {}: {}", key, e.getMessage(), e);
                forget(key);
                misses++;
                return Optional.empty();
            }
            if (stored.isEmpty()) {
                log.warn("Cache entry {} missing from {} backend", key, backend.getName());
                forget(key);
                misses++;
                return Optional.empty();
            }

            T value;
            try {
                value = reader.read(stored.get().getPayload());
            } catch (IOException e) {
                log.warn("Could not decode cached value for {}: {}", key, e.getMessage());
                removeEntry(key);
                misses++;
                return Optional.empty();
            }

            entry.lastAccessed = now;
            markRecent(key, entry);
            hits++;
            return Optional.ofNullable(value);
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Writes
    // ========================================================================

    public boolean set(String key, Object value) {
        return set(key, value, defaultTtlSeconds);
    }

    /**
     * Store a value, replacing any previous one.
     *
     * @return false if the value was not stored (larger than the cache bound, or a backend failure)
     * @throws IllegalArgumentException if the TTL is not positive or the value cannot be serialized
     */
    public boolean set(String key, Object value, long ttlSeconds) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("TTL must be positive: " + ttlSeconds);
        }
        if (!enabled) {
            return false;
        }

        byte[] payload = encode(key, value);
        if (payload.length > maxBytes) {
            log.warn("Not caching {}: {} bytes exceeds cache size bound of {} bytes", key, payload.length, maxBytes);
            return false;
        }

        Instant now = clock.instant();
        CacheEntry stored = new CacheEntry(key, payload, now, ttlSeconds, now);

        lock.lock();
        try {
            try {
                backend.write(stored);
            } catch (CacheBackendException e) {
                log.warn("Cache backend write failed for {}: {}", key, e.getMessage(), e);
                removeEntry(key);
                return false;
            }

            IndexEntry previous = index.remove(key);
            if (previous != null) {
                currentBytes -= previous.size;
            }
            index.put(key, new IndexEntry(payload.length, stored.getExpiresAt(), now));
            recordInsertion(key, now);
            currentBytes += payload.length;
            writes++;

            enforceBounds();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if a live or expired entry was removed
     */
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            IndexEntry removed = removeEntry(key);
            if (removed != null) {
                deletes++;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            try {
                backend.removeAll();
            } catch (CacheBackendException e) {
                log.warn("Cache backend clear failed: {}", e.getMessage(), e);
            }
            index.clear();
            insertions.clear();
            newestKey = null;
            newestInsertion = null;
            currentBytes = 0;
            resetStats();
            log.info("Cache cleared");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark a live entry as recently used.
     */
    public boolean touch(String key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            IndexEntry entry = index.get(key);
            if (entry == null || !now.isBefore(entry.expiresAt)) {
                return false;
            }
            entry.lastAccessed = now;
            markRecent(key, entry);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark a live entry as recently used and make it expire {@code ttlSeconds} from now.
     */
    public boolean touch(String key, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("TTL must be positive: " + ttlSeconds);
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            IndexEntry entry = index.get(key);
            if (entry == null || !now.isBefore(entry.expiresAt)) {
                return false;
            }
            Optional<CacheEntry> stored = backend.read(key);
            if (stored.isEmpty()) {
                forget(key);
                return false;
            }
            CacheEntry extended = new CacheEntry(key, stored.get().getPayload(), now, ttlSeconds, now);
            backend.write(extended);

            entry.expiresAt = extended.getExpiresAt();
            entry.lastAccessed = now;
            recordInsertion(key, now);
            markRecent(key, entry);
            return true;
        } catch (CacheBackendException e) {
            log.warn("Cache backend failed while touching {}: {}", key, e.getMessage(), e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        lock.lock();
        try {
            List<String> expired = new ArrayList<>();
            for (Map.Entry<String, IndexEntry> e : index.entrySet()) {
                if (!now.isBefore(e.getValue().expiresAt)) {
                    expired.add(e.getKey());
                }
            }
            for (String key : expired) {
                removeEntry(key);
                expirations++;
            }
            return expired.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            Instant oldest = insertions.isEmpty() ? null : insertions.values().iterator().next();
            return new CacheStats(hits, misses, writes, deletes, evictions, expirations,
                    index.size(), currentBytes, oldest, newestInsertion);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Zero the request and removal counters. Entries are kept.
     */
    public void resetStats() {
        lock.lock();
        try {
            hits = 0;
            misses = 0;
            writes = 0;
            deletes = 0;
            evictions = 0;
            expirations = 0;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getBackendName() {
        return backend.getName();
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    // ========================================================================
    // Internals (callers hold the lock)
    // ========================================================================

    private void loadIndex() {
        List<CacheEntry> stored;
        try {
            stored = backend.scan();
        } catch (CacheBackendException e) {
            log.warn("Could not scan {} cache backend, starting empty: {}", backend.getName(), e.getMessage(), e);
            return;
        }
        if (stored.isEmpty()) {
            return;
        }

        Instant now = clock.instant();
        lock.lock();
        try {
            stored.sort(Comparator.comparing(CacheEntry::getLastAccessed));
            int expired = 0;
            for (CacheEntry entry : stored) {
                if (entry.isExpired(now)) {
                    removeFromBackend(entry.getKey());
                    expired++;
                    continue;
                }
                index.put(entry.getKey(), new IndexEntry(entry.getSize(), entry.getExpiresAt(), entry.getLastAccessed()));
                currentBytes += entry.getSize();
            }

            stored.sort(Comparator.comparing(CacheEntry::getInsertedAt));
            for (CacheEntry entry : stored) {
                if (index.containsKey(entry.getKey())) {
                    recordInsertion(entry.getKey(), entry.getInsertedAt());
                }
            }

            enforceBounds();
            log.info("Loaded {} cache entries ({} bytes) from {} backend, discarded {} expired",
                    index.size(), currentBytes, backend.getName(), expired);
        } finally {
            lock.unlock();
        }
    }

    private void enforceBounds() {
        Iterator<Map.Entry<String, IndexEntry>> it = index.entrySet().iterator();
        while ((currentBytes > maxBytes || index.size() > maxEntries) && it.hasNext()) {
            Map.Entry<String, IndexEntry> eldest = it.next();
            it.remove();
            dropInsertion(eldest.getKey());
            currentBytes -= eldest.getValue().size;
            evictions++;
            removeFromBackend(eldest.getKey());
            log.debug("Evicted {} ({} bytes)", eldest.getKey(), eldest.getValue().size);
        }
    }

    private void markRecent(String key, IndexEntry entry) {
        index.remove(key);
        index.put(key, entry);
    }

    private IndexEntry removeEntry(String key) {
        IndexEntry removed = forget(key);
        removeFromBackend(key);
        return removed;
    }

    private IndexEntry forget(String key) {
        IndexEntry removed = index.remove(key);
        dropInsertion(key);
        if (removed != null) {
            currentBytes -= removed.size;
        }
        return removed;
    }

    private void recordInsertion(String key, Instant at) {
        insertions.remove(key);
        insertions.put(key, at);
        newestKey = key;
        newestInsertion = at;
    }

    private void dropInsertion(String key) {
        insertions.remove(key);
        if (key.equals(newestKey)) {
            // Only the removal of the newest entry walks the insertion order
            newestKey = null;
            newestInsertion = null;
            for (Map.Entry<String, Instant> e : insertions.entrySet()) {
                newestKey = e.getKey();
                newestInsertion = e.getValue();
            }
        }
    }

    private void removeFromBackend(String key) {
        try {
            backend.remove(key);
        } catch (CacheBackendException e) {
            log.warn("Cache backend remove failed for {}: {}", key, e.getMessage(), e);
        }
    }

    private byte[] encode(String key, Object value) {
        if (value instanceof byte[]) {
            return ((byte[]) value).clone();
        }
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for " + key + " cannot be serialized: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface PayloadReader<T> {
        T read(byte[] payload) throws IOException;
    }

    private static final class IndexEntry {
        private final long size;
        private Instant expiresAt;
        private Instant lastAccessed;

        private IndexEntry(long size, Instant expiresAt, Instant lastAccessed) {
            this.size = size;
            this.expiresAt = expiresAt;
            this.lastAccessed = lastAccessed;
        }
    }
}
