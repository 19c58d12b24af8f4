/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Snapshot of cache counters.
 */
public class CacheStats {
    private final long hits;
    private final long misses;
    private final long writes;
    private final long deletes;
    private final long evictions;
    private final long expirations;
    private final int itemCount;
    private final long cacheSize;
    private final Instant oldestItem;
    private final Instant newestItem;

    public CacheStats(long hits, long misses, long writes, long deletes, long evictions, long expirations,
                      int itemCount, long cacheSize, Instant oldestItem, Instant newestItem) {
        this.hits = hits;
        this.misses = misses;
        this.writes = writes;
        this.deletes = deletes;
        this.evictions = evictions;
        this.expirations = expirations;
        this.itemCount = itemCount;
        this.cacheSize = cacheSize;
        this.oldestItem = oldestItem;
        this.newestItem = newestItem;
    }

    @JsonProperty("hitRate")
    public double getHitRate() {
        long total = getTotalRequests();
        return total == 0 ? 0.0 : (double) hits / total;
    }

    @JsonProperty("missRate")
    public double getMissRate() {
        long total = getTotalRequests();
        return total == 0 ? 0.0 : (double) misses / total;
    }

    @JsonProperty("totalRequests")
    public long getTotalRequests() {
        return hits + misses;
    }

    @JsonProperty("hits")
    public long getHits() { return hits; }

    @JsonProperty("misses")
    public long getMisses() { return misses; }

    @JsonProperty("writes")
    public long getWrites() { return writes; }

    @JsonProperty("deletes")
    public long getDeletes() { return deletes; }

    /** Entries removed to stay within the size or entry bound. */
    @JsonProperty("evictions")
    public long getEvictions() { return evictions; }

    /** Entries removed because their time-to-live elapsed. */
    @JsonProperty("expirations")
    public long getExpirations() { return expirations; }

    @JsonProperty("itemCount")
    public int getItemCount() { return itemCount; }

    /** Total payload bytes. */
    @JsonProperty("cacheSize")
    public long getCacheSize() { return cacheSize; }

    /** Insertion time of the oldest entry, null when empty. */
    @JsonProperty("oldestItem")
    public Instant getOldestItem() { return oldestItem; }

    @JsonProperty("newestItem")
    public Instant getNewestItem() { return newestItem; }

    @Override
    public String toString() {
        return String.format("CacheStats{items=%d, size=%d, hits=%d, misses=%d, hitRate=%.2f, evictions=%d}",
                itemCount, cacheSize, hits, misses, getHitRate(), evictions);
    }
}
