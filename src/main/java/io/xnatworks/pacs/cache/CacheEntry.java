/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One stored cache value with its expiry bookkeeping. The payload is copied in and out.
 */
public final class CacheEntry {
    private final String key;
    private final byte[] payload;
    private final Instant insertedAt;
    private final long ttlSeconds;
    private final Instant lastAccessed;

    @JsonCreator
    public CacheEntry(@JsonProperty("key") String key,
                      @JsonProperty("payload") byte[] payload,
                      @JsonProperty("insertedAt") Instant insertedAt,
                      @JsonProperty("ttlSeconds") long ttlSeconds,
                      @JsonProperty("lastAccessed") Instant lastAccessed) {
        this.key = key;
        this.payload = payload.clone();
        this.insertedAt = insertedAt;
        this.ttlSeconds = ttlSeconds;
        this.lastAccessed = lastAccessed != null ? lastAccessed : insertedAt;
    }

    public String getKey() { return key; }

    public byte[] getPayload() { return payload.clone(); }

    public Instant getInsertedAt() { return insertedAt; }

    public long getTtlSeconds() { return ttlSeconds; }

    public Instant getLastAccessed() { return lastAccessed; }

    @JsonIgnore
    public int getSize() {
        return payload.length;
    }

    @JsonIgnore
    public Instant getExpiresAt() {
        return insertedAt.plusSeconds(ttlSeconds);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(getExpiresAt());
    }

    @Override
    public String toString() {
        return "CacheEntry{" + key + ", " + payload.length + " bytes, ttl=" + ttlSeconds + "s}";
    }
}
