/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.cache;

import java.util.List;
import java.util.Optional;

/**
 * Storage for cache entries. Backends only persist entries; expiry, eviction and statistics
 * belong to {@link CacheService}, which serializes all calls.
 */
public interface CacheBackend extends AutoCloseable {

    /**
     * Provider name as used in configuration.
     */
    String getName();

    Optional<CacheEntry> read(String key) throws CacheBackendException;

    /**
     * Insert or replace the entry for its key.
     */
    void write(CacheEntry entry) throws CacheBackendException;

    /**
     * @return true if an entry was removed
     */
    boolean remove(String key) throws CacheBackendException;

    void removeAll() throws CacheBackendException;

    /**
     * All stored entries, used to rebuild the index when the cache starts.
     */
    List<CacheEntry> scan() throws CacheBackendException;

    @Override
    void close();
}
