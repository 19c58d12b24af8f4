/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-process backend. Contents are lost when the process exits.
 */
public class MemoryCacheBackend implements CacheBackend {
    private final Map<String, CacheEntry> entries = new HashMap<>();

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public Optional<CacheEntry> read(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void write(CacheEntry entry) {
        entries.put(entry.getKey(), entry);
    }

    @Override
    public boolean remove(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public void removeAll() {
        entries.clear();
    }

    @Override
    public List<CacheEntry> scan() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public void close() {
        entries.clear();
    }
}
