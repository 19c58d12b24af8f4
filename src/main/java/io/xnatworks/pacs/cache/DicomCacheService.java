/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import io.xnatworks.pacs.config.AppConfig;
import io.xnatworks.pacs.dicom.DicomMetadata;
import io.xnatworks.pacs.dicom.DicomParseException;
import io.xnatworks.pacs.model.DicomStudy;
import io.xnatworks.pacs.model.SearchParameters;
import io.xnatworks.pacs.validation.DicomValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * DICOM views over a {@link CacheService}. Study metadata, image bytes and search results
 * live in the same store under the key prefixes {@code study:}, {@code image:} and {@code search:}.
 */
public class DicomCacheService {
    private static final Logger log = LoggerFactory.getLogger(DicomCacheService.class);

    public static final String STUDY_PREFIX = "study:";
    public static final String IMAGE_PREFIX = "image:";
    public static final String SEARCH_PREFIX = "search:";

    public static final long DEFAULT_MAX_IMAGE_SIZE = 10L * 1024 * 1024;

    private static final TypeReference<List<DicomStudy>> STUDY_LIST = new TypeReference<List<DicomStudy>>() {};

    private final CacheService cache;
    private final long maxImageSize;
    private final long searchTtlSeconds;

    public DicomCacheService(CacheService cache) {
        this(cache, DEFAULT_MAX_IMAGE_SIZE, Math.max(1, cache.getDefaultTtlSeconds() / 2));
    }

    public DicomCacheService(CacheService cache, AppConfig.CacheConfig config) {
        this(cache, config.getMaxImageSizeBytes(), config.getEffectiveSearchTtl());
    }

    public DicomCacheService(CacheService cache, long maxImageSize, long searchTtlSeconds) {
        this.cache = cache;
        this.maxImageSize = maxImageSize;
        this.searchTtlSeconds = searchTtlSeconds;
    }

    /**
     * Loads study metadata when it is not cached.
     */
    @FunctionalInterface
    public interface StudyLoader {
        DicomMetadata load(String studyInstanceUid) throws IOException, DicomParseException;
    }

    // ========================================================================
    // Study metadata
    // ========================================================================

    /**
     * Cache metadata under its study instance UID.
     *
     * @return false if the metadata has no usable study UID or was not stored
     */
    public boolean cacheStudyMetadata(DicomMetadata metadata) {
        return cacheStudyMetadata(metadata, cache.getDefaultTtlSeconds());
    }

    public boolean cacheStudyMetadata(DicomMetadata metadata, long ttlSeconds) {
        String uid = metadata.getStudy().getInstanceUid();
        if (!DicomValidator.validateStudyInstanceUID(uid)) {
            log.warn("Not caching study metadata without a valid Study Instance UID: {}", uid);
            return false;
        }
        boolean stored = cache.set(studyKey(uid), metadata, ttlSeconds);
        if (stored) {
            log.debug("Cached study metadata for {}", uid);
        }
        return stored;
    }

    public Optional<DicomMetadata> getCachedStudyMetadata(String studyInstanceUid) {
        return cache.get(studyKey(studyInstanceUid), DicomMetadata.class);
    }

    public boolean hasStudyMetadata(String studyInstanceUid) {
        return cache.contains(studyKey(studyInstanceUid));
    }

    /**
     * Return cached metadata, or load it, cache it and return it.
     */
    public DicomMetadata getOrLoadStudyMetadata(String studyInstanceUid, StudyLoader loader)
            throws IOException, DicomParseException {
        Optional<DicomMetadata> cached = getCachedStudyMetadata(studyInstanceUid);
        if (cached.isPresent()) {
            return cached.get();
        }
        log.debug("Study {} not cached, loading", studyInstanceUid);
        DicomMetadata loaded = loader.load(studyInstanceUid);
        cacheStudyMetadata(loaded);
        return loaded;
    }

    /**
     * Remove the study metadata entry. Image entries of the study are left in place.
     */
    public boolean invalidateStudy(String studyInstanceUid) {
        boolean removed = cache.delete(studyKey(studyInstanceUid));
        log.debug("Invalidated study {} (present: {})", studyInstanceUid, removed);
        return removed;
    }

    // ========================================================================
    // Image data
    // ========================================================================

    /**
     * Cache image bytes under the SOP instance UID. Images above the configured size are skipped.
     */
    public boolean cacheImageData(String sopInstanceUid, byte[] imageData) {
        if (imageData.length > maxImageSize) {
            log.debug("Image {} too large to cache ({} bytes, limit {})", sopInstanceUid, imageData.length, maxImageSize);
            return false;
        }
        return cache.set(imageKey(sopInstanceUid), imageData);
    }

    public Optional<byte[]> getCachedImageData(String sopInstanceUid) {
        return cache.get(imageKey(sopInstanceUid), byte[].class);
    }

    public boolean hasImageData(String sopInstanceUid) {
        return cache.contains(imageKey(sopInstanceUid));
    }

    // ========================================================================
    // Search results
    // ========================================================================

    public boolean cacheSearchResults(String searchKey, List<DicomStudy> results) {
        return cacheSearchResults(searchKey, results, searchTtlSeconds);
    }

    public boolean cacheSearchResults(String searchKey, List<DicomStudy> results, long ttlSeconds) {
        return cache.set(searchKey(searchKey), results, ttlSeconds);
    }

    public boolean cacheSearchResults(SearchParameters params, List<DicomStudy> results) {
        return cacheSearchResults(params.toCacheKey(), results);
    }

    public Optional<List<DicomStudy>> getCachedSearchResults(String searchKey) {
        return cache.get(searchKey(searchKey), STUDY_LIST);
    }

    public Optional<List<DicomStudy>> getCachedSearchResults(SearchParameters params) {
        return getCachedSearchResults(params.toCacheKey());
    }

    // ========================================================================

    public CacheStats getStats() {
        return cache.getStats();
    }

    public CacheService getCacheService() {
        return cache;
    }

    public long getMaxImageSize() {
        return maxImageSize;
    }

    public long getSearchTtlSeconds() {
        return searchTtlSeconds;
    }

    static String studyKey(String studyInstanceUid) {
        return STUDY_PREFIX + studyInstanceUid;
    }

    static String imageKey(String sopInstanceUid) {
        return IMAGE_PREFIX + sopInstanceUid;
    }

    static String searchKey(String searchKey) {
        return SEARCH_PREFIX + searchKey;
    }
}
