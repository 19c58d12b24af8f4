/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.cache;

/**
 * Storage failure inside a {@link CacheBackend}. The cache service recovers from it by
 * treating the entry as absent.
 */
public class CacheBackendException extends Exception {
    public CacheBackendException(String message) {
        super(message);
    }

    public CacheBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
