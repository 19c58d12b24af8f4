/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.cache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Stores each entry as one JSON file named after the lowercase hex form of its UTF-8 key, so
 * keys that differ only in case never share a file on case-insensitive file systems.
 * Writes go to a temporary file that is then moved into place.
 */
public class FileSystemCacheBackend implements CacheBackend {
    private static final Logger log = LoggerFactory.getLogger(FileSystemCacheBackend.class);
    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final int MAX_NAME_LENGTH = 200;

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSystemCacheBackend(Path directory) throws CacheBackendException {
        this.directory = directory;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CacheBackendException("Cannot create cache directory " + directory, e);
        }
        log.info("Filesystem cache backend at: {}", directory.toAbsolutePath());
    }

    @Override
    public String getName() {
        return "filesystem";
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public Optional<CacheEntry> read(String key) throws CacheBackendException {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), CacheEntry.class));
        } catch (IOException e) {
            throw new CacheBackendException("Failed to read cache entry " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void write(CacheEntry entry) throws CacheBackendException {
        Path file = fileFor(entry.getKey());
        Path temp = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
        try {
            objectMapper.writeValue(temp.toFile(), entry);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CacheBackendException("Failed to write cache entry " + entry.getKey() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean remove(String key) throws CacheBackendException {
        try {
            return Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new CacheBackendException("Failed to remove cache entry " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void removeAll() throws CacheBackendException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
        } catch (IOException e) {
            throw new CacheBackendException("Failed to clear cache directory: " + e.getMessage(), e);
        }
    }

    /**
     * Unreadable files are logged and deleted rather than failing the scan.
     */
    @Override
    public List<CacheEntry> scan() throws CacheBackendException {
        List<CacheEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                try {
                    entries.add(objectMapper.readValue(file.toFile(), CacheEntry.class));
                } catch (IOException e) {
                    log.warn("Discarding unreadable cache file {}: {}", file.getFileName(), e.getMessage());
                    deleteQuietly(file);
                }
            }
        } catch (IOException e) {
            throw new CacheBackendException("Failed to scan cache directory: " + e.getMessage(), e);
        }
        return entries;
    }

    @Override
    public void close() {
        log.debug("Filesystem cache backend closed");
    }

    Path fileFor(String key) {
        byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
        String name = HexFormat.of().formatHex(bytes);
        if (name.length() > MAX_NAME_LENGTH) {
            // Long keys (search keys) are hashed; the key itself is kept inside the file
            name = "h_" + HexFormat.of().formatHex(sha256(bytes));
        }
        return directory.resolve(name + SUFFIX);
    }

    private static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
