/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Key/value backend on a SQLite database file.
 */
public class SqliteCacheBackend implements CacheBackend {
    private static final Logger log = LoggerFactory.getLogger(SqliteCacheBackend.class);
    public static final String DB_FILE = "cache.db";

    private final String dbPath;
    private Connection connection;

    public SqliteCacheBackend(String directory) throws CacheBackendException {
        this.dbPath = directory + File.separator + DB_FILE;
        initialize();
    }

    private void initialize() throws CacheBackendException {
        try {
            File dbFile = new File(dbPath);
            dbFile.getAbsoluteFile().getParentFile().mkdirs();

            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);

            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute(
                    "CREATE TABLE IF NOT EXISTS cache_entries (" +
                    "    key TEXT PRIMARY KEY," +
                    "    payload BLOB NOT NULL," +
                    "    inserted_at INTEGER NOT NULL," +  // Unix timestamp in millis
                    "    ttl_seconds INTEGER NOT NULL," +
                    "    last_accessed INTEGER NOT NULL" +
                    ")");
            }
            log.info("SQLite cache backend initialized at: {}", dbPath);
        } catch (SQLException e) {
            log.error("Failed to initialize SQLite cache backend: {}", e.getMessage(), e);
            throw new CacheBackendException("Failed to initialize cache database " + dbPath, e);
        }
    }

    @Override
    public String getName() {
        return "sqlite";
    }

    @Override
    public Optional<CacheEntry> read(String key) throws CacheBackendException {
        String sql = "SELECT key, payload, inserted_at, ttl_seconds, last_accessed FROM cache_entries WHERE key = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, key);
            ResultSet rs = stmt.executeQuery();
            if (rs.next()) {
                return Optional.of(extractEntry(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new CacheBackendException("Failed to read cache entry " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void write(CacheEntry entry) throws CacheBackendException {
        String sql = "INSERT INTO cache_entries (key, payload, inserted_at, ttl_seconds, last_accessed) " +
                     "VALUES (?, ?, ?, ?, ?) " +
                     "ON CONFLICT(key) DO UPDATE SET payload = excluded.payload, " +
                     "inserted_at = excluded.inserted_at, ttl_seconds = excluded.ttl_seconds, " +
                     "last_accessed = excluded.last_accessed";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, entry.getKey());
            stmt.setBytes(2, entry.getPayload());
            stmt.setLong(3, entry.getInsertedAt().toEpochMilli());
            stmt.setLong(4, entry.getTtlSeconds());
            stmt.setLong(5, entry.getLastAccessed().toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new CacheBackendException("Failed to write cache entry " + entry.getKey() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean remove(String key) throws CacheBackendException {
        String sql = "DELETE FROM cache_entries WHERE key = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, key);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new CacheBackendException("Failed to remove cache entry " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void removeAll() throws CacheBackendException {
        try (Statement stmt = connection.createStatement()) {
            stmt.executeUpdate("DELETE FROM cache_entries");
        } catch (SQLException e) {
            throw new CacheBackendException("Failed to clear cache entries: " + e.getMessage(), e);
        }
    }

    @Override
    public List<CacheEntry> scan() throws CacheBackendException {
        String sql = "SELECT key, payload, inserted_at, ttl_seconds, last_accessed FROM cache_entries " +
                     "ORDER BY last_accessed";
        List<CacheEntry> entries = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                entries.add(extractEntry(rs));
            }
        } catch (SQLException e) {
            throw new CacheBackendException("Failed to scan cache entries: " + e.getMessage(), e);
        }
        return entries;
    }

    private CacheEntry extractEntry(ResultSet rs) throws SQLException {
        return new CacheEntry(
                rs.getString("key"),
                rs.getBytes("payload"),
                Instant.ofEpochMilli(rs.getLong("inserted_at")),
                rs.getLong("ttl_seconds"),
                Instant.ofEpochMilli(rs.getLong("last_accessed")));
    }

    @Override
    public void close() {
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                log.info("SQLite cache backend closed");
            }
        } catch (SQLException e) {
            log.error("Error closing SQLite cache backend: {}", e.getMessage(), e);
        }
    }
}
