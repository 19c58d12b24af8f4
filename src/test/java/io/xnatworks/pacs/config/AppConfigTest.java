/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.pacs.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AppConfig.
 */
@DisplayName("AppConfig Tests")
class AppConfigTest {

    @TempDir
    Path tempDir;

    private File writeConfig(String yaml) throws IOException {
        File configFile = tempDir.resolve("config.yaml").toFile();
        Files.writeString(configFile.toPath(), yaml);
        return configFile;
    }

    @Nested
    @DisplayName("Default Values Tests")
    class DefaultValuesTests {

        @Test
        @DisplayName("Should have correct default top-level settings")
        void shouldHaveDefaultSettings() {
            AppConfig config = new AppConfig();

            assertEquals("./data", config.getDataDirectory());
            assertEquals("INFO", config.getLogLevel());
            assertNull(config.getConfigFile());
        }

        @Test
        @DisplayName("Should have correct default cache settings")
        void shouldHaveDefaultCacheSettings() {
            AppConfig.CacheConfig cache = new AppConfig().getCache();

            assertTrue(cache.isEnabled());
            assertEquals(AppConfig.CacheConfig.PROVIDER_MEMORY, cache.getProvider());
            assertEquals(2L * 1024 * 1024 * 1024, cache.getMaxCacheSizeBytes());
            assertEquals(10000, cache.getMaxEntries());
            assertEquals(3600, cache.getDefaultTtl());
            assertEquals(1800, cache.getEffectiveSearchTtl());
            assertEquals(10L * 1024 * 1024, cache.getMaxImageSizeBytes());
            assertEquals(300, cache.getSweepInterval());
        }

        @Test
        @DisplayName("Should have the two default prefetch rules")
        void shouldHaveDefaultPrefetchRules() {
            AppConfig.PrefetchConfig prefetch = new AppConfig().getPrefetch();

            assertTrue(prefetch.isEnabled());
            assertEquals(4, prefetch.getWorkerThreads());
            assertNull(prefetch.getSpecialty());
            assertEquals(2, prefetch.getRules().size());

            AppConfig.PrefetchRuleConfig recent = prefetch.getRules().get(0);
            assertEquals("recent_studies", recent.getName());
            assertEquals(1, recent.getPriority());
            assertEquals(50, recent.getMaxImages());
            assertEquals(1, recent.getCondition().getWithinDays());

            AppConfig.PrefetchRuleConfig urgent = prefetch.getRules().get(1);
            assertEquals("urgent_radiology", urgent.getName());
            assertEquals(2, urgent.getPriority());
            assertEquals(20, urgent.getMaxImages());
            assertEquals(Arrays.asList("CT", "MR"), urgent.getCondition().getModalities());
        }
    }

    @Nested
    @DisplayName("YAML Loading Tests")
    class YamlLoadingTests {

        @Test
        @DisplayName("Should load config from YAML file")
        void shouldLoadConfigFromYaml() throws IOException {
            File configFile = writeConfig("""
                data_directory: /data/pacs
                log_level: DEBUG
                cache:
                  provider: sqlite
                  directory: /var/cache/pacs
                  max_cache_size: 512MB
                  max_entries: 200
                  default_ttl: 600
                  search_ttl: 60
                  max_image_size: 2MB
                  sweep_interval: 0
                prefetch:
                  enabled: false
                  worker_threads: 2
                  specialty: cardiology
                  rules:
                    - name: cardiac_echo
                      priority: 5
                      max_images: 10
                      condition:
                        modalities: [US]
                        body_parts: [HEART]
                        within_days: 7
                        patient_ids: [P1, P2]
                """);

            AppConfig config = AppConfig.load(configFile);

            assertEquals("/data/pacs", config.getDataDirectory());
            assertEquals("DEBUG", config.getLogLevel());
            assertEquals(configFile, config.getConfigFile());

            AppConfig.CacheConfig cache = config.getCache();
            assertEquals("sqlite", cache.getProvider());
            assertEquals("/var/cache/pacs", cache.getDirectory());
            assertEquals(512L * 1024 * 1024, cache.getMaxCacheSizeBytes());
            assertEquals(200, cache.getMaxEntries());
            assertEquals(600, cache.getDefaultTtl());
            assertEquals(60, cache.getEffectiveSearchTtl());
            assertEquals(2L * 1024 * 1024, cache.getMaxImageSizeBytes());
            assertEquals(0, cache.getSweepInterval());

            AppConfig.PrefetchConfig prefetch = config.getPrefetch();
            assertFalse(prefetch.isEnabled());
            assertEquals(2, prefetch.getWorkerThreads());
            assertEquals("cardiology", prefetch.getSpecialty());
            assertEquals(1, prefetch.getRules().size());

            AppConfig.PrefetchRuleConfig rule = prefetch.getRules().get(0);
            assertEquals("cardiac_echo", rule.getName());
            assertEquals(5, rule.getPriority());
            assertEquals(10, rule.getMaxImages());
            assertTrue(rule.isEnabled());
            assertEquals(List.of("US"), rule.getCondition().getModalities());
            assertEquals(List.of("HEART"), rule.getCondition().getBodyParts());
            assertEquals(7, rule.getCondition().getWithinDays());
            assertEquals(List.of("P1", "P2"), rule.getCondition().getPatientIds());
        }

        @Test
        @DisplayName("Should keep defaults for omitted sections")
        void shouldKeepDefaultsForOmittedSections() throws IOException {
            AppConfig config = AppConfig.load(writeConfig("log_level: WARN\n"));

            assertEquals("WARN", config.getLogLevel());
            assertEquals(AppConfig.CacheConfig.PROVIDER_MEMORY, config.getCache().getProvider());
            assertEquals(2, config.getPrefetch().getRules().size());
        }

        @Test
        @DisplayName("Should ignore unknown properties")
        void shouldIgnoreUnknownProperties() throws IOException {
            AppConfig config = AppConfig.load(writeConfig("""
                log_level: INFO
                admin_port: 8080
                cache:
                  provider: memory
                  eviction_policy: lfu
                """));

            assertEquals("memory", config.getCache().getProvider());
        }

        @Test
        @DisplayName("Should throw exception for non-existent file")
        void shouldThrowForNonExistentFile() {
            File missing = tempDir.resolve("missing.yaml").toFile();

            assertThrows(IOException.class, () -> AppConfig.load(missing));
        }

        @Test
        @DisplayName("Should fall back to defaults when the file is missing")
        void shouldFallBackToDefaults() throws IOException {
            File missing = tempDir.resolve("missing.yaml").toFile();

            AppConfig config = AppConfig.loadOrDefault(missing);

            assertEquals("./data", config.getDataDirectory());
            assertEquals(missing, config.getConfigFile());
        }
    }

    @Nested
    @DisplayName("Save Tests")
    class SaveTests {

        @Test
        @DisplayName("Should save and reload the same settings")
        void shouldSaveAndReload() throws IOException {
            AppConfig config = new AppConfig();
            config.getCache().setProvider("filesystem");
            config.getCache().setMaxCacheSize("1GB");
            config.getPrefetch().setSpecialty("radiology");
            File file = tempDir.resolve("saved.yaml").toFile();

            config.save(file);
            AppConfig reloaded = AppConfig.load(file);

            assertEquals("filesystem", reloaded.getCache().getProvider());
            assertEquals(1024L * 1024 * 1024, reloaded.getCache().getMaxCacheSizeBytes());
            assertEquals("radiology", reloaded.getPrefetch().getSpecialty());
            assertEquals(2, reloaded.getPrefetch().getRules().size());
        }

        @Test
        @DisplayName("Should refuse to save without a file path")
        void shouldRefuseSaveWithoutPath() {
            assertThrows(IOException.class, () -> new AppConfig().save());
        }
    }

    @Nested
    @DisplayName("Size Parsing Tests")
    class SizeParsingTests {

        @Test
        @DisplayName("Should parse sizes with binary units")
        void shouldParseSizes() {
            assertEquals(100, AppConfig.CacheConfig.parseSize("100"));
            assertEquals(100, AppConfig.CacheConfig.parseSize("100B"));
            assertEquals(2048, AppConfig.CacheConfig.parseSize("2KB"));
            assertEquals(512L * 1024 * 1024, AppConfig.CacheConfig.parseSize("512 mb"));
            assertEquals(1536L * 1024 * 1024, AppConfig.CacheConfig.parseSize("1.5GB"));
            assertEquals(1024L * 1024 * 1024 * 1024, AppConfig.CacheConfig.parseSize("1TB"));
        }

        @Test
        @DisplayName("Should reject malformed sizes")
        void shouldRejectMalformedSizes() {
            assertThrows(IllegalArgumentException.class, () -> AppConfig.CacheConfig.parseSize("lots"));
            assertThrows(IllegalArgumentException.class, () -> AppConfig.CacheConfig.parseSize("10 PB"));
            assertThrows(IllegalArgumentException.class, () -> AppConfig.CacheConfig.parseSize(null));
        }
    }
}
