/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Application configuration for the PACS codec and cache.
 * Covers the cache backend and its bounds, and the prefetch rules.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /**
     * Data directory for persistent cache backends.
     */
    @JsonProperty("data_directory")
    private String dataDirectory = "./data";

    /**
     * Log level.
     */
    @JsonProperty("log_level")
    private String logLevel = "INFO";

    private CacheConfig cache = new CacheConfig();
    private PrefetchConfig prefetch = new PrefetchConfig();

    /**
     * Path to the config file (set when loaded).
     */
    private transient File configFile;

    public static AppConfig load(File configFile) throws IOException {
        log.info("Loading configuration from: {}", configFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = mapper.readValue(configFile, AppConfig.class);
        config.configFile = configFile;
        return config;
    }

    public static AppConfig load(String configPath) throws IOException {
        return load(new File(configPath));
    }

    /**
     * Load the file if it exists, otherwise return the defaults.
     */
    public static AppConfig loadOrDefault(File configFile) throws IOException {
        if (configFile == null || !configFile.exists()) {
            log.info("No configuration file found, using defaults");
            AppConfig config = new AppConfig();
            config.configFile = configFile;
            return config;
        }
        return load(configFile);
    }

    /**
     * Save the configuration back to the YAML file.
     */
    public void save() throws IOException {
        if (configFile == null) {
            throw new IOException("Config file path not set - cannot save");
        }
        save(configFile);
    }

    /**
     * Save the configuration to a specific file.
     */
    public void save(File file) throws IOException {
        log.info("Saving configuration to: {}", file.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writerWithDefaultPrettyPrinter().writeValue(file, this);
    }

    @JsonIgnore
    public File getConfigFile() {
        return configFile;
    }

    public void setConfigFile(File configFile) {
        this.configFile = configFile;
    }

    public String getDataDirectory() { return dataDirectory; }
    public void setDataDirectory(String dataDirectory) { this.dataDirectory = dataDirectory; }

    public String getLogLevel() { return logLevel; }
    public void setLogLevel(String logLevel) { this.logLevel = logLevel; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public PrefetchConfig getPrefetch() { return prefetch; }
    public void setPrefetch(PrefetchConfig prefetch) { this.prefetch = prefetch; }

    // ========================================================================
    // Cache
    // ========================================================================

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        public static final String PROVIDER_MEMORY = "memory";
        public static final String PROVIDER_FILESYSTEM = "filesystem";
        public static final String PROVIDER_SQLITE = "sqlite";

        private static final Pattern SIZE_PATTERN =
                Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\s*(B|KB|MB|GB|TB)?\\s*$", Pattern.CASE_INSENSITIVE);

        private boolean enabled = true;

        /**
         * memory, filesystem or sqlite.
         */
        private String provider = PROVIDER_MEMORY;

        /**
         * Directory for the filesystem and sqlite providers. Relative to data_directory when not absolute.
         */
        private String directory = "cache";

        /**
         * Upper bound on the total payload size, e.g. "512MB" or "2GB".
         */
        @JsonProperty("max_cache_size")
        private String maxCacheSize = "2GB";

        @JsonProperty("max_entries")
        private int maxEntries = 10000;

        /**
         * Default time-to-live in seconds.
         */
        @JsonProperty("default_ttl")
        private long defaultTtl = 3600;

        /**
         * Time-to-live for search results in seconds; half of default_ttl when unset.
         */
        @JsonProperty("search_ttl")
        private Long searchTtl;

        /**
         * Images larger than this are not cached.
         */
        @JsonProperty("max_image_size")
        private String maxImageSize = "10MB";

        /**
         * Seconds between background sweeps of expired entries; 0 disables the sweep.
         */
        @JsonProperty("sweep_interval")
        private int sweepInterval = 300;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getMaxCacheSize() { return maxCacheSize; }
        public void setMaxCacheSize(String maxCacheSize) { this.maxCacheSize = maxCacheSize; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        public long getDefaultTtl() { return defaultTtl; }
        public void setDefaultTtl(long defaultTtl) { this.defaultTtl = defaultTtl; }

        public Long getSearchTtl() { return searchTtl; }
        public void setSearchTtl(Long searchTtl) { this.searchTtl = searchTtl; }

        public String getMaxImageSize() { return maxImageSize; }
        public void setMaxImageSize(String maxImageSize) { this.maxImageSize = maxImageSize; }

        public int getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(int sweepInterval) { this.sweepInterval = sweepInterval; }

        @JsonIgnore
        public long getMaxCacheSizeBytes() {
            return parseSize(maxCacheSize);
        }

        @JsonIgnore
        public long getMaxImageSizeBytes() {
            return parseSize(maxImageSize);
        }

        @JsonIgnore
        public long getEffectiveSearchTtl() {
            return searchTtl != null ? searchTtl : Math.max(1, defaultTtl / 2);
        }

        /**
         * Parse a size such as "2GB", "512 mb" or "1048576" into bytes (binary multiples).
         *
         * @throws IllegalArgumentException if the value is not a size
         */
        public static long parseSize(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Size is required");
            }
            Matcher m = SIZE_PATTERN.matcher(value);
            if (!m.matches()) {
                throw new IllegalArgumentException("Invalid size: " + value);
            }
            double number = Double.parseDouble(m.group(1));
            String unit = m.group(2) == null ? "B" : m.group(2).toUpperCase(Locale.ROOT);
            long multiplier;
            switch (unit) {
                case "KB": multiplier = 1024L; break;
                case "MB": multiplier = 1024L * 1024; break;
                case "GB": multiplier = 1024L * 1024 * 1024; break;
                case "TB": multiplier = 1024L * 1024 * 1024 * 1024; break;
                default: multiplier = 1L; break;
            }
            return (long) (number * multiplier);
        }
    }

    // ========================================================================
    // Prefetch
    // ========================================================================

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrefetchConfig {
        private boolean enabled = true;

        @JsonProperty("worker_threads")
        private int workerThreads = 4;

        /**
         * Specialty whose extra rules are added to the configured ones, e.g. "radiology".
         */
        private String specialty;

        private List<PrefetchRuleConfig> rules = defaultRules();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public String getSpecialty() { return specialty; }
        public void setSpecialty(String specialty) { this.specialty = specialty; }

        public List<PrefetchRuleConfig> getRules() { return rules; }
        public void setRules(List<PrefetchRuleConfig> rules) { this.rules = rules; }

        /**
         * recent_studies (studies from the last day) and urgent_radiology (CT and MR).
         */
        public static List<PrefetchRuleConfig> defaultRules() {
            List<PrefetchRuleConfig> defaults = new ArrayList<>();

            ConditionConfig recent = new ConditionConfig();
            recent.setWithinDays(1);
            defaults.add(new PrefetchRuleConfig("recent_studies", 1, 50, recent));

            ConditionConfig urgent = new ConditionConfig();
            urgent.setModalities(new ArrayList<>(Arrays.asList("CT", "MR")));
            defaults.add(new PrefetchRuleConfig("urgent_radiology", 2, 20, urgent));

            return defaults;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrefetchRuleConfig {
        private String name;
        private int priority = 1;

        @JsonProperty("max_images")
        private int maxImages = 50;

        private boolean enabled = true;
        private ConditionConfig condition = new ConditionConfig();

        public PrefetchRuleConfig() {
        }

        public PrefetchRuleConfig(String name, int priority, int maxImages, ConditionConfig condition) {
            this.name = name;
            this.priority = priority;
            this.maxImages = maxImages;
            this.condition = condition;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public int getMaxImages() { return maxImages; }
        public void setMaxImages(int maxImages) { this.maxImages = maxImages; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public ConditionConfig getCondition() { return condition; }
        public void setCondition(ConditionConfig condition) { this.condition = condition; }
    }

    /**
     * Structured rule condition. Every populated criterion must hold; an empty condition matches all studies.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConditionConfig {
        private List<String> modalities = new ArrayList<>();

        @JsonProperty("body_parts")
        private List<String> bodyParts = new ArrayList<>();

        @JsonProperty("within_days")
        private Integer withinDays;

        @JsonProperty("patient_ids")
        private List<String> patientIds = new ArrayList<>();

        public List<String> getModalities() { return modalities; }
        public void setModalities(List<String> modalities) { this.modalities = modalities; }

        public List<String> getBodyParts() { return bodyParts; }
        public void setBodyParts(List<String> bodyParts) { this.bodyParts = bodyParts; }

        public Integer getWithinDays() { return withinDays; }
        public void setWithinDays(Integer withinDays) { this.withinDays = withinDays; }

        public List<String> getPatientIds() { return patientIds; }
        public void setPatientIds(List<String> patientIds) { this.patientIds = patientIds; }
    }
}
