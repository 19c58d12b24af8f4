/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.prefetch;

import io.xnatworks.pacs.config.AppConfig;

import java.time.Clock;
import java.util.Objects;

/**
 * Declares which studies to warm the cache for and how many images to fetch.
 * Higher priority rules run first.
 */
public final class PrefetchRule {
    private final String name;
    private final PrefetchCondition condition;
    private final int priority;
    private final int maxImages;
    private final boolean enabled;

    public PrefetchRule(String name, PrefetchCondition condition, int priority, int maxImages, boolean enabled) {
        this.name = Objects.requireNonNull(name, "name");
        this.condition = Objects.requireNonNull(condition, "condition");
        if (maxImages < 0) {
            throw new IllegalArgumentException("maxImages must not be negative: " + maxImages);
        }
        this.priority = priority;
        this.maxImages = maxImages;
        this.enabled = enabled;
    }

    public static PrefetchRule fromConfig(AppConfig.PrefetchRuleConfig config, Clock clock) {
        return new PrefetchRule(config.getName(), PrefetchCondition.fromConfig(config.getCondition(), clock),
                config.getPriority(), config.getMaxImages(), config.isEnabled());
    }

    public String getName() { return name; }
    public PrefetchCondition getCondition() { return condition; }
    public int getPriority() { return priority; }
    public int getMaxImages() { return maxImages; }
    public boolean isEnabled() { return enabled; }

    @Override
    public String toString() {
        return "PrefetchRule{" + name + ", priority=" + priority + ", maxImages=" + maxImages
                + ", enabled=" + enabled + ", condition=" + condition + "}";
    }
}
