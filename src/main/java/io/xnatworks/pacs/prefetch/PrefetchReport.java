/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.prefetch;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * What a prefetch run did, rule by rule, in execution order.
 */
public class PrefetchReport {
    private final boolean enabled;
    private final Instant startedAt;
    private Instant finishedAt;
    private final List<RuleResult> rules = new ArrayList<>();

    PrefetchReport(boolean enabled, Instant startedAt) {
        this.enabled = enabled;
        this.startedAt = startedAt;
    }

    RuleResult addRule(PrefetchRule rule) {
        RuleResult result = new RuleResult(rule.getName(), rule.getPriority());
        rules.add(result);
        return result;
    }

    void finish(Instant at) {
        this.finishedAt = at;
    }

    /** False when prefetching is disabled globally and nothing ran. */
    @JsonProperty("enabled")
    public boolean isEnabled() { return enabled; }

    @JsonProperty("startedAt")
    public Instant getStartedAt() { return startedAt; }

    @JsonProperty("finishedAt")
    public Instant getFinishedAt() { return finishedAt; }

    @JsonProperty("rules")
    public List<RuleResult> getRules() { return Collections.unmodifiableList(rules); }

    public RuleResult getRule(String name) {
        for (RuleResult r : rules) {
            if (r.getRuleName().equals(name)) {
                return r;
            }
        }
        return null;
    }

    @JsonProperty("totalCached")
    public int getTotalCached() {
        return rules.stream().mapToInt(RuleResult::getCached).sum();
    }

    @JsonProperty("totalFailed")
    public int getTotalFailed() {
        return rules.stream().mapToInt(RuleResult::getFailed).sum();
    }

    @Override
    public String toString() {
        return "PrefetchReport{rules=" + rules.size() + ", cached=" + getTotalCached()
                + ", failed=" + getTotalFailed() + "}";
    }

    /**
     * Counters for one rule. Updated concurrently by the fetch workers.
     */
    public static class RuleResult {
        private final String ruleName;
        private final int priority;
        private volatile boolean skipped;
        private final AtomicInteger matchedStudies = new AtomicInteger();
        private final AtomicInteger scheduled = new AtomicInteger();
        private final AtomicInteger cached = new AtomicInteger();
        private final AtomicInteger alreadyCached = new AtomicInteger();
        private final AtomicInteger notStored = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();

        RuleResult(String ruleName, int priority) {
            this.ruleName = ruleName;
            this.priority = priority;
        }

        void markSkipped() { skipped = true; }
        void studyMatched() { matchedStudies.incrementAndGet(); }
        void fetchScheduled() { scheduled.incrementAndGet(); }
        void imageCached() { cached.incrementAndGet(); }
        void imageAlreadyCached() { alreadyCached.incrementAndGet(); }
        void imageNotStored() { notStored.incrementAndGet(); }
        void fetchFailed() { failed.incrementAndGet(); }

        @JsonProperty("rule")
        public String getRuleName() { return ruleName; }

        @JsonProperty("priority")
        public int getPriority() { return priority; }

        /** True for a disabled rule. */
        @JsonProperty("skipped")
        public boolean isSkipped() { return skipped; }

        @JsonProperty("matchedStudies")
        public int getMatchedStudies() { return matchedStudies.get(); }

        @JsonProperty("scheduled")
        public int getScheduled() { return scheduled.get(); }

        @JsonProperty("cached")
        public int getCached() { return cached.get(); }

        @JsonProperty("alreadyCached")
        public int getAlreadyCached() { return alreadyCached.get(); }

        /** Decoded but not stored, e.g. larger than the image size limit. */
        @JsonProperty("notStored")
        public int getNotStored() { return notStored.get(); }

        @JsonProperty("failed")
        public int getFailed() { return failed.get(); }
    }
}
