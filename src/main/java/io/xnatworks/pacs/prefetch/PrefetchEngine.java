/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.prefetch;

import io.xnatworks.pacs.cache.DicomCacheService;
import io.xnatworks.pacs.config.AppConfig;
import io.xnatworks.pacs.dicom.DicomHandler;
import io.xnatworks.pacs.dicom.DicomMetadata;
import io.xnatworks.pacs.dicom.DicomParseException;
import io.xnatworks.pacs.dicom.ImageData;
import io.xnatworks.pacs.model.DicomInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Warms the image cache according to prefetch rules.
 *
 * <p>Rules run one after another, highest priority first, ties in declaration order.
 * For each study matching a rule, instances are fetched on a bounded worker pool until
 * the rule's image budget is spent. A failed fetch is logged and counted; it never stops
 * the rule or the run.</p>
 */
public class PrefetchEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PrefetchEngine.class);

    private final DicomCacheService cache;
    private final InstanceSource source;
    private final DicomHandler handler;
    private final boolean enabled;
    private final int workerThreads;
    private final Clock clock;

    private final ExecutorService workers;
    private final ExecutorService coordinator;

    public PrefetchEngine(DicomCacheService cache, InstanceSource source, AppConfig.PrefetchConfig config) {
        this(cache, source, new DicomHandler(), config.isEnabled(), config.getWorkerThreads(), Clock.systemUTC());
    }

    public PrefetchEngine(DicomCacheService cache, InstanceSource source, DicomHandler handler,
                          boolean enabled, int workerThreads, Clock clock) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("Worker threads must be at least 1: " + workerThreads);
        }
        this.cache = cache;
        this.source = source;
        this.handler = handler;
        this.enabled = enabled;
        this.workerThreads = workerThreads;
        this.clock = clock;

        AtomicInteger workerCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "prefetch-worker-" + workerCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.coordinator = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "prefetch-coordinator");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run the rules without blocking the caller.
     */
    public CompletableFuture<PrefetchReport> prefetchAsync(List<PrefetchRule> rules, List<DicomMetadata> knownStudies) {
        return CompletableFuture.supplyAsync(() -> prefetch(rules, knownStudies), coordinator);
    }

    /**
     * Run the rules against the known studies and wait for all fetches to finish.
     */
    public PrefetchReport prefetch(List<PrefetchRule> rules, List<DicomMetadata> knownStudies) {
        PrefetchReport report = new PrefetchReport(enabled, clock.instant());
        if (!enabled) {
            log.info("Prefetch is disabled");
            report.finish(clock.instant());
            return report;
        }

        List<PrefetchRule> ordered = orderRules(rules);
        log.info("Starting prefetch: {} rules over {} known studies ({} workers)",
                ordered.size(), knownStudies.size(), workerThreads);

        for (PrefetchRule rule : ordered) {
            PrefetchReport.RuleResult result = report.addRule(rule);
            if (!rule.isEnabled()) {
                log.debug("Skipping disabled prefetch rule {}", rule.getName());
                result.markSkipped();
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Prefetch interrupted before rule {}", rule.getName());
                break;
            }
            runRule(rule, knownStudies, result);
            log.info("Prefetch rule {} done: {} studies matched, {} cached, {} already cached, {} failed",
                    rule.getName(), result.getMatchedStudies(), result.getCached(),
                    result.getAlreadyCached(), result.getFailed());
        }

        report.finish(clock.instant());
        log.info("Prefetch completed: {}", report);
        return report;
    }

    /**
     * Priority descending; the sort is stable so equal priorities keep their declared order.
     */
    static List<PrefetchRule> orderRules(List<PrefetchRule> rules) {
        List<PrefetchRule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparingInt(PrefetchRule::getPriority).reversed());
        return ordered;
    }

    private void runRule(PrefetchRule rule, List<DicomMetadata> knownStudies, PrefetchReport.RuleResult result) {
        int budget = rule.getMaxImages();
        List<Future<?>> pending = new ArrayList<>();

        studies:
        for (DicomMetadata study : knownStudies) {
            if (!rule.getCondition().matches(study)) {
                continue;
            }
            result.studyMatched();

            String studyUid = study.getStudy().getInstanceUid();
            List<DicomInstance> instances;
            try {
                instances = source.instancesFor(studyUid);
            } catch (IOException e) {
                log.warn("Prefetch rule {}: could not list instances of study {}: {}",
                        rule.getName(), studyUid, e.getMessage());
                result.fetchFailed();
                continue;
            }

            for (DicomInstance instance : instances) {
                if (result.getScheduled() >= budget) {
                    break studies;
                }
                if (cache.hasImageData(instance.getSopInstanceUid())) {
                    result.imageAlreadyCached();
                    continue;
                }
                result.fetchScheduled();
                pending.add(workers.submit(() -> fetch(rule, instance, result)));
            }
        }

        awaitAll(rule, pending);
    }

    private void fetch(PrefetchRule rule, DicomInstance instance, PrefetchReport.RuleResult result) {
        String sopUid = instance.getSopInstanceUid();
        try {
            byte[] buffer = source.load(instance);
            ImageData image = handler.extractImageData(buffer);

            if (cache.cacheImageData(sopUid, image.getPixelData().toByteArray())) {
                result.imageCached();
            } else {
                result.imageNotStored();
            }

            DicomMetadata metadata = image.getMetadata();
            if (!cache.hasStudyMetadata(metadata.getStudy().getInstanceUid())) {
                cache.cacheStudyMetadata(metadata);
            }
        } catch (IOException | DicomParseException e) {
            log.warn("Prefetch rule {}: failed to fetch {}: {}", rule.getName(), sopUid, e.getMessage());
            result.fetchFailed();
        } catch (RuntimeException e) {
            log.error("Prefetch rule {}: unexpected error fetching {}: {}", rule.getName(), sopUid, e.getMessage(), e);
            result.fetchFailed();
        }
    }

    private void awaitAll(PrefetchRule rule, List<Future<?>> pending) {
        for (int i = 0; i < pending.size(); i++) {
            try {
                pending.get(i).get();
            } catch (ExecutionException e) {
                log.error("Prefetch rule {}: fetch task failed: {}", rule.getName(), e.getMessage(), e);
            } catch (InterruptedException e) {
                log.warn("Prefetch rule {} interrupted, cancelling {} pending fetches",
                        rule.getName(), pending.size() - i);
                for (int j = i; j < pending.size(); j++) {
                    pending.get(j).cancel(true);
                }
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void close() {
        coordinator.shutdown();
        workers.shutdown();
        try {
            if (!coordinator.awaitTermination(30, TimeUnit.SECONDS)) {
                coordinator.shutdownNow();
            }
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            coordinator.shutdownNow();
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
