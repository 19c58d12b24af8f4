/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.prefetch;

import io.xnatworks.pacs.config.AppConfig;
import io.xnatworks.pacs.dicom.DicomMetadata;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A predicate over study metadata that decides whether a prefetch rule applies.
 * Conditions are built from fixed criteria; no expressions are evaluated.
 */
public final class PrefetchCondition {
    private final Predicate<DicomMetadata> predicate;
    private final String description;

    private PrefetchCondition(Predicate<DicomMetadata> predicate, String description) {
        this.predicate = predicate;
        this.description = description;
    }

    public boolean matches(DicomMetadata study) {
        return predicate.test(study);
    }

    public static PrefetchCondition always() {
        return new PrefetchCondition(study -> true, "always");
    }

    /**
     * Series modality is one of the codes, compared case-insensitively.
     */
    public static PrefetchCondition modalityIn(Collection<String> modalities) {
        Set<String> codes = upper(modalities);
        return new PrefetchCondition(
                study -> study.getSeries().getModality() != null
                        && codes.contains(study.getSeries().getModality().toUpperCase(Locale.ROOT)),
                "modality in " + codes);
    }

    public static PrefetchCondition modalityIn(String... modalities) {
        return modalityIn(Arrays.asList(modalities));
    }

    public static PrefetchCondition bodyPartIn(Collection<String> bodyParts) {
        Set<String> parts = upper(bodyParts);
        return new PrefetchCondition(
                study -> study.getSeries().getBodyPart() != null
                        && parts.contains(study.getSeries().getBodyPart().toUpperCase(Locale.ROOT)),
                "body part in " + parts);
    }

    /**
     * Study date is no more than {@code days} days before today. Studies without a
     * parseable date do not match.
     */
    public static PrefetchCondition withinDays(int days, Clock clock) {
        if (days < 0) {
            throw new IllegalArgumentException("Days must not be negative: " + days);
        }
        Objects.requireNonNull(clock, "clock");
        return new PrefetchCondition(study -> {
            LocalDate date = parseDate(study.getStudy().getDate());
            if (date == null) {
                return false;
            }
            long age = ChronoUnit.DAYS.between(date, LocalDate.now(clock));
            return age >= 0 && age <= days;
        }, "study within " + days + " days");
    }

    public static PrefetchCondition patientIdIn(Collection<String> patientIds) {
        Set<String> ids = Set.copyOf(patientIds);
        return new PrefetchCondition(
                study -> study.getPatient().getId() != null && ids.contains(study.getPatient().getId()),
                "patient id in " + ids);
    }

    public static PrefetchCondition and(PrefetchCondition... conditions) {
        List<PrefetchCondition> parts = Arrays.asList(conditions);
        return new PrefetchCondition(
                study -> parts.stream().allMatch(c -> c.matches(study)),
                parts.stream().map(PrefetchCondition::toString).collect(Collectors.joining(" and ", "(", ")")));
    }

    public static PrefetchCondition or(PrefetchCondition... conditions) {
        List<PrefetchCondition> parts = Arrays.asList(conditions);
        return new PrefetchCondition(
                study -> parts.stream().anyMatch(c -> c.matches(study)),
                parts.stream().map(PrefetchCondition::toString).collect(Collectors.joining(" or ", "(", ")")));
    }

    /**
     * All populated criteria of the configuration must hold; an empty configuration always matches.
     */
    public static PrefetchCondition fromConfig(AppConfig.ConditionConfig config, Clock clock) {
        if (config == null) {
            return always();
        }
        List<PrefetchCondition> parts = new ArrayList<>();
        if (config.getModalities() != null && !config.getModalities().isEmpty()) {
            parts.add(modalityIn(config.getModalities()));
        }
        if (config.getBodyParts() != null && !config.getBodyParts().isEmpty()) {
            parts.add(bodyPartIn(config.getBodyParts()));
        }
        if (config.getWithinDays() != null) {
            parts.add(withinDays(config.getWithinDays(), clock));
        }
        if (config.getPatientIds() != null && !config.getPatientIds().isEmpty()) {
            parts.add(patientIdIn(config.getPatientIds()));
        }
        if (parts.isEmpty()) {
            return always();
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return and(parts.toArray(new PrefetchCondition[0]));
    }

    private static Set<String> upper(Collection<String> values) {
        return values.stream()
                .map(v -> v.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private static LocalDate parseDate(String value) {
        if (value == null || DicomMetadata.UNKNOWN.equals(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return description;
    }
}
