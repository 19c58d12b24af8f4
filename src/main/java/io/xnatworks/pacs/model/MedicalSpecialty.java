/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Clinical specialties that studies, orders and prefetch rules are associated with.
 */
public enum MedicalSpecialty {
    RADIOLOGY("radiology"),
    CARDIOLOGY("cardiology"),
    ORTHOPEDICS("orthopedics"),
    NEUROLOGY("neurology"),
    ONCOLOGY("oncology"),
    PULMONOLOGY("pulmonology"),
    GASTROENTEROLOGY("gastroenterology"),
    PEDIATRICS("pediatrics"),
    EMERGENCY("emergency"),
    PRIMARY_CARE("primary-care");

    private final String code;

    MedicalSpecialty(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolve a specialty code such as {@code primary-care}; matching is exact.
     *
     * @return the specialty, or null if the code is not recognized
     */
    @JsonCreator
    public static MedicalSpecialty fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (MedicalSpecialty specialty : values()) {
            if (specialty.code.equals(code)) {
                return specialty;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return code;
    }
}
