/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a validation check: valid when there are no errors.
 */
public class ValidationResult {
    private final List<String> errors;

    public ValidationResult(List<String> errors) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static ValidationResult ok() {
        return new ValidationResult(Collections.emptyList());
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return errors.isEmpty();
    }

    @JsonProperty("errors")
    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : "invalid " + errors;
    }
}
