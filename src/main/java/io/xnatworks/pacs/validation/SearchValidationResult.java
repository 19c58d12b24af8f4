/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.xnatworks.pacs.model.SearchParameters;

import java.util.List;

/**
 * Validation of search criteria, carrying a copy holding only the values that passed.
 */
public class SearchValidationResult extends ValidationResult {
    private final SearchParameters sanitized;

    public SearchValidationResult(List<String> errors, SearchParameters sanitized) {
        super(errors);
        this.sanitized = sanitized;
    }

    @JsonProperty("sanitized")
    public SearchParameters getSanitized() {
        return sanitized;
    }
}
