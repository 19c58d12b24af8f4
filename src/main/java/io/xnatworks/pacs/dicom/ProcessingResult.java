/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import io.xnatworks.pacs.validation.ValidationResult;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Outcome of processing one DICOM file. Failures are reported here, never thrown.
 */
public class ProcessingResult {

    /**
     * Why a file could not be processed.
     */
    public enum ErrorKind {
        FILE_NOT_FOUND,
        INVALID_DICOM,
        IO_ERROR
    }

    private final Path filePath;
    private final long fileSize;
    private final boolean valid;
    private final DicomMetadata metadata;
    private final ImageData imageData;
    private final ValidationResult validation;
    private final ErrorKind errorKind;
    private final String error;
    private final Instant processedAt;

    private ProcessingResult(Path filePath, long fileSize, boolean valid, DicomMetadata metadata,
                             ImageData imageData, ValidationResult validation,
                             ErrorKind errorKind, String error) {
        this.filePath = filePath;
        this.fileSize = fileSize;
        this.valid = valid;
        this.metadata = metadata;
        this.imageData = imageData;
        this.validation = validation;
        this.errorKind = errorKind;
        this.error = error;
        this.processedAt = Instant.now();
    }

    static ProcessingResult success(Path filePath, long fileSize, DicomMetadata metadata,
                                    ImageData imageData, ValidationResult validation) {
        return new ProcessingResult(filePath, fileSize, true, metadata, imageData, validation, null, null);
    }

    static ProcessingResult failure(Path filePath, ErrorKind errorKind, String error) {
        return new ProcessingResult(filePath, -1, false, null, null, null, errorKind, error);
    }

    public Path getFilePath() { return filePath; }
    /** Size in bytes, or -1 when the file could not be read. */
    public long getFileSize() { return fileSize; }
    /** True when the file parsed as DICOM; see {@link #getValidation()} for content checks. */
    public boolean isValid() { return valid; }
    public DicomMetadata getMetadata() { return metadata; }
    /** Null when the file has no pixel data. */
    public ImageData getImageData() { return imageData; }
    public ValidationResult getValidation() { return validation; }
    public ErrorKind getErrorKind() { return errorKind; }
    public String getError() { return error; }
    public Instant getProcessedAt() { return processedAt; }
}
