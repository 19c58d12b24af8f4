/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

/**
 * Thrown when a buffer cannot be walked or a value cannot be decoded.
 */
public class DicomParseException extends Exception {

    /**
     * Why parsing failed.
     */
    public enum Reason {
        /** Missing DICM marker or buffer shorter than the preamble. */
        MALFORMED_CONTAINER,
        /** Declared length runs past the end of the buffer. */
        TRUNCATED_ELEMENT,
        /** Fixed-width numeric value with too few bytes. */
        INVALID_NUMERIC_WIDTH,
        /** Date or time text that does not follow the DICOM format. */
        INVALID_VALUE_FORMAT,
        /** No (7FE0,0010) element in the buffer. */
        MISSING_PIXEL_DATA
    }

    private final Reason reason;
    private final int offset;

    public DicomParseException(Reason reason, String message) {
        this(reason, message, -1);
    }

    public DicomParseException(Reason reason, String message, int offset) {
        super(message);
        this.reason = reason;
        this.offset = offset;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Buffer offset of the failing element, or -1 when not tied to an element.
     */
    public int getOffset() {
        return offset;
    }
}
