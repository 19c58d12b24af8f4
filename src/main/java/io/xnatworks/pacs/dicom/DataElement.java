/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import java.util.Arrays;
import java.util.Optional;

/**
 * One element produced by {@link ElementWalker}. Only valid while its source buffer is.
 */
public final class DataElement {
    private final byte[] buffer;
    private final Tag tag;
    private final VR vr;
    private final boolean explicitVr;
    private final int offset;
    private final int valueOffset;
    private final int length;
    private final DecodedValue value;
    private final DicomParseException decodeError;

    DataElement(byte[] buffer, Tag tag, VR vr, boolean explicitVr, int offset, int valueOffset, int length,
                DecodedValue value, DicomParseException decodeError) {
        this.buffer = buffer;
        this.tag = tag;
        this.vr = vr;
        this.explicitVr = explicitVr;
        this.offset = offset;
        this.valueOffset = valueOffset;
        this.length = length;
        this.value = value;
        this.decodeError = decodeError;
    }

    public Tag getTag() { return tag; }
    public VR getVr() { return vr; }
    public boolean isExplicitVr() { return explicitVr; }
    public int getOffset() { return offset; }
    public int getValueOffset() { return valueOffset; }
    public int getLength() { return length; }

    /**
     * Offset of the element following this one.
     */
    public int getNextOffset() {
        return valueOffset + length;
    }

    /**
     * Decoded value, or null when the value is empty or could not be decoded.
     */
    public DecodedValue getValue() {
        return value;
    }

    public Optional<DicomParseException> getDecodeError() {
        return Optional.ofNullable(decodeError);
    }

    /**
     * Copy of the raw value bytes.
     */
    public byte[] getRawValue() {
        return Arrays.copyOfRange(buffer, valueOffset, valueOffset + length);
    }

    @Override
    public String toString() {
        return tag + " " + vr + " #" + length + " [" + (value != null ? value : "") + "]";
    }
}
