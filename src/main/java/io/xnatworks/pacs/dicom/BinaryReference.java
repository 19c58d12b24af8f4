/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Offset/length reference to a binary value inside the buffer it was decoded from.
 * The bytes themselves are never copied into the reference.
 */
public final class BinaryReference {

    public static final String TYPE_PIXEL_DATA = "pixel_data";
    public static final String TYPE_BINARY = "binary";

    private final String type;
    private final int offset;
    private final int length;

    @JsonCreator
    public BinaryReference(@JsonProperty("type") String type,
                           @JsonProperty("offset") int offset,
                           @JsonProperty("length") int length) {
        this.type = type;
        this.offset = offset;
        this.length = length;
    }

    public String getType() { return type; }
    public int getOffset() { return offset; }
    public int getLength() { return length; }

    @JsonIgnore
    public boolean isPixelData() {
        return TYPE_PIXEL_DATA.equals(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryReference)) return false;
        BinaryReference that = (BinaryReference) o;
        return offset == that.offset && length == that.length && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, offset, length);
    }

    @Override
    public String toString() {
        return type + "[offset=" + offset + ", length=" + length + "]";
    }
}
