/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * The raw pixel-data value of a buffer, referenced in place.
 */
public final class PixelData {
    private final byte[] source;
    private final BinaryReference reference;

    PixelData(byte[] source, BinaryReference reference) {
        this.source = source;
        this.reference = reference;
    }

    public int getLength() {
        return reference.getLength();
    }

    public int getOffset() {
        return reference.getOffset();
    }

    public BinaryReference getReference() {
        return reference;
    }

    /**
     * Read-only view over the pixel bytes; no copy is made.
     */
    public ByteBuffer asByteBuffer() {
        return ByteBuffer.wrap(source, reference.getOffset(), reference.getLength()).slice().asReadOnlyBuffer();
    }

    /**
     * Copy of the pixel bytes.
     */
    public byte[] toByteArray() {
        return Arrays.copyOfRange(source, reference.getOffset(), reference.getOffset() + reference.getLength());
    }
}
