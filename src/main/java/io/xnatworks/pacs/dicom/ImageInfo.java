/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

/**
 * Geometry of an extracted image.
 */
public class ImageInfo {
    private final Integer width;
    private final Integer height;
    private final Integer bitsAllocated;
    private final Integer bitsStored;
    private final int pixelDataLength;

    public ImageInfo(Integer width, Integer height, Integer bitsAllocated, Integer bitsStored, int pixelDataLength) {
        this.width = width;
        this.height = height;
        this.bitsAllocated = bitsAllocated;
        this.bitsStored = bitsStored;
        this.pixelDataLength = pixelDataLength;
    }

    /** Columns. */
    public Integer getWidth() { return width; }
    /** Rows. */
    public Integer getHeight() { return height; }
    public Integer getBitsAllocated() { return bitsAllocated; }
    public Integer getBitsStored() { return bitsStored; }
    public int getPixelDataLength() { return pixelDataLength; }
}
