/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

/**
 * Pixel data, image geometry and metadata extracted from one buffer.
 */
public class ImageData {
    private final PixelData pixelData;
    private final ImageInfo imageInfo;
    private final DicomMetadata metadata;

    public ImageData(PixelData pixelData, ImageInfo imageInfo, DicomMetadata metadata) {
        this.pixelData = pixelData;
        this.imageInfo = imageInfo;
        this.metadata = metadata;
    }

    public PixelData getPixelData() { return pixelData; }
    public ImageInfo getImageInfo() { return imageInfo; }
    public DicomMetadata getMetadata() { return metadata; }
}
