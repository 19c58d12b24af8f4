/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.prefetch;

import io.xnatworks.pacs.model.DicomInstance;

import java.io.IOException;
import java.util.List;

/**
 * Where the prefetch engine finds the instances of a study and their bytes.
 */
public interface InstanceSource {

    List<DicomInstance> instancesFor(String studyInstanceUid) throws IOException;

    /**
     * Raw DICOM bytes of one instance.
     */
    byte[] load(DicomInstance instance) throws IOException;
}
