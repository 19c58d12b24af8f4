/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Folds walked elements into a {@link DicomMetadata} record.
 *
 * Only tags known to {@link TagDictionary} are used. The first occurrence of a tag wins and
 * later duplicates are ignored, even when the first one failed to decode and was skipped.
 */
public final class MetadataAssembler {
    private static final Logger log = LoggerFactory.getLogger(MetadataAssembler.class);

    private MetadataAssembler() {
    }

    public static DicomMetadata assemble(Iterable<DataElement> elements) {
        DicomMetadata.Builder builder = DicomMetadata.builder();
        Set<Tag> seen = new HashSet<>();
        int applied = 0;

        for (DataElement element : elements) {
            Optional<String> field = TagDictionary.fieldName(element.getTag());
            if (field.isEmpty()) {
                continue;
            }
            if (!seen.add(element.getTag())) {
                log.debug("Ignoring duplicate {} at offset {}", element.getTag(), element.getOffset());
                continue;
            }
            // An undecodable first occurrence still claims the tag
            if (element.getValue() == null) {
                continue;
            }
            if (apply(builder, field.get(), element.getValue())) {
                applied++;
            }
        }

        log.debug("Assembled metadata from {} elements", applied);
        return builder.build();
    }

    private static boolean apply(DicomMetadata.Builder b, String field, DecodedValue value) {
        switch (field) {
            case "transferSyntaxUID": b.transferSyntaxUid(text(value)); break;
            case "patientName": b.patientName(text(value)); break;
            case "patientId": b.patientId(text(value)); break;
            case "patientBirthDate": b.patientBirthDate(text(value)); break;
            case "patientSex": b.patientSex(text(value)); break;
            case "studyDate": b.studyDate(text(value)); break;
            case "studyTime": b.studyTime(text(value)); break;
            case "studyDescription": b.studyDescription(text(value)); break;
            case "studyInstanceUID": b.studyInstanceUid(text(value)); break;
            case "accessionNumber": b.accessionNumber(text(value)); break;
            case "studyId": b.studyId(text(value)); break;
            case "numberOfStudyRelatedInstances": b.studyInstanceCount(integer(value)); break;
            case "seriesDate": b.seriesDate(text(value)); break;
            case "seriesTime": b.seriesTime(text(value)); break;
            case "seriesDescription": b.seriesDescription(text(value)); break;
            case "seriesInstanceUID": b.seriesInstanceUid(text(value)); break;
            case "seriesNumber": b.seriesNumber(integer(value)); break;
            case "modality": b.modality(text(value)); break;
            case "bodyPartExamined": b.bodyPart(text(value)); break;
            case "numberOfSeriesRelatedInstances": b.seriesInstanceCount(integer(value)); break;
            case "sopClassUID": b.sopClassUid(text(value)); break;
            case "sopInstanceUID": b.sopInstanceUid(text(value)); break;
            case "instanceNumber": b.instanceNumber(integer(value)); break;
            case "numberOfFrames": b.numberOfFrames(integer(value)); break;
            case "rows": b.rows(integer(value)); break;
            case "columns": b.columns(integer(value)); break;
            case "bitsAllocated": b.bitsAllocated(integer(value)); break;
            case "bitsStored": b.bitsStored(integer(value)); break;
            case "pixelData":
                if (value.getKind() != DecodedValue.Kind.BINARY) {
                    return false;
                }
                b.pixelData(value.asBinary());
                break;
            default:
                return false;
        }
        return true;
    }

    private static String text(DecodedValue value) {
        switch (value.getKind()) {
            case TEXT:
            case DATE:
            case TIME:
                return value.asText();
            case INTEGER:
                return Long.toString(value.asLong());
            default:
                return null;
        }
    }

    /**
     * Integer from a binary integer value or the first component of an IS string.
     */
    private static Integer integer(DecodedValue value) {
        if (value.getKind() == DecodedValue.Kind.INTEGER) {
            return (int) value.asLong();
        }
        if (value.getKind() != DecodedValue.Kind.TEXT) {
            return null;
        }
        String first = value.asText().split("\\\\", 2)[0].trim();
        try {
            return Integer.valueOf(first);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-integer value '{}'", first);
            return null;
        }
    }
}
