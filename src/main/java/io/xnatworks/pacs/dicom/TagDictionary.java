/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static mapping from the tags this codec understands to a field name and value representation.
 */
public final class TagDictionary {

    /**
     * Field metadata for one tag.
     */
    public static final class Entry {
        private final Tag tag;
        private final String fieldName;
        private final VR vr;

        Entry(Tag tag, String fieldName, VR vr) {
            this.tag = tag;
            this.fieldName = fieldName;
            this.vr = vr;
        }

        public Tag getTag() { return tag; }
        public String getFieldName() { return fieldName; }
        public VR getVr() { return vr; }

        @Override
        public String toString() {
            return tag + " " + fieldName + " " + vr;
        }
    }

    private static final Map<Tag, Entry> ENTRIES;
    static {
        Map<Tag, Entry> m = new LinkedHashMap<>();
        // File meta
        put(m, Tag.TRANSFER_SYNTAX_UID, "transferSyntaxUID", VR.UI);

        // Patient
        put(m, Tag.PATIENT_NAME, "patientName", VR.PN);
        put(m, Tag.PATIENT_ID, "patientId", VR.LO);
        put(m, Tag.PATIENT_BIRTH_DATE, "patientBirthDate", VR.DA);
        put(m, Tag.PATIENT_SEX, "patientSex", VR.CS);

        // Study
        put(m, Tag.STUDY_DATE, "studyDate", VR.DA);
        put(m, Tag.STUDY_TIME, "studyTime", VR.TM);
        put(m, Tag.STUDY_DESCRIPTION, "studyDescription", VR.LO);
        put(m, Tag.STUDY_INSTANCE_UID, "studyInstanceUID", VR.UI);
        put(m, Tag.ACCESSION_NUMBER, "accessionNumber", VR.SH);
        put(m, Tag.STUDY_ID, "studyId", VR.SH);
        put(m, Tag.NUMBER_OF_STUDY_RELATED_INSTANCES, "numberOfStudyRelatedInstances", VR.IS);

        // Series
        put(m, Tag.SERIES_DATE, "seriesDate", VR.DA);
        put(m, Tag.SERIES_TIME, "seriesTime", VR.TM);
        put(m, Tag.SERIES_DESCRIPTION, "seriesDescription", VR.LO);
        put(m, Tag.SERIES_INSTANCE_UID, "seriesInstanceUID", VR.UI);
        put(m, Tag.SERIES_NUMBER, "seriesNumber", VR.IS);
        put(m, Tag.MODALITY, "modality", VR.CS);
        put(m, Tag.BODY_PART_EXAMINED, "bodyPartExamined", VR.CS);
        put(m, Tag.NUMBER_OF_SERIES_RELATED_INSTANCES, "numberOfSeriesRelatedInstances", VR.IS);

        // Instance / image
        put(m, Tag.SOP_CLASS_UID, "sopClassUID", VR.UI);
        put(m, Tag.SOP_INSTANCE_UID, "sopInstanceUID", VR.UI);
        put(m, Tag.INSTANCE_NUMBER, "instanceNumber", VR.IS);
        put(m, Tag.NUMBER_OF_FRAMES, "numberOfFrames", VR.IS);
        put(m, Tag.ROWS, "rows", VR.US);
        put(m, Tag.COLUMNS, "columns", VR.US);
        put(m, Tag.BITS_ALLOCATED, "bitsAllocated", VR.US);
        put(m, Tag.BITS_STORED, "bitsStored", VR.US);
        put(m, Tag.PIXEL_DATA, "pixelData", VR.OW);

        ENTRIES = Collections.unmodifiableMap(m);
    }

    private TagDictionary() {
    }

    private static void put(Map<Tag, Entry> map, Tag tag, String fieldName, VR vr) {
        map.put(tag, new Entry(tag, fieldName, vr));
    }

    public static Optional<Entry> lookup(Tag tag) {
        return Optional.ofNullable(ENTRIES.get(tag));
    }

    /**
     * Look up a tag given as text; see {@link Tag#parse(String)} for accepted forms.
     * Unparseable text yields an empty result.
     */
    public static Optional<Entry> lookup(String tagText) {
        try {
            return lookup(Tag.parse(tagText));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static Optional<String> fieldName(Tag tag) {
        return lookup(tag).map(Entry::getFieldName);
    }

    /**
     * Dictionary VR for a tag, used when a dataset does not encode VRs explicitly.
     */
    public static Optional<VR> vrOf(Tag tag) {
        return lookup(tag).map(Entry::getVr);
    }

    public static Map<Tag, Entry> entries() {
        return ENTRIES;
    }
}
