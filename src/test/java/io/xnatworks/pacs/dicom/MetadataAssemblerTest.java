/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.pacs.dicom;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MetadataAssembler.
 */
@DisplayName("MetadataAssembler Tests")
class MetadataAssemblerTest {

    private static DicomMetadata assemble(byte[] buffer) throws DicomParseException {
        return MetadataAssembler.assemble(ElementWalker.walk(buffer));
    }

    @Test
    @DisplayName("Should fill every section from a complete instance")
    void shouldFillAllSections() throws Exception {
        DicomMetadata metadata = assemble(DicomTestData.ctImage());

        assertEquals(DicomTestData.PATIENT_NAME, metadata.getPatient().getName());
        assertEquals(DicomTestData.PATIENT_ID, metadata.getPatient().getId());
        assertEquals("M", metadata.getPatient().getSex());
        assertEquals(DicomTestData.STUDY_UID, metadata.getStudy().getInstanceUid());
        assertEquals("2024-01-15", metadata.getStudy().getDate());
        assertEquals("14:30:45", metadata.getStudy().getTime());
        assertEquals("ACC12345", metadata.getStudy().getAccessionNumber());
        assertEquals("CT", metadata.getSeries().getModality());
        assertEquals("CHEST", metadata.getSeries().getBodyPart());
        assertEquals(1, metadata.getSeries().getNumber());
        assertEquals(DicomTestData.SOP_UID, metadata.getImage().getSopInstanceUid());
        assertEquals(1, metadata.getImage().getInstanceNumber());
        assertEquals(10, metadata.getImage().getRows());
        assertEquals(5, metadata.getImage().getColumns());
        assertEquals(16, metadata.getImage().getBitsAllocated());
        assertEquals(12, metadata.getImage().getBitsStored());
        assertEquals("1.2.840.10008.1.2.1", metadata.getTransferSyntaxUid());
        assertEquals(100, metadata.getPixelData().getLength());
        assertTrue(metadata.getPixelData().isPixelData());
    }

    @Test
    @DisplayName("Should use Unknown for missing required text fields")
    void shouldUseUnknownForMissingFields() throws Exception {
        DicomMetadata metadata = assemble(DicomTestData.builder()
                .string(Tag.STUDY_INSTANCE_UID, "UI", "1.2.3")
                .build());

        assertEquals(DicomMetadata.UNKNOWN, metadata.getPatient().getName());
        assertEquals(DicomMetadata.UNKNOWN, metadata.getPatient().getId());
        assertEquals(DicomMetadata.UNKNOWN, metadata.getStudy().getDescription());
        assertEquals(DicomMetadata.UNKNOWN, metadata.getSeries().getModality());
        assertNull(metadata.getStudy().getDate());
        assertNull(metadata.getImage().getRows());
        assertNull(metadata.getPixelData());
    }

    @Test
    @DisplayName("Should keep the first occurrence of a duplicated tag")
    void shouldKeepFirstOccurrence() throws Exception {
        DicomMetadata metadata = assemble(DicomTestData.builder()
                .string(Tag.PATIENT_ID, "LO", "FIRST")
                .string(Tag.PATIENT_ID, "LO", "SECOND")
                .build());

        assertEquals("FIRST", metadata.getPatient().getId());
    }

    @Test
    @DisplayName("Should skip values that failed to decode")
    void shouldSkipUndecodableValues() throws Exception {
        DicomMetadata metadata = assemble(DicomTestData.builder()
                .string(Tag.STUDY_DATE, "DA", "15/01/24")
                .string(Tag.MODALITY, "CS", "MR")
                .build());

        assertNull(metadata.getStudy().getDate());
        assertEquals("MR", metadata.getSeries().getModality());
    }

    @Test
    @DisplayName("Should not let a later duplicate replace an undecodable first value")
    void shouldIgnoreDuplicateAfterUndecodableValue() throws Exception {
        DicomMetadata metadata = assemble(DicomTestData.builder()
                .string(Tag.STUDY_DATE, "DA", "15/01/24")
                .string(Tag.STUDY_DATE, "DA", "20240115")
                .build());

        assertNull(metadata.getStudy().getDate());
    }

    @Test
    @DisplayName("Should read the first component of a multi-valued integer string")
    void shouldReadFirstIntegerComponent() throws Exception {
        DicomMetadata metadata = assemble(DicomTestData.builder()
                .string(Tag.INSTANCE_NUMBER, "IS", " 7\\8")
                .string(Tag.SERIES_NUMBER, "IS", "abc")
                .build());

        assertEquals(7, metadata.getImage().getInstanceNumber());
        assertNull(metadata.getSeries().getNumber());
    }

    @Test
    @DisplayName("Should ignore elements outside the dictionary")
    void shouldIgnoreUnknownTags() throws Exception {
        DicomMetadata withPrivate = assemble(DicomTestData.ctInstance()
                .string(new Tag(0x0009, 0x1001), "LO", "PRIVATE")
                .build());
        DicomMetadata without = assemble(DicomTestData.ctInstance().build());

        assertEquals(without, withPrivate);
    }
}
