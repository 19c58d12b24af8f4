/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.pacs.dicom;

import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ElementWalker.
 */
@DisplayName("ElementWalker Tests")
class ElementWalkerTest {

    private static List<DataElement> walkAll(byte[] buffer) throws DicomParseException {
        return ElementWalker.walk(buffer).stream().collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Container Tests")
    class ContainerTests {

        @Test
        @DisplayName("Should accept a buffer with preamble and DICM marker")
        void shouldAcceptDicmMarker() {
            assertTrue(ElementWalker.isValidDicom(DicomTestData.builder().build()));
        }

        @Test
        @DisplayName("Should reject short, unmarked and null buffers")
        void shouldRejectInvalidBuffers() {
            assertFalse(ElementWalker.isValidDicom(null));
            assertFalse(ElementWalker.isValidDicom(new byte[131]));
            assertFalse(ElementWalker.isValidDicom(new byte[200]));
        }

        @Test
        @DisplayName("Should fail with MALFORMED_CONTAINER for a zero-filled buffer")
        void shouldFailForZeroBuffer() {
            DicomParseException e = assertThrows(DicomParseException.class, () -> ElementWalker.walk(new byte[200]));
            assertEquals(DicomParseException.Reason.MALFORMED_CONTAINER, e.getReason());
        }

        @Test
        @DisplayName("Should yield nothing for an empty dataset")
        void shouldYieldNothingForEmptyDataset() throws Exception {
            ElementWalker walker = ElementWalker.walk(DicomTestData.builder().build());

            assertTrue(walker.stream().findAny().isEmpty());
            assertEquals(ElementWalker.Termination.END_OF_BUFFER, walker.getTermination());
        }
    }

    @Nested
    @DisplayName("Walking Tests")
    class WalkingTests {

        @Test
        @DisplayName("Should walk short and long form explicit VR elements in order")
        void shouldWalkExplicitElements() throws Exception {
            byte[] buffer = DicomTestData.builder()
                    .string(Tag.PATIENT_NAME, "PN", "DOE^JANE")
                    .us(Tag.ROWS, 256)
                    .pixelData(new byte[8])
                    .build();

            List<DataElement> elements = walkAll(buffer);

            assertEquals(3, elements.size());
            assertEquals(Tag.PATIENT_NAME, elements.get(0).getTag());
            assertEquals(ElementWalker.DATASET_OFFSET, elements.get(0).getOffset());
            assertEquals(ElementWalker.DATASET_OFFSET + 8, elements.get(0).getValueOffset());
            assertEquals(256, elements.get(1).getValue().asLong());
            assertEquals(VR.OW, elements.get(2).getVr());
            assertEquals(elements.get(1).getNextOffset() + 12, elements.get(2).getValueOffset());
            assertEquals(buffer.length, elements.get(2).getNextOffset());
        }

        @Test
        @DisplayName("Should fall back to the dictionary VR for implicit elements")
        void shouldWalkImplicitElements() throws Exception {
            byte[] buffer = DicomTestData.builder()
                    .implicit(Tag.PATIENT_ID, "ID42".getBytes(StandardCharsets.US_ASCII))
                    .implicit(new Tag(0x0009, 0x0010), new byte[]{1, 2})
                    .build();

            List<DataElement> elements = walkAll(buffer);

            assertEquals(2, elements.size());
            assertFalse(elements.get(0).isExplicitVr());
            assertEquals(VR.LO, elements.get(0).getVr());
            assertEquals("ID42", elements.get(0).getValue().asText());
            assertEquals(VR.UN, elements.get(1).getVr());
        }

        @Test
        @DisplayName("Should restart from the beginning on every pass")
        void shouldRestartOnEveryPass() throws Exception {
            ElementWalker walker = ElementWalker.walk(DicomTestData.ctInstance().build());

            long first = walker.stream().count();
            long second = walker.stream().count();

            assertEquals(first, second);
            assertTrue(first > 10);
        }

        @Test
        @DisplayName("Should resume from a given element offset")
        void shouldResumeFromOffset() throws Exception {
            byte[] buffer = DicomTestData.ctInstance().build();
            List<DataElement> all = walkAll(buffer);

            List<DataElement> rest = ElementWalker.walk(buffer, all.get(2).getNextOffset())
                    .stream().collect(Collectors.toList());

            assertEquals(all.size() - 3, rest.size());
            assertEquals(all.get(3).getTag(), rest.get(0).getTag());
        }
    }

    @Nested
    @DisplayName("Malformed Input Tests")
    class MalformedInputTests {

        @Test
        @DisplayName("Should keep earlier elements when a length runs past the buffer")
        void shouldStopAtTruncatedElement() throws Exception {
            byte[] good = DicomTestData.builder().string(Tag.PATIENT_ID, "LO", "PAT001").build();
            byte[] truncated = DicomTestData.fragment()
                    .raw(good)
                    .raw(new byte[]{0x10, 0x00, 0x10, 0x00, 'P', 'N', 0x40, 0x00, 'A', 'B'})
                    .build();

            ElementWalker walker = ElementWalker.walk(truncated);
            List<DataElement> elements = walker.stream().collect(Collectors.toList());

            assertEquals(1, elements.size());
            assertEquals("PAT001", elements.get(0).getValue().asText());
            assertEquals(ElementWalker.Termination.TRUNCATED_ELEMENT, walker.getTermination());
            assertEquals(DicomParseException.Reason.TRUNCATED_ELEMENT, walker.getTerminationError().getReason());
        }

        @Test
        @DisplayName("Should stop at an undefined-length element")
        void shouldStopAtUndefinedLength() throws Exception {
            byte[] buffer = DicomTestData.builder()
                    .string(Tag.MODALITY, "CS", "MR")
                    .raw(new byte[]{0x08, 0x00, 0x15, 0x11, 'S', 'Q', 0, 0, -1, -1, -1, -1})
                    .string(Tag.PATIENT_ID, "LO", "HIDDEN")
                    .build();

            ElementWalker walker = ElementWalker.walk(buffer);
            List<DataElement> elements = walker.stream().collect(Collectors.toList());

            assertEquals(1, elements.size());
            assertEquals(ElementWalker.Termination.UNDEFINED_LENGTH, walker.getTermination());
        }

        @Test
        @DisplayName("Should attach decode errors without stopping the walk")
        void shouldAttachDecodeErrors() throws Exception {
            byte[] buffer = DicomTestData.builder()
                    .string(Tag.STUDY_DATE, "DA", "2024-1-1")
                    .element(Tag.ROWS, "US", new byte[]{1})
                    .string(Tag.MODALITY, "CS", "CT")
                    .build();

            List<DataElement> elements = walkAll(buffer);

            assertEquals(3, elements.size());
            assertNull(elements.get(0).getValue());
            assertEquals(DicomParseException.Reason.INVALID_VALUE_FORMAT,
                    elements.get(0).getDecodeError().orElseThrow().getReason());
            assertEquals(DicomParseException.Reason.INVALID_NUMERIC_WIDTH,
                    elements.get(1).getDecodeError().orElseThrow().getReason());
            assertEquals("CT", elements.get(2).getValue().asText());
        }
    }
}
