/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.pacs.prefetch;

import io.xnatworks.pacs.cache.CacheService;
import io.xnatworks.pacs.cache.DicomCacheService;
import io.xnatworks.pacs.cache.MemoryCacheBackend;
import io.xnatworks.pacs.dicom.DicomHandler;
import io.xnatworks.pacs.dicom.DicomTestData;
import io.xnatworks.pacs.model.DicomInstance;
import io.xnatworks.pacs.model.DicomStudy;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DirectoryInstanceSource.
 */
@DisplayName("DirectoryInstanceSource Tests")
class DirectoryInstanceSourceTest {

    private static final String STUDY_A = "1.2.826.0.1.100";
    private static final String STUDY_B = "1.2.826.0.1.200";

    @TempDir
    Path tempDir;

    private DirectoryInstanceSource source;

    @BeforeEach
    void setUp() throws Exception {
        Path seriesDir = Files.createDirectories(tempDir.resolve("A").resolve("series1"));
        image(STUDY_A, STUDY_A + ".1").writeTo(seriesDir.resolve("a1.dcm"));
        image(STUDY_A, STUDY_A + ".2").writeTo(seriesDir.resolve("a2.dcm"));
        image(STUDY_B, STUDY_B + ".1").writeTo(tempDir.resolve("IMG0001"));
        Files.write(tempDir.resolve("broken.dcm"), new byte[64]);
        Files.writeString(tempDir.resolve("notes.txt"), "not an image");

        source = new DirectoryInstanceSource(tempDir, new DicomHandler());
    }

    private static DicomTestData image(String studyUid, String sopUid) {
        return DicomTestData.ctInstance(studyUid, sopUid).pixelData(DicomTestData.pixels(100));
    }

    @Nested
    @DisplayName("Indexing Tests")
    class IndexingTests {

        @Test
        @DisplayName("Should index parseable files by study")
        void shouldIndexByStudy() {
            assertEquals(3, source.scan());

            Set<String> studyUids = source.getStudies().stream()
                    .map(DicomStudy::getStudyInstanceUid)
                    .collect(Collectors.toSet());
            assertEquals(Set.of(STUDY_A, STUDY_B), studyUids);
            assertEquals(2, source.getKnownStudies().size());
        }

        @Test
        @DisplayName("Should record unparseable files as failures")
        void shouldRecordFailures() {
            source.scan();

            assertEquals(1, source.getFailures().size());
            assertEquals("broken.dcm", source.getFailures().get(0).getFilePath().getFileName().toString());
        }

        @Test
        @DisplayName("Should count series and instances per study")
        void shouldCountSeriesAndInstances() {
            source.scan();

            DicomStudy study = source.getStudies().stream()
                    .filter(s -> STUDY_A.equals(s.getStudyInstanceUid()))
                    .findFirst()
                    .orElseThrow();

            assertEquals(1, study.getSeriesCount());
            assertEquals(2, study.getInstanceCount());
            assertEquals(2, study.getSeries().get(0).getInstanceCount());
            assertEquals("radiology", study.getSpecialty());
        }

        @Test
        @DisplayName("Should replace the index on rescan")
        void shouldReplaceIndexOnRescan() throws Exception {
            source.scan();
            Files.delete(tempDir.resolve("IMG0001"));

            assertEquals(2, source.scan());
            assertTrue(source.instancesFor(STUDY_B).isEmpty());
            assertEquals(1, source.getStudies().size());
        }
    }

    @Nested
    @DisplayName("Loading Tests")
    class LoadingTests {

        @Test
        @DisplayName("Should list instances with their file locations")
        void shouldListInstances() {
            source.scan();

            List<DicomInstance> instances = source.instancesFor(STUDY_A);

            assertEquals(Set.of(STUDY_A + ".1", STUDY_A + ".2"),
                    instances.stream().map(DicomInstance::getSopInstanceUid).collect(Collectors.toSet()));
            assertTrue(instances.stream().allMatch(i -> Files.isRegularFile(Path.of(i.getLocation()))));
            assertTrue(source.instancesFor("9.9.9").isEmpty());
        }

        @Test
        @DisplayName("Should load instance bytes from disk")
        void shouldLoadInstanceBytes() throws Exception {
            source.scan();
            DicomInstance instance = source.instancesFor(STUDY_B).get(0);

            assertArrayEquals(image(STUDY_B, STUDY_B + ".1").build(), source.load(instance));
        }

        @Test
        @DisplayName("Should fail to load a file that has gone away")
        void shouldFailForMissingFile() throws Exception {
            source.scan();
            DicomInstance instance = source.instancesFor(STUDY_B).get(0);
            Files.delete(Path.of(instance.getLocation()));

            assertThrows(NoSuchFileException.class, () -> source.load(instance));
        }
    }

    @Test
    @DisplayName("Should feed the prefetch engine end to end")
    void shouldFeedPrefetchEngine() {
        source.scan();
        CacheService cache = new CacheService(new MemoryCacheBackend(), 1024 * 1024, 100, 3600, 0, Clock.systemUTC());
        DicomCacheService dicomCache = new DicomCacheService(cache, 1024, 1800);

        try (PrefetchEngine engine = new PrefetchEngine(dicomCache, source, new DicomHandler(), true, 2,
                Clock.systemUTC())) {
            PrefetchReport report = engine.prefetch(
                    Collections.singletonList(new PrefetchRule("ct", PrefetchCondition.modalityIn("CT"), 1, 10, true)),
                    source.getKnownStudies());

            assertEquals(3, report.getTotalCached());
            assertTrue(dicomCache.hasImageData(STUDY_A + ".2"));
            assertTrue(dicomCache.hasStudyMetadata(STUDY_B));
        }
    }
}
