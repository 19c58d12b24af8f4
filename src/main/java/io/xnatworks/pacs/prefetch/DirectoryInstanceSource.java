/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.prefetch;

import io.xnatworks.pacs.dicom.DicomHandler;
import io.xnatworks.pacs.dicom.DicomMetadata;
import io.xnatworks.pacs.dicom.ProcessingResult;
import io.xnatworks.pacs.model.DicomInstance;
import io.xnatworks.pacs.model.DicomSeries;
import io.xnatworks.pacs.model.DicomStudy;
import io.xnatworks.pacs.model.MedicalSpecialty;
import io.xnatworks.pacs.validation.DicomValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instance source over a directory of DICOM files, indexed by study instance UID.
 * Files that cannot be parsed are recorded as failures and left out of the index.
 */
public class DirectoryInstanceSource implements InstanceSource {
    private static final Logger log = LoggerFactory.getLogger(DirectoryInstanceSource.class);

    private final Path directory;
    private final DicomHandler handler;

    private final Map<String, DicomMetadata> studyMetadata = new LinkedHashMap<>();
    private final Map<String, DicomStudy> studies = new LinkedHashMap<>();
    private final Map<String, List<DicomInstance>> instances = new LinkedHashMap<>();
    private final List<ProcessingResult> failures = new ArrayList<>();

    public DirectoryInstanceSource(Path directory, DicomHandler handler) {
        this.directory = directory;
        this.handler = handler;
    }

    /**
     * Index every DICOM file under the directory, replacing any previous index.
     *
     * @return number of instances indexed
     */
    public synchronized int scan() {
        studyMetadata.clear();
        studies.clear();
        instances.clear();
        failures.clear();

        List<Path> files = handler.findDicomFiles(directory, true);
        log.info("Indexing {} DICOM files under {}", files.size(), directory);

        int indexed = 0;
        for (ProcessingResult result : handler.batchProcessDicomFiles(files)) {
            if (!result.isValid()) {
                failures.add(result);
                continue;
            }
            if (index(result.getFilePath(), result.getMetadata())) {
                indexed++;
            }
        }

        log.info("Indexed {} instances in {} studies ({} files failed)", indexed, studies.size(), failures.size());
        return indexed;
    }

    private boolean index(Path file, DicomMetadata metadata) {
        String studyUid = metadata.getStudy().getInstanceUid();
        String sopUid = metadata.getImage().getSopInstanceUid();
        if (!DicomValidator.validateStudyInstanceUID(studyUid) || !DicomValidator.validateSOPInstanceUID(sopUid)) {
            log.warn("Skipping {}: missing or invalid study/SOP instance UID", file.getFileName());
            return false;
        }

        studyMetadata.putIfAbsent(studyUid, metadata);
        DicomStudy study = studies.computeIfAbsent(studyUid, uid -> DicomStudy.fromMetadata(metadata, specialtyOf(metadata)));

        String seriesUid = metadata.getSeries().getInstanceUid();
        DicomSeries series = null;
        for (DicomSeries s : study.getSeries()) {
            if (s.getSeriesInstanceUid() != null && s.getSeriesInstanceUid().equals(seriesUid)) {
                series = s;
                break;
            }
        }
        if (series == null) {
            series = DicomSeries.fromMetadata(metadata);
            study.getSeries().add(series);
            study.setSeriesCount(study.getSeries().size());
        }
        series.setInstanceCount(series.getInstanceCount() + 1);
        study.setInstanceCount(study.getInstanceCount() + 1);

        instances.computeIfAbsent(studyUid, uid -> new ArrayList<>())
                .add(DicomInstance.fromMetadata(metadata, file.toAbsolutePath().toString()));
        return true;
    }

    private static MedicalSpecialty specialtyOf(DicomMetadata metadata) {
        String modality = DicomValidator.canonicalModality(metadata.getSeries().getModality());
        if ("ECG".equals(modality) || "XA".equals(modality) || "IVUS".equals(modality)) {
            return MedicalSpecialty.CARDIOLOGY;
        }
        return MedicalSpecialty.RADIOLOGY;
    }

    @Override
    public synchronized List<DicomInstance> instancesFor(String studyInstanceUid) {
        List<DicomInstance> found = instances.get(studyInstanceUid);
        return found == null ? Collections.emptyList() : new ArrayList<>(found);
    }

    @Override
    public byte[] load(DicomInstance instance) throws IOException {
        Path file = Paths.get(instance.getLocation());
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        return Files.readAllBytes(file);
    }

    /**
     * Metadata of the first indexed instance of every study, in indexing order.
     */
    public synchronized List<DicomMetadata> getKnownStudies() {
        return new ArrayList<>(studyMetadata.values());
    }

    public synchronized List<DicomStudy> getStudies() {
        return new ArrayList<>(studies.values());
    }

    public synchronized List<ProcessingResult> getFailures() {
        return new ArrayList<>(failures);
    }

    public Path getDirectory() {
        return directory;
    }
}
