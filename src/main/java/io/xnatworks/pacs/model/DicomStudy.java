/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.xnatworks.pacs.dicom.DicomMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * A study as known to the PACS: identity, clinical context and its series.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DicomStudy {

    private String studyInstanceUid;
    private String patientId;
    private String patientName;
    private String studyDate;
    private String studyTime;
    private String studyDescription;
    private String accessionNumber;
    private String modality;
    private String bodyPart;
    private String specialty;
    private Integer seriesCount;
    private Integer instanceCount;
    private List<DicomSeries> series = new ArrayList<>();

    public DicomStudy() {
    }

    /**
     * Build a study summary from the metadata of one of its instances.
     * Series and instance counts start at zero.
     */
    public static DicomStudy fromMetadata(DicomMetadata metadata, MedicalSpecialty specialty) {
        DicomStudy study = new DicomStudy();
        study.setStudyInstanceUid(metadata.getStudy().getInstanceUid());
        study.setPatientId(metadata.getPatient().getId());
        study.setPatientName(metadata.getPatient().getName());
        study.setStudyDate(metadata.getStudy().getDate());
        study.setStudyTime(metadata.getStudy().getTime());
        study.setStudyDescription(metadata.getStudy().getDescription());
        study.setAccessionNumber(metadata.getStudy().getAccessionNumber());
        study.setModality(metadata.getSeries().getModality());
        study.setBodyPart(metadata.getSeries().getBodyPart());
        study.setSpecialty(specialty != null ? specialty.getCode() : null);
        study.setSeriesCount(0);
        study.setInstanceCount(0);
        return study;
    }

    public String getStudyInstanceUid() { return studyInstanceUid; }
    public void setStudyInstanceUid(String studyInstanceUid) { this.studyInstanceUid = studyInstanceUid; }

    public String getPatientId() { return patientId; }
    public void setPatientId(String patientId) { this.patientId = patientId; }

    public String getPatientName() { return patientName; }
    public void setPatientName(String patientName) { this.patientName = patientName; }

    /** ISO {@code YYYY-MM-DD} or DICOM {@code YYYYMMDD}. */
    public String getStudyDate() { return studyDate; }
    public void setStudyDate(String studyDate) { this.studyDate = studyDate; }

    public String getStudyTime() { return studyTime; }
    public void setStudyTime(String studyTime) { this.studyTime = studyTime; }

    public String getStudyDescription() { return studyDescription; }
    public void setStudyDescription(String studyDescription) { this.studyDescription = studyDescription; }

    public String getAccessionNumber() { return accessionNumber; }
    public void setAccessionNumber(String accessionNumber) { this.accessionNumber = accessionNumber; }

    public String getModality() { return modality; }
    public void setModality(String modality) { this.modality = modality; }

    public String getBodyPart() { return bodyPart; }
    public void setBodyPart(String bodyPart) { this.bodyPart = bodyPart; }

    /** Specialty code, see {@link MedicalSpecialty#getCode()}. */
    public String getSpecialty() { return specialty; }
    public void setSpecialty(String specialty) { this.specialty = specialty; }

    public Integer getSeriesCount() { return seriesCount; }
    public void setSeriesCount(Integer seriesCount) { this.seriesCount = seriesCount; }

    public Integer getInstanceCount() { return instanceCount; }
    public void setInstanceCount(Integer instanceCount) { this.instanceCount = instanceCount; }

    public List<DicomSeries> getSeries() { return series; }
    public void setSeries(List<DicomSeries> series) { this.series = series; }

    @Override
    public String toString() {
        return "DicomStudy{" + studyInstanceUid + ", modality=" + modality + ", series=" + seriesCount
                + ", instances=" + instanceCount + "}";
    }
}
