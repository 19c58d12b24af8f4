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

/**
 * A series within a study.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DicomSeries {

    private String seriesInstanceUid;
    private String studyInstanceUid;
    private Integer seriesNumber;
    private String modality;
    private String seriesDescription;
    private String bodyPart;
    private Integer instanceCount;

    public DicomSeries() {
    }

    public static DicomSeries fromMetadata(DicomMetadata metadata) {
        DicomSeries series = new DicomSeries();
        series.setSeriesInstanceUid(metadata.getSeries().getInstanceUid());
        series.setStudyInstanceUid(metadata.getStudy().getInstanceUid());
        series.setSeriesNumber(metadata.getSeries().getNumber());
        series.setModality(metadata.getSeries().getModality());
        series.setSeriesDescription(metadata.getSeries().getDescription());
        series.setBodyPart(metadata.getSeries().getBodyPart());
        series.setInstanceCount(0);
        return series;
    }

    public String getSeriesInstanceUid() { return seriesInstanceUid; }
    public void setSeriesInstanceUid(String seriesInstanceUid) { this.seriesInstanceUid = seriesInstanceUid; }

    public String getStudyInstanceUid() { return studyInstanceUid; }
    public void setStudyInstanceUid(String studyInstanceUid) { this.studyInstanceUid = studyInstanceUid; }

    public Integer getSeriesNumber() { return seriesNumber; }
    public void setSeriesNumber(Integer seriesNumber) { this.seriesNumber = seriesNumber; }

    public String getModality() { return modality; }
    public void setModality(String modality) { this.modality = modality; }

    public String getSeriesDescription() { return seriesDescription; }
    public void setSeriesDescription(String seriesDescription) { this.seriesDescription = seriesDescription; }

    public String getBodyPart() { return bodyPart; }
    public void setBodyPart(String bodyPart) { this.bodyPart = bodyPart; }

    public Integer getInstanceCount() { return instanceCount; }
    public void setInstanceCount(Integer instanceCount) { this.instanceCount = instanceCount; }
}
