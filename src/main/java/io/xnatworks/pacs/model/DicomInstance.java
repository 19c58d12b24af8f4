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
 * One SOP instance (typically one image) within a series.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DicomInstance {

    private String sopInstanceUid;
    private String sopClassUid;
    private String seriesInstanceUid;
    private String studyInstanceUid;
    private Integer instanceNumber;
    private Integer rows;
    private Integer columns;
    private Integer bitsAllocated;
    private Integer bitsStored;
    private Integer numberOfFrames;
    private String location;

    public DicomInstance() {
    }

    /**
     * @param location where the instance bytes can be loaded from, e.g. a file path
     */
    public static DicomInstance fromMetadata(DicomMetadata metadata, String location) {
        DicomMetadata.Image image = metadata.getImage();
        DicomInstance instance = new DicomInstance();
        instance.setSopInstanceUid(image.getSopInstanceUid());
        instance.setSopClassUid(image.getSopClassUid());
        instance.setSeriesInstanceUid(metadata.getSeries().getInstanceUid());
        instance.setStudyInstanceUid(metadata.getStudy().getInstanceUid());
        instance.setInstanceNumber(image.getInstanceNumber());
        instance.setRows(image.getRows());
        instance.setColumns(image.getColumns());
        instance.setBitsAllocated(image.getBitsAllocated());
        instance.setBitsStored(image.getBitsStored());
        instance.setNumberOfFrames(image.getNumberOfFrames());
        instance.setLocation(location);
        return instance;
    }

    public String getSopInstanceUid() { return sopInstanceUid; }
    public void setSopInstanceUid(String sopInstanceUid) { this.sopInstanceUid = sopInstanceUid; }

    public String getSopClassUid() { return sopClassUid; }
    public void setSopClassUid(String sopClassUid) { this.sopClassUid = sopClassUid; }

    public String getSeriesInstanceUid() { return seriesInstanceUid; }
    public void setSeriesInstanceUid(String seriesInstanceUid) { this.seriesInstanceUid = seriesInstanceUid; }

    public String getStudyInstanceUid() { return studyInstanceUid; }
    public void setStudyInstanceUid(String studyInstanceUid) { this.studyInstanceUid = studyInstanceUid; }

    public Integer getInstanceNumber() { return instanceNumber; }
    public void setInstanceNumber(Integer instanceNumber) { this.instanceNumber = instanceNumber; }

    public Integer getRows() { return rows; }
    public void setRows(Integer rows) { this.rows = rows; }

    public Integer getColumns() { return columns; }
    public void setColumns(Integer columns) { this.columns = columns; }

    public Integer getBitsAllocated() { return bitsAllocated; }
    public void setBitsAllocated(Integer bitsAllocated) { this.bitsAllocated = bitsAllocated; }

    public Integer getBitsStored() { return bitsStored; }
    public void setBitsStored(Integer bitsStored) { this.bitsStored = bitsStored; }

    public Integer getNumberOfFrames() { return numberOfFrames; }
    public void setNumberOfFrames(Integer numberOfFrames) { this.numberOfFrames = numberOfFrames; }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }

    @Override
    public String toString() {
        return "DicomInstance{" + sopInstanceUid + " @ " + location + "}";
    }
}
