/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Patient/study/series/image record assembled from one DICOM buffer.
 *
 * Immutable. Use {@link #toBuilder()} to derive a changed copy. Required text fields that were
 * absent from the source hold {@link #UNKNOWN}; optional fields are null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DicomMetadata {

    public static final String UNKNOWN = "Unknown";

    private final Patient patient;
    private final Study study;
    private final Series series;
    private final Image image;
    private final String transferSyntaxUid;
    private final BinaryReference pixelData;

    @JsonCreator
    public DicomMetadata(@JsonProperty("patient") Patient patient,
                         @JsonProperty("study") Study study,
                         @JsonProperty("series") Series series,
                         @JsonProperty("image") Image image,
                         @JsonProperty("transferSyntaxUid") String transferSyntaxUid,
                         @JsonProperty("pixelData") BinaryReference pixelData) {
        this.patient = Objects.requireNonNull(patient, "patient");
        this.study = Objects.requireNonNull(study, "study");
        this.series = Objects.requireNonNull(series, "series");
        this.image = Objects.requireNonNull(image, "image");
        this.transferSyntaxUid = transferSyntaxUid;
        this.pixelData = pixelData;
    }

    public Patient getPatient() { return patient; }
    public Study getStudy() { return study; }
    public Series getSeries() { return series; }
    public Image getImage() { return image; }
    public String getTransferSyntaxUid() { return transferSyntaxUid; }
    public BinaryReference getPixelData() { return pixelData; }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .patientName(patient.name).patientId(patient.id)
                .patientBirthDate(patient.birthDate).patientSex(patient.sex)
                .studyInstanceUid(study.instanceUid).studyDate(study.date).studyTime(study.time)
                .studyDescription(study.description).accessionNumber(study.accessionNumber)
                .studyId(study.studyId).studyInstanceCount(study.numberOfInstances)
                .seriesInstanceUid(series.instanceUid).seriesDate(series.date).seriesTime(series.time)
                .seriesDescription(series.description).modality(series.modality)
                .seriesNumber(series.number).bodyPart(series.bodyPart)
                .seriesInstanceCount(series.numberOfInstances)
                .sopInstanceUid(image.sopInstanceUid).sopClassUid(image.sopClassUid)
                .instanceNumber(image.instanceNumber).numberOfFrames(image.numberOfFrames)
                .rows(image.rows).columns(image.columns)
                .bitsAllocated(image.bitsAllocated).bitsStored(image.bitsStored)
                .transferSyntaxUid(transferSyntaxUid).pixelData(pixelData);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DicomMetadata)) return false;
        DicomMetadata that = (DicomMetadata) o;
        return patient.equals(that.patient) && study.equals(that.study) && series.equals(that.series)
                && image.equals(that.image) && Objects.equals(transferSyntaxUid, that.transferSyntaxUid)
                && Objects.equals(pixelData, that.pixelData);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patient, study, series, image, transferSyntaxUid, pixelData);
    }

    @Override
    public String toString() {
        return "DicomMetadata{study=" + study.instanceUid + ", series=" + series.instanceUid
                + ", sop=" + image.sopInstanceUid + ", modality=" + series.modality + "}";
    }

    // ==================== Sections ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Patient {
        private final String name;
        private final String id;
        private final String birthDate;
        private final String sex;

        @JsonCreator
        public Patient(@JsonProperty("name") String name,
                       @JsonProperty("id") String id,
                       @JsonProperty("birthDate") String birthDate,
                       @JsonProperty("sex") String sex) {
            this.name = name;
            this.id = id;
            this.birthDate = birthDate;
            this.sex = sex;
        }

        public String getName() { return name; }
        public String getId() { return id; }
        public String getBirthDate() { return birthDate; }
        public String getSex() { return sex; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Patient)) return false;
            Patient that = (Patient) o;
            return Objects.equals(name, that.name) && Objects.equals(id, that.id)
                    && Objects.equals(birthDate, that.birthDate) && Objects.equals(sex, that.sex);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, id, birthDate, sex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Study {
        private final String instanceUid;
        private final String date;
        private final String time;
        private final String description;
        private final String accessionNumber;
        private final String studyId;
        private final Integer numberOfInstances;

        @JsonCreator
        public Study(@JsonProperty("instanceUid") String instanceUid,
                     @JsonProperty("date") String date,
                     @JsonProperty("time") String time,
                     @JsonProperty("description") String description,
                     @JsonProperty("accessionNumber") String accessionNumber,
                     @JsonProperty("studyId") String studyId,
                     @JsonProperty("numberOfInstances") Integer numberOfInstances) {
            this.instanceUid = instanceUid;
            this.date = date;
            this.time = time;
            this.description = description;
            this.accessionNumber = accessionNumber;
            this.studyId = studyId;
            this.numberOfInstances = numberOfInstances;
        }

        public String getInstanceUid() { return instanceUid; }
        public String getDate() { return date; }
        public String getTime() { return time; }
        public String getDescription() { return description; }
        public String getAccessionNumber() { return accessionNumber; }
        public String getStudyId() { return studyId; }
        public Integer getNumberOfInstances() { return numberOfInstances; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Study)) return false;
            Study that = (Study) o;
            return Objects.equals(instanceUid, that.instanceUid) && Objects.equals(date, that.date)
                    && Objects.equals(time, that.time) && Objects.equals(description, that.description)
                    && Objects.equals(accessionNumber, that.accessionNumber)
                    && Objects.equals(studyId, that.studyId)
                    && Objects.equals(numberOfInstances, that.numberOfInstances);
        }

        @Override
        public int hashCode() {
            return Objects.hash(instanceUid, date, time, description, accessionNumber, studyId, numberOfInstances);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Series {
        private final String instanceUid;
        private final String date;
        private final String time;
        private final String description;
        private final String modality;
        private final Integer number;
        private final String bodyPart;
        private final Integer numberOfInstances;

        @JsonCreator
        public Series(@JsonProperty("instanceUid") String instanceUid,
                      @JsonProperty("date") String date,
                      @JsonProperty("time") String time,
                      @JsonProperty("description") String description,
                      @JsonProperty("modality") String modality,
                      @JsonProperty("number") Integer number,
                      @JsonProperty("bodyPart") String bodyPart,
                      @JsonProperty("numberOfInstances") Integer numberOfInstances) {
            this.instanceUid = instanceUid;
            this.date = date;
            this.time = time;
            this.description = description;
            this.modality = modality;
            this.number = number;
            this.bodyPart = bodyPart;
            this.numberOfInstances = numberOfInstances;
        }

        public String getInstanceUid() { return instanceUid; }
        public String getDate() { return date; }
        public String getTime() { return time; }
        public String getDescription() { return description; }
        public String getModality() { return modality; }
        public Integer getNumber() { return number; }
        public String getBodyPart() { return bodyPart; }
        public Integer getNumberOfInstances() { return numberOfInstances; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Series)) return false;
            Series that = (Series) o;
            return Objects.equals(instanceUid, that.instanceUid) && Objects.equals(date, that.date)
                    && Objects.equals(time, that.time) && Objects.equals(description, that.description)
                    && Objects.equals(modality, that.modality) && Objects.equals(number, that.number)
                    && Objects.equals(bodyPart, that.bodyPart)
                    && Objects.equals(numberOfInstances, that.numberOfInstances);
        }

        @Override
        public int hashCode() {
            return Objects.hash(instanceUid, date, time, description, modality, number, bodyPart, numberOfInstances);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Image {
        private final String sopInstanceUid;
        private final String sopClassUid;
        private final Integer instanceNumber;
        private final Integer numberOfFrames;
        private final Integer rows;
        private final Integer columns;
        private final Integer bitsAllocated;
        private final Integer bitsStored;

        @JsonCreator
        public Image(@JsonProperty("sopInstanceUid") String sopInstanceUid,
                     @JsonProperty("sopClassUid") String sopClassUid,
                     @JsonProperty("instanceNumber") Integer instanceNumber,
                     @JsonProperty("numberOfFrames") Integer numberOfFrames,
                     @JsonProperty("rows") Integer rows,
                     @JsonProperty("columns") Integer columns,
                     @JsonProperty("bitsAllocated") Integer bitsAllocated,
                     @JsonProperty("bitsStored") Integer bitsStored) {
            this.sopInstanceUid = sopInstanceUid;
            this.sopClassUid = sopClassUid;
            this.instanceNumber = instanceNumber;
            this.numberOfFrames = numberOfFrames;
            this.rows = rows;
            this.columns = columns;
            this.bitsAllocated = bitsAllocated;
            this.bitsStored = bitsStored;
        }

        public String getSopInstanceUid() { return sopInstanceUid; }
        public String getSopClassUid() { return sopClassUid; }
        public Integer getInstanceNumber() { return instanceNumber; }
        public Integer getNumberOfFrames() { return numberOfFrames; }
        public Integer getRows() { return rows; }
        public Integer getColumns() { return columns; }
        public Integer getBitsAllocated() { return bitsAllocated; }
        public Integer getBitsStored() { return bitsStored; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Image)) return false;
            Image that = (Image) o;
            return Objects.equals(sopInstanceUid, that.sopInstanceUid) && Objects.equals(sopClassUid, that.sopClassUid)
                    && Objects.equals(instanceNumber, that.instanceNumber)
                    && Objects.equals(numberOfFrames, that.numberOfFrames)
                    && Objects.equals(rows, that.rows) && Objects.equals(columns, that.columns)
                    && Objects.equals(bitsAllocated, that.bitsAllocated)
                    && Objects.equals(bitsStored, that.bitsStored);
        }

        @Override
        public int hashCode() {
            return Objects.hash(sopInstanceUid, sopClassUid, instanceNumber, numberOfFrames,
                    rows, columns, bitsAllocated, bitsStored);
        }
    }

    // ==================== Builder ====================

    public static final class Builder {
        private String patientName;
        private String patientId;
        private String patientBirthDate;
        private String patientSex;
        private String studyInstanceUid;
        private String studyDate;
        private String studyTime;
        private String studyDescription;
        private String accessionNumber;
        private String studyId;
        private Integer studyInstanceCount;
        private String seriesInstanceUid;
        private String seriesDate;
        private String seriesTime;
        private String seriesDescription;
        private String modality;
        private Integer seriesNumber;
        private String bodyPart;
        private Integer seriesInstanceCount;
        private String sopInstanceUid;
        private String sopClassUid;
        private Integer instanceNumber;
        private Integer numberOfFrames;
        private Integer rows;
        private Integer columns;
        private Integer bitsAllocated;
        private Integer bitsStored;
        private String transferSyntaxUid;
        private BinaryReference pixelData;

        private Builder() {
        }

        public Builder patientName(String v) { this.patientName = v; return this; }
        public Builder patientId(String v) { this.patientId = v; return this; }
        public Builder patientBirthDate(String v) { this.patientBirthDate = v; return this; }
        public Builder patientSex(String v) { this.patientSex = v; return this; }
        public Builder studyInstanceUid(String v) { this.studyInstanceUid = v; return this; }
        public Builder studyDate(String v) { this.studyDate = v; return this; }
        public Builder studyTime(String v) { this.studyTime = v; return this; }
        public Builder studyDescription(String v) { this.studyDescription = v; return this; }
        public Builder accessionNumber(String v) { this.accessionNumber = v; return this; }
        public Builder studyId(String v) { this.studyId = v; return this; }
        public Builder studyInstanceCount(Integer v) { this.studyInstanceCount = v; return this; }
        public Builder seriesInstanceUid(String v) { this.seriesInstanceUid = v; return this; }
        public Builder seriesDate(String v) { this.seriesDate = v; return this; }
        public Builder seriesTime(String v) { this.seriesTime = v; return this; }
        public Builder seriesDescription(String v) { this.seriesDescription = v; return this; }
        public Builder modality(String v) { this.modality = v; return this; }
        public Builder seriesNumber(Integer v) { this.seriesNumber = v; return this; }
        public Builder bodyPart(String v) { this.bodyPart = v; return this; }
        public Builder seriesInstanceCount(Integer v) { this.seriesInstanceCount = v; return this; }
        public Builder sopInstanceUid(String v) { this.sopInstanceUid = v; return this; }
        public Builder sopClassUid(String v) { this.sopClassUid = v; return this; }
        public Builder instanceNumber(Integer v) { this.instanceNumber = v; return this; }
        public Builder numberOfFrames(Integer v) { this.numberOfFrames = v; return this; }
        public Builder rows(Integer v) { this.rows = v; return this; }
        public Builder columns(Integer v) { this.columns = v; return this; }
        public Builder bitsAllocated(Integer v) { this.bitsAllocated = v; return this; }
        public Builder bitsStored(Integer v) { this.bitsStored = v; return this; }
        public Builder transferSyntaxUid(String v) { this.transferSyntaxUid = v; return this; }
        public Builder pixelData(BinaryReference v) { this.pixelData = v; return this; }

        /**
         * Build the record, filling absent required text fields with {@link #UNKNOWN}.
         */
        public DicomMetadata build() {
            Patient patient = new Patient(orUnknown(patientName), orUnknown(patientId),
                    patientBirthDate, orUnknown(patientSex));
            Study study = new Study(studyInstanceUid, studyDate, studyTime, orUnknown(studyDescription),
                    accessionNumber, studyId, studyInstanceCount);
            Series series = new Series(seriesInstanceUid, seriesDate, seriesTime, orUnknown(seriesDescription),
                    orUnknown(modality), seriesNumber, bodyPart, seriesInstanceCount);
            Image image = new Image(sopInstanceUid, sopClassUid, instanceNumber, numberOfFrames,
                    rows, columns, bitsAllocated, bitsStored);
            return new DicomMetadata(patient, study, series, image, transferSyntaxUid, pixelData);
        }

        private static String orUnknown(String value) {
            return value == null || value.isEmpty() ? UNKNOWN : value;
        }
    }
}
