/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Study search criteria. Unset fields are null and do not constrain the search.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchParameters {

    private String patientId;
    private String patientName;
    private String studyDateFrom;
    private String studyDateTo;
    private List<String> modalities;
    private List<String> specialties;
    private String accessionNumber;
    private String studyDescription;
    private Integer limit;
    private Integer offset;

    public SearchParameters() {
    }

    /**
     * Stable key for caching the results of this search, e.g. {@code patientId=P1|modalities=CT,MR|limit=50}.
     */
    public String toCacheKey() {
        StringJoiner key = new StringJoiner("|");
        append(key, "patientId", patientId);
        append(key, "patientName", patientName);
        append(key, "from", studyDateFrom);
        append(key, "to", studyDateTo);
        append(key, "modalities", modalities != null ? String.join(",", modalities) : null);
        append(key, "specialties", specialties != null ? String.join(",", specialties) : null);
        append(key, "accession", accessionNumber);
        append(key, "description", studyDescription);
        append(key, "limit", limit);
        append(key, "offset", offset);
        return key.length() == 0 ? "all" : key.toString();
    }

    private static void append(StringJoiner key, String name, Object value) {
        if (value != null) {
            key.add(name + "=" + value);
        }
    }

    public String getPatientId() { return patientId; }
    public void setPatientId(String patientId) { this.patientId = patientId; }

    public String getPatientName() { return patientName; }
    public void setPatientName(String patientName) { this.patientName = patientName; }

    public String getStudyDateFrom() { return studyDateFrom; }
    public void setStudyDateFrom(String studyDateFrom) { this.studyDateFrom = studyDateFrom; }

    public String getStudyDateTo() { return studyDateTo; }
    public void setStudyDateTo(String studyDateTo) { this.studyDateTo = studyDateTo; }

    public List<String> getModalities() { return modalities; }
    public void setModalities(List<String> modalities) { this.modalities = modalities; }

    public List<String> getSpecialties() { return specialties; }
    public void setSpecialties(List<String> specialties) { this.specialties = specialties; }

    public String getAccessionNumber() { return accessionNumber; }
    public void setAccessionNumber(String accessionNumber) { this.accessionNumber = accessionNumber; }

    public String getStudyDescription() { return studyDescription; }
    public void setStudyDescription(String studyDescription) { this.studyDescription = studyDescription; }

    public Integer getLimit() { return limit; }
    public void setLimit(Integer limit) { this.limit = limit; }

    public Integer getOffset() { return offset; }
    public void setOffset(Integer offset) { this.offset = offset; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchParameters)) return false;
        SearchParameters that = (SearchParameters) o;
        return toCacheKey().equals(that.toCacheKey());
    }

    @Override
    public int hashCode() {
        return Objects.hash(toCacheKey());
    }

    @Override
    public String toString() {
        return "SearchParameters{" + toCacheKey() + "}";
    }
}
