/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * A diagnostic report written against a study.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImagingReport {

    public static final String STATUS_PRELIMINARY = "preliminary";
    public static final String STATUS_FINAL = "final";
    public static final String STATUS_AMENDED = "amended";

    private String reportId;
    private String studyInstanceUid;
    private String authorId;
    private String status = STATUS_PRELIMINARY;
    private String findings;
    private String impression;
    private Instant reportedAt;

    public ImagingReport() {
    }

    public String getReportId() { return reportId; }
    public void setReportId(String reportId) { this.reportId = reportId; }

    public String getStudyInstanceUid() { return studyInstanceUid; }
    public void setStudyInstanceUid(String studyInstanceUid) { this.studyInstanceUid = studyInstanceUid; }

    public String getAuthorId() { return authorId; }
    public void setAuthorId(String authorId) { this.authorId = authorId; }

    /** One of preliminary, final, amended. */
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getFindings() { return findings; }
    public void setFindings(String findings) { this.findings = findings; }

    public String getImpression() { return impression; }
    public void setImpression(String impression) { this.impression = impression; }

    public Instant getReportedAt() { return reportedAt; }
    public void setReportedAt(Instant reportedAt) { this.reportedAt = reportedAt; }
}
