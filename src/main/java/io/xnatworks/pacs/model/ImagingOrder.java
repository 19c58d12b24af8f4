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
 * A request for an imaging procedure.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImagingOrder {

    public static final String URGENCY_ROUTINE = "routine";
    public static final String URGENCY_URGENT = "urgent";
    public static final String URGENCY_STAT = "stat";

    private String orderId;
    private String patientId;
    private String modality;
    private String bodyPart;
    private String specialty;
    private String urgency = URGENCY_ROUTINE;
    private String clinicalIndication;
    private String accessionNumber;
    private Instant orderedAt;

    public ImagingOrder() {
    }

    public String getOrderId() { return orderId; }
    public void setOrderId(String orderId) { this.orderId = orderId; }

    public String getPatientId() { return patientId; }
    public void setPatientId(String patientId) { this.patientId = patientId; }

    public String getModality() { return modality; }
    public void setModality(String modality) { this.modality = modality; }

    public String getBodyPart() { return bodyPart; }
    public void setBodyPart(String bodyPart) { this.bodyPart = bodyPart; }

    public String getSpecialty() { return specialty; }
    public void setSpecialty(String specialty) { this.specialty = specialty; }

    /** One of routine, urgent, stat. */
    public String getUrgency() { return urgency; }
    public void setUrgency(String urgency) { this.urgency = urgency; }

    public String getClinicalIndication() { return clinicalIndication; }
    public void setClinicalIndication(String clinicalIndication) { this.clinicalIndication = clinicalIndication; }

    public String getAccessionNumber() { return accessionNumber; }
    public void setAccessionNumber(String accessionNumber) { this.accessionNumber = accessionNumber; }

    public Instant getOrderedAt() { return orderedAt; }
    public void setOrderedAt(Instant orderedAt) { this.orderedAt = orderedAt; }
}
