/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.validation;

import io.xnatworks.pacs.dicom.DicomMetadata;
import io.xnatworks.pacs.model.DicomInstance;
import io.xnatworks.pacs.model.DicomSeries;
import io.xnatworks.pacs.model.DicomStudy;
import io.xnatworks.pacs.model.ImagingOrder;
import io.xnatworks.pacs.model.ImagingReport;
import io.xnatworks.pacs.model.MedicalSpecialty;
import io.xnatworks.pacs.model.SearchParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Format and consistency checks for DICOM identifiers and PACS objects.
 *
 * Field checks return a boolean; composite checks return a {@link ValidationResult}.
 * Invalid content is never reported by throwing.
 */
public final class DicomValidator {
    private static final Logger log = LoggerFactory.getLogger(DicomValidator.class);

    public static final int MAX_UID_LENGTH = 64;
    public static final long MIN_FILE_SIZE = 128;
    public static final long MAX_FILE_SIZE = 2L * 1024 * 1024 * 1024;
    public static final int MAX_SEARCH_LIMIT = 1000;

    private static final Pattern UID_PATTERN = Pattern.compile("^[0-9]+(\\.[0-9]+)*$");
    private static final Pattern PATIENT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");
    private static final Pattern DATE_PATTERN = Pattern.compile("^(\\d{4})-?(\\d{2})-?(\\d{2})$");
    private static final Pattern DICOM_TIME_PATTERN = Pattern.compile("^(\\d{2})(\\d{2})(\\d{2})(\\.\\d{1,6})?$");
    private static final Pattern ISO_TIME_PATTERN = Pattern.compile("^(\\d{2}):(\\d{2}):(\\d{2})(\\.\\d{1,6})?$");
    private static final Pattern NAME_DISALLOWED = Pattern.compile("[^\\w\\s^]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> MODALITIES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "CR", "CT", "MR", "NM", "US", "OT", "BI", "CD", "DD", "DG",
            "ES", "LS", "PT", "RG", "ST", "TG", "XA", "RF", "RTIMAGE",
            "RTDOSE", "RTSTRUCT", "RTPLAN", "RTRECORD", "HC", "DX", "MG",
            "IO", "PX", "GM", "SM", "XC", "PR", "AU", "EPS", "HD", "SR",
            "IVUS", "OP", "SMR", "ECG", "RESP", "KO", "SEG", "REG")));

    private static final Set<Integer> BITS_ALLOCATED = Set.of(8, 16, 32);
    private static final Set<String> URGENCIES = Set.of(
            ImagingOrder.URGENCY_ROUTINE, ImagingOrder.URGENCY_URGENT, ImagingOrder.URGENCY_STAT);
    private static final Set<String> REPORT_STATUSES = Set.of(
            ImagingReport.STATUS_PRELIMINARY, ImagingReport.STATUS_FINAL, ImagingReport.STATUS_AMENDED);
    private static final Set<String> FILE_EXTENSIONS = Set.of(".dcm", ".dicom", ".ima", ".img");

    private DicomValidator() {
    }

    // ========================================================================
    // Field checks
    // ========================================================================

    /**
     * Dot-separated numeric components, 1 to 64 characters, no empty component.
     */
    public static boolean validateStudyInstanceUID(String uid) {
        return uid != null && !uid.isEmpty() && uid.length() <= MAX_UID_LENGTH
                && UID_PATTERN.matcher(uid).matches();
    }

    public static boolean validateSeriesInstanceUID(String uid) {
        return validateStudyInstanceUID(uid);
    }

    public static boolean validateSOPInstanceUID(String uid) {
        return validateStudyInstanceUID(uid);
    }

    /**
     * Letters, digits, hyphen and underscore, 1 to 64 characters after trimming.
     */
    public static boolean validatePatientID(String patientId) {
        if (patientId == null) {
            return false;
        }
        return PATIENT_ID_PATTERN.matcher(patientId.trim()).matches();
    }

    public static boolean validateModality(String modality) {
        return canonicalModality(modality) != null;
    }

    /**
     * Upper-cased modality code, or null if it is not a known modality.
     */
    public static String canonicalModality(String modality) {
        if (modality == null) {
            return null;
        }
        String code = modality.trim().toUpperCase(Locale.ROOT);
        return MODALITIES.contains(code) ? code : null;
    }

    public static Set<String> knownModalities() {
        return MODALITIES;
    }

    /**
     * {@code YYYYMMDD} or {@code YYYY-MM-DD}, year 1900 to 2100, and a real calendar date.
     */
    public static boolean validateDicomDate(String date) {
        if (date == null) {
            return false;
        }
        Matcher m = DATE_PATTERN.matcher(date);
        if (!m.matches()) {
            return false;
        }
        // Reject mixed forms such as 2024-0115
        if (date.length() != 8 && date.length() != 10) {
            return false;
        }
        int year = Integer.parseInt(m.group(1));
        if (year < 1900 || year > 2100) {
            return false;
        }
        try {
            LocalDate.of(year, Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    /**
     * {@code HHMMSS[.F{1,6}]} or {@code HH:MM:SS[.F{1,6}]}; hours up to 23, minutes and seconds up to 59.
     */
    public static boolean validateDicomTime(String time) {
        if (time == null) {
            return false;
        }
        Matcher m = DICOM_TIME_PATTERN.matcher(time);
        if (!m.matches()) {
            m = ISO_TIME_PATTERN.matcher(time);
            if (!m.matches()) {
                return false;
            }
        }
        int hours = Integer.parseInt(m.group(1));
        int minutes = Integer.parseInt(m.group(2));
        int seconds = Integer.parseInt(m.group(3));
        return hours <= 23 && minutes <= 59 && seconds <= 59;
    }

    public static boolean validateMedicalSpecialty(String specialty) {
        return MedicalSpecialty.fromCode(specialty) != null;
    }

    /**
     * Keep word characters, whitespace and {@code ^}; collapse whitespace, trim and upper-case.
     * Meant for display and logging, never for identity comparisons.
     */
    public static String sanitizePatientName(String name) {
        if (name == null) {
            return "";
        }
        String cleaned = NAME_DISALLOWED.matcher(name).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        return cleaned.toUpperCase(Locale.ROOT);
    }

    // ========================================================================
    // Composite checks
    // ========================================================================

    /**
     * Check an assembled metadata record. Values holding the "Unknown" sentinel count as missing.
     */
    public static ValidationResult validateMetadata(DicomMetadata metadata) {
        List<String> errors = new ArrayList<>();
        DicomMetadata.Patient patient = metadata.getPatient();
        DicomMetadata.Study study = metadata.getStudy();
        DicomMetadata.Series series = metadata.getSeries();
        DicomMetadata.Image image = metadata.getImage();

        if (!validateStudyInstanceUID(study.getInstanceUid())) {
            errors.add("Invalid or missing Study Instance UID");
        }
        if (!validateSeriesInstanceUID(series.getInstanceUid())) {
            errors.add("Invalid or missing Series Instance UID");
        }
        if (!validateSOPInstanceUID(image.getSopInstanceUid())) {
            errors.add("Invalid or missing SOP Instance UID");
        }
        if (isMissing(patient.getId()) || !validatePatientID(patient.getId())) {
            errors.add("Invalid or missing Patient ID");
        }
        if (isMissing(patient.getName())) {
            errors.add("Patient name is required");
        }
        if (isMissing(study.getDescription())) {
            errors.add("Study description is required");
        }
        if (study.getDate() != null && !validateDicomDate(study.getDate())) {
            errors.add("Invalid study date");
        }
        if (study.getTime() != null && !validateDicomTime(study.getTime())) {
            errors.add("Invalid study time format");
        }
        if (!validateModality(series.getModality())) {
            errors.add("Invalid or missing modality");
        }
        if (image.getInstanceNumber() != null && image.getInstanceNumber() < 1) {
            errors.add("Instance number must be at least 1");
        }
        if (study.getNumberOfInstances() != null && study.getNumberOfInstances() < 0) {
            errors.add("Study instance count must be a non-negative number");
        }
        if (series.getNumberOfInstances() != null && series.getNumberOfInstances() < 1) {
            errors.add("Series instance count must be at least 1");
        }
        checkImage(image.getRows(), image.getColumns(), image.getBitsAllocated(), image.getBitsStored(), errors);

        return new ValidationResult(errors);
    }

    public static ValidationResult validateStudy(DicomStudy study) {
        List<String> errors = new ArrayList<>();

        if (!validateStudyInstanceUID(study.getStudyInstanceUid())) {
            errors.add("Invalid or missing Study Instance UID");
        }
        if (!validatePatientID(study.getPatientId())) {
            errors.add("Invalid or missing Patient ID");
        }
        if (isBlank(study.getPatientName())) {
            errors.add("Patient name is required");
        }
        if (isBlank(study.getStudyDescription())) {
            errors.add("Study description is required");
        }
        if (!validateDicomDate(study.getStudyDate())) {
            errors.add("Invalid or missing study date");
        }
        if (study.getStudyTime() != null && !validateDicomTime(study.getStudyTime())) {
            errors.add("Invalid study time format");
        }
        if (!validateModality(study.getModality())) {
            errors.add("Invalid or missing modality");
        }
        if (!validateMedicalSpecialty(study.getSpecialty())) {
            errors.add("Invalid or missing medical specialty");
        }
        if (study.getSeriesCount() == null || study.getSeriesCount() < 0) {
            errors.add("Series count must be a non-negative number");
        }
        if (study.getInstanceCount() == null || study.getInstanceCount() < 0) {
            errors.add("Instance count must be a non-negative number");
        }

        return new ValidationResult(errors);
    }

    /**
     * A series is only known once it holds an instance, so its instance count must be at least 1.
     */
    public static ValidationResult validateSeries(DicomSeries series) {
        List<String> errors = new ArrayList<>();

        if (!validateSeriesInstanceUID(series.getSeriesInstanceUid())) {
            errors.add("Invalid or missing Series Instance UID");
        }
        if (!validateStudyInstanceUID(series.getStudyInstanceUid())) {
            errors.add("Invalid or missing Study Instance UID");
        }
        if (series.getSeriesNumber() == null || series.getSeriesNumber() < 0) {
            errors.add("Series number must be a non-negative number");
        }
        if (!validateModality(series.getModality())) {
            errors.add("Invalid or missing modality");
        }
        if (series.getInstanceCount() == null || series.getInstanceCount() < 1) {
            errors.add("Series instance count must be at least 1");
        }

        return new ValidationResult(errors);
    }

    public static ValidationResult validateInstance(DicomInstance instance) {
        List<String> errors = new ArrayList<>();

        if (!validateSOPInstanceUID(instance.getSopInstanceUid())) {
            errors.add("Invalid or missing SOP Instance UID");
        }
        if (!validateSeriesInstanceUID(instance.getSeriesInstanceUid())) {
            errors.add("Invalid or missing Series Instance UID");
        }
        if (instance.getInstanceNumber() == null || instance.getInstanceNumber() < 1) {
            errors.add("Instance number must be at least 1");
        }
        if (isBlank(instance.getSopClassUid())) {
            errors.add("SOP Class UID is required");
        }
        checkImage(instance.getRows(), instance.getColumns(),
                instance.getBitsAllocated(), instance.getBitsStored(), errors);

        return new ValidationResult(errors);
    }

    public static ValidationResult validateOrder(ImagingOrder order) {
        List<String> errors = new ArrayList<>();

        if (isBlank(order.getOrderId())) {
            errors.add("Order ID is required");
        }
        if (!validatePatientID(order.getPatientId())) {
            errors.add("Invalid or missing Patient ID");
        }
        if (!validateModality(order.getModality())) {
            errors.add("Invalid or missing modality");
        }
        if (order.getUrgency() == null || !URGENCIES.contains(order.getUrgency())) {
            errors.add("Urgency must be one of routine, urgent, stat");
        }
        if (order.getSpecialty() != null && !validateMedicalSpecialty(order.getSpecialty())) {
            errors.add("Invalid medical specialty");
        }

        return new ValidationResult(errors);
    }

    /**
     * Final and amended reports must carry findings or an impression.
     */
    public static ValidationResult validateReport(ImagingReport report) {
        List<String> errors = new ArrayList<>();

        if (isBlank(report.getReportId())) {
            errors.add("Report ID is required");
        }
        if (!validateStudyInstanceUID(report.getStudyInstanceUid())) {
            errors.add("Invalid or missing Study Instance UID");
        }
        if (report.getStatus() == null || !REPORT_STATUSES.contains(report.getStatus())) {
            errors.add("Report status must be one of preliminary, final, amended");
        } else if (!ImagingReport.STATUS_PRELIMINARY.equals(report.getStatus())
                && isBlank(report.getFindings()) && isBlank(report.getImpression())) {
            errors.add("A " + report.getStatus() + " report requires findings or an impression");
        }

        return new ValidationResult(errors);
    }

    /**
     * Check that a file exists and its size is plausible for DICOM (128 bytes to 2 GB).
     * An unusual extension is logged but not reported as an error.
     */
    public static ValidationResult validateDicomFile(Path file) {
        List<String> errors = new ArrayList<>();

        if (!Files.isRegularFile(file)) {
            errors.add("File not found: " + file);
            return new ValidationResult(errors);
        }

        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            log.warn("Could not determine size of {}: {}", file, e.getMessage());
            errors.add("Could not read file size: " + e.getMessage());
            return new ValidationResult(errors);
        }

        if (size > MAX_FILE_SIZE) {
            errors.add("File size " + size + " exceeds maximum allowed size of " + MAX_FILE_SIZE + " bytes");
        }
        if (size < MIN_FILE_SIZE) {
            errors.add("File size " + size + " is below minimum required size of " + MIN_FILE_SIZE + " bytes");
        }

        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot >= 0 && !FILE_EXTENSIONS.contains(name.substring(dot))) {
            log.warn("File {} has unusual extension for DICOM file", file.getFileName());
        }

        return new ValidationResult(errors);
    }

    /**
     * Check search criteria. The sanitized copy holds trimmed values that passed; for
     * modality and specialty lists only the valid members are kept (modalities upper-cased).
     */
    public static SearchValidationResult validateSearchParameters(SearchParameters params) {
        List<String> errors = new ArrayList<>();
        SearchParameters sanitized = new SearchParameters();

        if (params.getPatientId() != null) {
            if (validatePatientID(params.getPatientId())) {
                sanitized.setPatientId(params.getPatientId().trim());
            } else {
                errors.add("Invalid Patient ID format");
            }
        }

        if (params.getPatientName() != null) {
            if (!isBlank(params.getPatientName())) {
                sanitized.setPatientName(params.getPatientName().trim());
            } else {
                errors.add("Patient name must be a non-empty string");
            }
        }

        if (params.getStudyDateFrom() != null) {
            if (validateDicomDate(params.getStudyDateFrom())) {
                sanitized.setStudyDateFrom(params.getStudyDateFrom());
            } else {
                errors.add("Invalid from date format");
            }
        }

        if (params.getStudyDateTo() != null) {
            if (validateDicomDate(params.getStudyDateTo())) {
                sanitized.setStudyDateTo(params.getStudyDateTo());
            } else {
                errors.add("Invalid to date format");
            }
        }

        if (params.getModalities() != null) {
            List<String> valid = new ArrayList<>();
            for (String modality : params.getModalities()) {
                String code = canonicalModality(modality);
                if (code != null) {
                    valid.add(code);
                }
            }
            if (!valid.isEmpty()) {
                sanitized.setModalities(valid);
            }
            if (valid.size() != params.getModalities().size()) {
                errors.add("Some modalities are invalid");
            }
        }

        if (params.getSpecialties() != null) {
            List<String> valid = new ArrayList<>();
            for (String specialty : params.getSpecialties()) {
                if (validateMedicalSpecialty(specialty)) {
                    valid.add(specialty);
                }
            }
            if (!valid.isEmpty()) {
                sanitized.setSpecialties(valid);
            }
            if (valid.size() != params.getSpecialties().size()) {
                errors.add("Some specialties are invalid");
            }
        }

        if (params.getLimit() != null) {
            if (params.getLimit() < 1 || params.getLimit() > MAX_SEARCH_LIMIT) {
                errors.add("Limit must be a number between 1 and " + MAX_SEARCH_LIMIT);
            } else {
                sanitized.setLimit(params.getLimit());
            }
        }

        if (params.getOffset() != null) {
            if (params.getOffset() < 0) {
                errors.add("Offset must be a non-negative number");
            } else {
                sanitized.setOffset(params.getOffset());
            }
        }

        if (params.getAccessionNumber() != null) {
            if (!isBlank(params.getAccessionNumber())) {
                sanitized.setAccessionNumber(params.getAccessionNumber().trim());
            } else {
                errors.add("Accession number must be a non-empty string");
            }
        }

        if (params.getStudyDescription() != null) {
            if (!isBlank(params.getStudyDescription())) {
                sanitized.setStudyDescription(params.getStudyDescription().trim());
            } else {
                errors.add("Study description must be a non-empty string");
            }
        }

        return new SearchValidationResult(errors, sanitized);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static void checkImage(Integer rows, Integer columns, Integer bitsAllocated, Integer bitsStored,
                                   List<String> errors) {
        if (rows != null && rows <= 0) {
            errors.add("Rows must be a positive number");
        }
        if (columns != null && columns <= 0) {
            errors.add("Columns must be a positive number");
        }
        if (bitsAllocated != null && !BITS_ALLOCATED.contains(bitsAllocated)) {
            errors.add("Bits allocated must be 8, 16, or 32");
        }
        if (bitsStored != null && bitsAllocated != null && bitsStored > bitsAllocated) {
            errors.add("Bits stored cannot exceed bits allocated");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isMissing(String value) {
        return isBlank(value) || DicomMetadata.UNKNOWN.equals(value);
    }
}
