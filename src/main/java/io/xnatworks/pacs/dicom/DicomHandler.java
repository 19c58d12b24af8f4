/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs.dicom;

import io.xnatworks.pacs.validation.DicomValidator;
import io.xnatworks.pacs.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads DICOM files and buffers into metadata and image data.
 *
 * Stateless; one instance can serve concurrent callers working on independent buffers.
 */
public class DicomHandler {
    private static final Logger log = LoggerFactory.getLogger(DicomHandler.class);

    /**
     * True when the buffer has the 128-byte preamble followed by {@code DICM}.
     */
    public boolean isValidDicom(byte[] buffer) {
        return ElementWalker.isValidDicom(buffer);
    }

    /**
     * Read a file into memory and check the DICM marker.
     *
     * @throws NoSuchFileException if the file does not exist
     * @throws DicomParseException if the file is not a DICOM container
     */
    public byte[] readDicomFile(Path filePath) throws IOException, DicomParseException {
        if (!Files.isRegularFile(filePath)) {
            throw new NoSuchFileException(filePath.toString(), null, "DICOM file not found");
        }
        byte[] buffer = Files.readAllBytes(filePath);
        if (!isValidDicom(buffer)) {
            throw new DicomParseException(DicomParseException.Reason.MALFORMED_CONTAINER,
                    "Invalid DICOM file: " + filePath);
        }
        log.debug("Read DICOM file {} ({} bytes)", filePath, buffer.length);
        return buffer;
    }

    /**
     * Parse the dataset of a buffer into metadata.
     *
     * @throws DicomParseException with {@code MALFORMED_CONTAINER} when the buffer is not DICOM
     */
    public DicomMetadata parseMetadata(byte[] buffer) throws DicomParseException {
        Objects.requireNonNull(buffer, "buffer");
        ElementWalker walker = ElementWalker.walk(buffer);
        DicomMetadata metadata = MetadataAssembler.assemble(walker);
        logTermination(walker);
        log.debug("Parsed metadata for study {} / SOP {}",
                metadata.getStudy().getInstanceUid(), metadata.getImage().getSopInstanceUid());
        return metadata;
    }

    /**
     * Parse metadata and locate the pixel data of a buffer.
     *
     * @throws DicomParseException with {@code MALFORMED_CONTAINER} when the buffer is not DICOM, or
     *                             {@code MISSING_PIXEL_DATA} when there is no (7FE0,0010) element
     */
    public ImageData extractImageData(byte[] buffer) throws DicomParseException {
        DicomMetadata metadata = parseMetadata(buffer);
        BinaryReference reference = metadata.getPixelData();
        if (reference == null) {
            throw new DicomParseException(DicomParseException.Reason.MISSING_PIXEL_DATA,
                    "No pixel data found in DICOM buffer");
        }

        PixelData pixelData = new PixelData(buffer, reference);
        DicomMetadata.Image image = metadata.getImage();
        ImageInfo info = new ImageInfo(image.getColumns(), image.getRows(),
                image.getBitsAllocated(), image.getBitsStored(), pixelData.getLength());

        log.debug("Extracted image {}x{} with {} bytes of pixel data",
                info.getWidth(), info.getHeight(), info.getPixelDataLength());
        return new ImageData(pixelData, info, metadata);
    }

    /**
     * Read, parse and validate one file. Never throws for file or content problems.
     */
    public ProcessingResult processDicomFile(Path filePath) {
        log.debug("Processing DICOM file {}", filePath);
        byte[] buffer;
        DicomMetadata metadata;
        try {
            buffer = readDicomFile(filePath);
            metadata = parseMetadata(buffer);
        } catch (NoSuchFileException e) {
            log.warn("DICOM file not found: {}", filePath);
            return ProcessingResult.failure(filePath, ProcessingResult.ErrorKind.FILE_NOT_FOUND,
                    "DICOM file not found: " + filePath);
        } catch (DicomParseException e) {
            log.warn("Invalid DICOM file {}: {}", filePath, e.getMessage());
            return ProcessingResult.failure(filePath, ProcessingResult.ErrorKind.INVALID_DICOM, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read DICOM file {}: {}", filePath, e.getMessage(), e);
            return ProcessingResult.failure(filePath, ProcessingResult.ErrorKind.IO_ERROR, e.getMessage());
        }

        ImageData imageData = null;
        if (metadata.getPixelData() != null) {
            try {
                imageData = extractImageData(buffer);
            } catch (DicomParseException e) {
                log.warn("Could not extract image data from {}: {}", filePath, e.getMessage());
            }
        }

        ValidationResult validation = DicomValidator.validateMetadata(metadata);
        if (!validation.isValid()) {
            log.info("File {} parsed with {} validation warnings", filePath, validation.getErrors().size());
        }

        log.info("Processed {} (patient {}, image data: {})", filePath,
                DicomValidator.sanitizePatientName(metadata.getPatient().getName()), imageData != null);
        return ProcessingResult.success(filePath, buffer.length, metadata, imageData, validation);
    }

    /**
     * Process several files. Each failure is isolated to its own result.
     */
    public List<ProcessingResult> batchProcessDicomFiles(List<Path> filePaths) {
        log.info("Starting batch processing of {} files", filePaths.size());

        List<ProcessingResult> results = new ArrayList<>(filePaths.size());
        for (Path filePath : filePaths) {
            try {
                results.add(processDicomFile(filePath));
            } catch (RuntimeException e) {
                log.error("Unexpected failure processing {}: {}", filePath, e.getMessage(), e);
                results.add(ProcessingResult.failure(filePath, ProcessingResult.ErrorKind.IO_ERROR, e.getMessage()));
            }
        }

        long successful = results.stream().filter(ProcessingResult::isValid).count();
        log.info("Batch processing completed: {} files, {} successful, {} failed",
                filePaths.size(), successful, filePaths.size() - successful);
        return results;
    }

    /**
     * List DICOM files in a directory, by extension or by DICM marker.
     */
    public List<Path> findDicomFiles(Path directory, boolean recursive) {
        List<Path> results = new ArrayList<>();
        scanDirectory(directory.toFile(), results, recursive);
        return results;
    }

    private void scanDirectory(File dir, List<Path> results, boolean recursive) {
        File[] files = dir.listFiles();
        if (files == null) {
            return;
        }
        for (File f : files) {
            if (f.isFile() && isDicomFile(f)) {
                results.add(f.toPath());
            } else if (f.isDirectory() && recursive) {
                scanDirectory(f, results, true);
            }
        }
    }

    private boolean isDicomFile(File file) {
        String name = file.getName().toLowerCase();
        if (name.endsWith(".dcm") || name.endsWith(".dicom")) {
            return true;
        }

        if (file.length() >= ElementWalker.DATASET_OFFSET) {
            try (RandomAccessFile raf = new RandomAccessFile(file, "r")) {
                raf.seek(ElementWalker.PREAMBLE_LENGTH);
                byte[] magic = new byte[4];
                raf.readFully(magic);
                return magic[0] == 'D' && magic[1] == 'I' && magic[2] == 'C' && magic[3] == 'M';
            } catch (IOException e) {
                log.debug("Could not read {}: {}", file, e.getMessage());
            }
        }
        return false;
    }

    private void logTermination(ElementWalker walker) {
        if (walker.getTermination() == ElementWalker.Termination.TRUNCATED_ELEMENT) {
            log.warn("Stopped at malformed trailing element: {}", walker.getTerminationError().getMessage());
        } else if (walker.getTermination() == ElementWalker.Termination.UNDEFINED_LENGTH) {
            log.info("Stopped at undefined-length element; nested sequences are not parsed");
        }
    }
}
