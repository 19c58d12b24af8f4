/*
 * PACS DICOM Codec and Cache
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.pacs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.xnatworks.pacs.cache.CacheService;
import io.xnatworks.pacs.cache.DicomCacheService;
import io.xnatworks.pacs.config.AppConfig;
import io.xnatworks.pacs.dicom.DicomHandler;
import io.xnatworks.pacs.dicom.DicomMetadata;
import io.xnatworks.pacs.dicom.DicomParseException;
import io.xnatworks.pacs.dicom.ImageData;
import io.xnatworks.pacs.dicom.ImageInfo;
import io.xnatworks.pacs.dicom.ProcessingResult;
import io.xnatworks.pacs.model.MedicalSpecialty;
import io.xnatworks.pacs.prefetch.DirectoryInstanceSource;
import io.xnatworks.pacs.prefetch.PrefetchEngine;
import io.xnatworks.pacs.prefetch.PrefetchReport;
import io.xnatworks.pacs.prefetch.PrefetchRule;
import io.xnatworks.pacs.prefetch.SpecialtyPrefetchRules;
import io.xnatworks.pacs.validation.DicomValidator;
import io.xnatworks.pacs.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * PACS DICOM Codec - Command Line Interface
 *
 * Reads DICOM files into structured metadata and can:
 * - Extract pixel data and image geometry
 * - Validate files and their metadata
 * - Batch-process a directory into the cache
 * - Warm the cache with prefetch rules
 */
@Command(name = "pacs-codec",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "PACS DICOM Codec - Parse, validate and cache DICOM objects",
        subcommands = {
                PacsCodec.ParseCommand.class,
                PacsCodec.ExtractCommand.class,
                PacsCodec.ValidateCommand.class,
                PacsCodec.BatchCommand.class,
                PacsCodec.PrefetchCommand.class
        })
public class PacsCodec implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(PacsCodec.class);

    @Option(names = {"-c", "--config"}, description = "Config file path", defaultValue = "config.yaml")
    protected File configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PacsCodec()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    static ObjectMapper jsonMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // ========================================================================
    // PARSE COMMAND - Print metadata
    // ========================================================================

    @Command(name = "parse", description = "Parse a DICOM file and print its metadata as JSON")
    static class ParseCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "DICOM file")
        private Path file;

        @Override
        public Integer call() throws Exception {
            DicomHandler handler = new DicomHandler();
            try {
                DicomMetadata metadata = handler.parseMetadata(handler.readDicomFile(file));
                System.out.println(jsonMapper().writeValueAsString(metadata));
                return 0;
            } catch (NoSuchFileException e) {
                System.err.println("File not found: " + file);
                return 1;
            } catch (DicomParseException e) {
                System.err.println("Error: " + e.getMessage() + " [" + e.getReason() + "]");
                return 1;
            }
        }
    }

    // ========================================================================
    // EXTRACT COMMAND - Pixel data
    // ========================================================================

    @Command(name = "extract", description = "Extract pixel data from a DICOM file")
    static class ExtractCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "DICOM file")
        private Path file;

        @Option(names = {"-o", "--output"}, description = "Write the raw pixel bytes to this file")
        private Path output;

        @Override
        public Integer call() throws Exception {
            DicomHandler handler = new DicomHandler();
            ImageData image;
            try {
                image = handler.extractImageData(handler.readDicomFile(file));
            } catch (NoSuchFileException e) {
                System.err.println("File not found: " + file);
                return 1;
            } catch (DicomParseException e) {
                System.err.println("Error: " + e.getMessage() + " [" + e.getReason() + "]");
                return 1;
            }

            ImageInfo info = image.getImageInfo();
            System.out.println();
            System.out.println("Image: " + file.getFileName());
            System.out.println("─────────────────────────────────────────────────────────");
            System.out.printf("  %-18s %s%n", "SOP Instance UID:", image.getMetadata().getImage().getSopInstanceUid());
            System.out.printf("  %-18s %s x %s%n", "Dimensions:", orDash(info.getWidth()), orDash(info.getHeight()));
            System.out.printf("  %-18s %s / %s%n", "Bits (alloc/stored):",
                    orDash(info.getBitsAllocated()), orDash(info.getBitsStored()));
            System.out.printf("  %-18s %d bytes at offset %d%n", "Pixel data:",
                    info.getPixelDataLength(), image.getPixelData().getOffset());

            if (output != null) {
                Files.write(output, image.getPixelData().toByteArray());
                System.out.println("  Written to: " + output);
            }
            System.out.println();
            return 0;
        }

        private static String orDash(Integer value) {
            return value != null ? value.toString() : "-";
        }
    }

    // ========================================================================
    // VALIDATE COMMAND
    // ========================================================================

    @Command(name = "validate", description = "Validate a DICOM file and its metadata")
    static class ValidateCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "DICOM file")
        private Path file;

        @Override
        public Integer call() {
            ValidationResult fileCheck = DicomValidator.validateDicomFile(file);
            if (!fileCheck.isValid()) {
                printErrors("File", fileCheck);
                return 1;
            }

            ProcessingResult result = new DicomHandler().processDicomFile(file);
            if (!result.isValid()) {
                System.out.println("INVALID (" + result.getErrorKind() + "): " + result.getError());
                return 1;
            }
            if (!result.getValidation().isValid()) {
                printErrors("Metadata", result.getValidation());
                return 1;
            }
            System.out.println("VALID: " + file);
            return 0;
        }

        private void printErrors(String what, ValidationResult validation) {
            System.out.println("INVALID: " + file);
            for (String error : validation.getErrors()) {
                System.out.println("  " + what + ": " + error);
            }
        }
    }

    // ========================================================================
    // BATCH COMMAND - Process a directory
    // ========================================================================

    @Command(name = "batch", description = "Process every DICOM file in a directory")
    static class BatchCommand implements Callable<Integer> {

        @ParentCommand
        private PacsCodec parent;

        @Parameters(index = "0", description = "Directory of DICOM files")
        private Path directory;

        @Option(names = {"-r", "--recursive"}, description = "Include subdirectories")
        private boolean recursive;

        @Option(names = {"--cache"}, description = "Store metadata and pixel data in the configured cache")
        private boolean cache;

        @Override
        public Integer call() throws Exception {
            DicomHandler handler = new DicomHandler();
            List<Path> files = handler.findDicomFiles(directory, recursive);
            if (files.isEmpty()) {
                System.out.println("No DICOM files found in " + directory);
                return 0;
            }

            List<ProcessingResult> results = handler.batchProcessDicomFiles(files);

            System.out.println();
            System.out.printf("%-40s %-8s %-8s %-30s%n", "FILE", "STATUS", "MODALITY", "DETAIL");
            System.out.println("─────────────────────────────────────────────────────────────────────────────────────");
            int failed = 0;
            for (ProcessingResult r : results) {
                String name = r.getFilePath().getFileName().toString();
                if (r.isValid()) {
                    String detail = r.getValidation().isValid()
                            ? "ok" : r.getValidation().getErrors().size() + " warning(s)";
                    System.out.printf("%-40s %-8s %-8s %-30s%n", name, "OK",
                            r.getMetadata().getSeries().getModality(), detail);
                } else {
                    failed++;
                    System.out.printf("%-40s %-8s %-8s %-30s%n", name, "FAILED", "-", r.getErrorKind());
                }
            }
            System.out.println();
            System.out.printf("Processed %d files: %d ok, %d failed%n", results.size(), results.size() - failed, failed);

            if (cache) {
                storeInCache(results);
            }
            return failed == 0 ? 0 : 1;
        }

        private void storeInCache(List<ProcessingResult> results) throws Exception {
            AppConfig config = AppConfig.loadOrDefault(parent.configFile);
            try (CacheService cacheService = CacheService.create(config)) {
                DicomCacheService dicomCache = new DicomCacheService(cacheService, config.getCache());
                int images = 0;
                for (ProcessingResult r : results) {
                    if (!r.isValid()) {
                        continue;
                    }
                    dicomCache.cacheStudyMetadata(r.getMetadata());
                    if (r.getImageData() != null && dicomCache.cacheImageData(
                            r.getMetadata().getImage().getSopInstanceUid(),
                            r.getImageData().getPixelData().toByteArray())) {
                        images++;
                    }
                }
                log.info("Cached {} images from batch", images);
                System.out.println("Cache: " + cacheService.getStats());
            }
        }
    }

    // ========================================================================
    // PREFETCH COMMAND - Warm the cache
    // ========================================================================

    @Command(name = "prefetch", description = "Run prefetch rules over a directory of DICOM files")
    static class PrefetchCommand implements Callable<Integer> {

        @ParentCommand
        private PacsCodec parent;

        @Parameters(index = "0", description = "Directory of DICOM files")
        private Path directory;

        @Option(names = {"--specialty"}, description = "Add the rules of this specialty (e.g. radiology, cardiology)")
        private String specialty;

        @Option(names = {"--json"}, description = "Print the report as JSON")
        private boolean json;

        @Override
        public Integer call() throws Exception {
            AppConfig config = AppConfig.loadOrDefault(parent.configFile);
            if (specialty != null) {
                if (MedicalSpecialty.fromCode(specialty) == null) {
                    System.err.println("Unknown specialty: " + specialty);
                    return 2;
                }
                config.getPrefetch().setSpecialty(specialty);
            }

            DicomHandler handler = new DicomHandler();
            DirectoryInstanceSource source = new DirectoryInstanceSource(directory, handler);
            source.scan();

            List<PrefetchRule> rules = SpecialtyPrefetchRules.fromConfig(config.getPrefetch(), Clock.systemUTC());

            try (CacheService cacheService = CacheService.create(config)) {
                DicomCacheService dicomCache = new DicomCacheService(cacheService, config.getCache());
                PrefetchReport report;
                try (PrefetchEngine engine = new PrefetchEngine(dicomCache, source, config.getPrefetch())) {
                    report = engine.prefetchAsync(rules, source.getKnownStudies()).get();
                }

                if (json) {
                    System.out.println(jsonMapper().writeValueAsString(report));
                    return 0;
                }

                System.out.println();
                System.out.printf("%-22s %-9s %-8s %-9s %-7s %-8s %-7s%n",
                        "RULE", "PRIORITY", "STUDIES", "SCHEDULED", "CACHED", "PRESENT", "FAILED");
                System.out.println("─────────────────────────────────────────────────────────────────────────");
                for (PrefetchReport.RuleResult r : report.getRules()) {
                    if (r.isSkipped()) {
                        System.out.printf("%-22s %-9d %s%n", r.getRuleName(), r.getPriority(), "(disabled)");
                        continue;
                    }
                    System.out.printf("%-22s %-9d %-8d %-9d %-7d %-8d %-7d%n", r.getRuleName(), r.getPriority(),
                            r.getMatchedStudies(), r.getScheduled(), r.getCached(), r.getAlreadyCached(), r.getFailed());
                }
                System.out.println();
                System.out.println("Cache: " + cacheService.getStats());
                return 0;
            }
        }
    }
}
