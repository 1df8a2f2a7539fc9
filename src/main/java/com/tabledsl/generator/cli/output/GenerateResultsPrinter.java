package com.tabledsl.generator.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tabledsl.generator.codegen.GenerationOptions;
import com.tabledsl.generator.codegen.GenerationResult;

/**
 * Responsible only for printing CLI output for the generator.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerationOptions o) {
        log.info("=================================================");
        log.info("tabledsl generator");
        log.info("=================================================");
        log.info("Driver: {}", o.getDriverName());
        log.info("Output Directory: {}", o.getOutputDir());
        log.info("Tables: {}", o.getTableNames().isEmpty() ? "all" : String.join(", ", o.getTableNames()));
        if (!o.getForceCases().isEmpty()) {
            log.info("Force Cases: {}", String.join(", ", o.getForceCases()));
        }
        log.info("=================================================");
    }

    public void printSuccess(GenerationResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Database: {}", result.getDatabaseName());
        log.info("Package: {}", result.getPackageName());
        log.info("Tables Generated: {}", result.getTableNames().size());
        log.info("Files Written: {}", result.getWrittenFiles().size());
        for (Path skipped : result.getSkippedFiles()) {
            log.info("  Skipped (not overwritten): {}", skipped);
        }
        log.info("Output Path: {}", result.getOutputDir());
        log.info("=================================================");
    }

    public void printFailure(Exception e) {
        log.error("Generation failed: {}", e.getMessage());
        log.debug("Failure detail", e);
    }
}
