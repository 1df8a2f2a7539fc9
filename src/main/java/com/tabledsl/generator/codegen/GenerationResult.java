package com.tabledsl.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of a successful generation run.
 */
@Value
@Builder
public class GenerationResult {
    String databaseName;
    String packageName;
    Path outputDir;

    @Singular
    List<String> tableNames;

    @Singular
    List<Path> writtenFiles;

    @Singular
    List<Path> skippedFiles;
}
