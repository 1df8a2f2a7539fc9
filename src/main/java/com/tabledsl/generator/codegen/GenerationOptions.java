package com.tabledsl.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Configuration of one generation run. Built once from the command line and never mutated.
 */
@Value
@Builder(toBuilder = true)
public class GenerationOptions {

    /**
     * Driver name selecting the schema fetcher, e.g. "mysql", "sqlite3", "postgres".
     */
    @NonNull
    String driverName;

    /**
     * JDBC URL of the database to inspect.
     */
    @NonNull
    String dataSourceName;

    String user;

    String password;

    /**
     * Tables to generate, in order. Empty means every table of the database.
     */
    @Singular
    List<String> tableNames;

    /**
     * Exact spellings for words of generated identifiers, e.g. "ID", "HTML".
     */
    @Singular
    List<String> forceCases;

    @NonNull
    Path outputDir;

    /**
     * Replace existing files without asking.
     */
    @Builder.Default
    boolean forceOverwrite = true;
}
