package com.tabledsl.generator;

import com.tabledsl.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the tabledsl generator.
 * Reads a database schema over JDBC and writes one typed accessor class per table.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }
}
