package com.tabledsl.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tabledsl.generator.cli.exception.OptionsValidationException;
import com.tabledsl.generator.cli.model.GenerateOptions;
import com.tabledsl.generator.cli.output.GenerateResultsPrinter;
import com.tabledsl.generator.cli.validation.GenerateOptionsValidator;
import com.tabledsl.generator.codegen.GenerationOptions;
import com.tabledsl.generator.codegen.GenerationResult;
import com.tabledsl.generator.codegen.SchemaCodeGenerator;
import com.tabledsl.generator.codegen.exception.GenerationException;
import com.tabledsl.generator.codegen.exception.UnsupportedDriverException;
import com.tabledsl.generator.codegen.output.ConsoleOverwriteConfirmer;
import com.tabledsl.generator.codegen.output.FileOutputSink;
import com.tabledsl.generator.schema.JdbcDriverConnector;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that generates table accessors for a database.
 */
@Command(
        name = "tabledsl-gen",
        mixinStandardHelpOptions = true,
        version = "tabledsl-gen 1.0.0",
        description = "Generates typed table accessors from the schema of a MySQL, SQLite or PostgreSQL database."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_UNSUPPORTED_DRIVER = 2;

    @Mixin
    private GenerateOptions options;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        GenerationOptions config;
        try {
            config = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return EXIT_FAILURE;
        } catch (UnsupportedDriverException e) {
            log.error(e.getMessage());
            return EXIT_UNSUPPORTED_DRIVER;
        }

        printer.printBanner(config);

        try {
            SchemaCodeGenerator generator = new SchemaCodeGenerator(
                    config,
                    new JdbcDriverConnector(config.getUser(), config.getPassword()),
                    new FileOutputSink(new ConsoleOverwriteConfirmer()));
            GenerationResult result = generator.generate();
            printer.printSuccess(result);
            return EXIT_OK;
        } catch (UnsupportedDriverException e) {
            log.error(e.getMessage());
            return EXIT_UNSUPPORTED_DRIVER;
        } catch (GenerationException e) {
            printer.printFailure(e);
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return EXIT_FAILURE;
        }
    }
}
