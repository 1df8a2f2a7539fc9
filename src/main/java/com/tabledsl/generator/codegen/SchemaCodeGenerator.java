package com.tabledsl.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tabledsl.generator.codegen.emit.BaseUnitEmitter;
import com.tabledsl.generator.codegen.emit.GeneratedSources;
import com.tabledsl.generator.codegen.emit.TableEmitter;
import com.tabledsl.generator.codegen.exception.ConnectionException;
import com.tabledsl.generator.codegen.exception.GenerationException;
import com.tabledsl.generator.codegen.exception.NoDatabaseSelectedException;
import com.tabledsl.generator.codegen.model.EmittedUnit;
import com.tabledsl.generator.codegen.output.OutputSink;
import com.tabledsl.generator.schema.DriverConnector;
import com.tabledsl.generator.schema.SchemaFetcher;
import com.tabledsl.generator.schema.SchemaFetcherFactory;

/**
 * Runs a complete generation: connects, discovers the database and its tables, then
 * writes the base unit followed by one unit per table.
 * <p>
 * Everything happens sequentially over one connection. The first error stops the run
 * and is rethrown unchanged; units already written stay on disk, and rerunning after
 * fixing the cause reproduces the full output.
 */
public class SchemaCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(SchemaCodeGenerator.class);

    private final GenerationOptions options;
    private final DriverConnector connector;
    private final Function<Connection, SchemaFetcher> fetcherFactory;
    private final OutputSink sink;
    private final BaseUnitEmitter baseUnitEmitter;
    private final TableEmitter tableEmitter;

    private GenerationPhase phase = GenerationPhase.CONFIGURING;

    /**
     * @throws com.tabledsl.generator.codegen.exception.UnsupportedDriverException if the driver has no schema fetcher
     */
    public SchemaCodeGenerator(GenerationOptions options, DriverConnector connector, OutputSink sink) {
        this(options, connector, SchemaFetcherFactory.forDriver(options.getDriverName()), sink);
    }

    public SchemaCodeGenerator(GenerationOptions options, DriverConnector connector,
                               Function<Connection, SchemaFetcher> fetcherFactory, OutputSink sink) {
        this.options = options;
        this.connector = connector;
        this.fetcherFactory = fetcherFactory;
        this.sink = sink;
        this.baseUnitEmitter = new BaseUnitEmitter();
        this.tableEmitter = new TableEmitter();
    }

    public GenerationPhase getPhase() {
        return phase;
    }

    public GenerationResult generate() throws GenerationException, IOException {
        Connection connection = connect();
        try {
            GenerationResult result = generate(fetcherFactory.apply(connection));
            enter(GenerationPhase.DONE);
            return result;
        } catch (GenerationException | IOException | RuntimeException e) {
            enter(GenerationPhase.FAILED);
            throw e;
        } finally {
            close(connection);
        }
    }

    private Connection connect() throws ConnectionException {
        enter(GenerationPhase.CONNECTING);
        try {
            return connector.open(options.getDriverName(), options.getDataSourceName());
        } catch (SQLException e) {
            enter(GenerationPhase.FAILED);
            throw new ConnectionException("Failed to open " + options.getDriverName() + " connection", e);
        }
    }

    private GenerationResult generate(SchemaFetcher fetcher) throws GenerationException, IOException {
        enter(GenerationPhase.DISCOVERING_DATABASE);
        String databaseName = fetcher.getDatabaseName();
        if (databaseName == null || databaseName.isEmpty()) {
            throw new NoDatabaseSelectedException();
        }
        log.info("Database: {}", databaseName);

        enter(GenerationPhase.DISCOVERING_TABLES);
        List<String> tableNames = options.getTableNames().isEmpty()
                ? fetcher.getTableNames()
                : options.getTableNames();
        log.info("Tables: {}", tableNames);

        GenerationResult.GenerationResultBuilder result = GenerationResult.builder()
                .databaseName(databaseName)
                .packageName(GeneratedSources.packageName(databaseName))
                .outputDir(options.getOutputDir())
                .tableNames(tableNames);

        enter(GenerationPhase.EMITTING_BASE);
        // the base unit is always replaced, it only depends on the table list
        write(baseUnitEmitter.emit(databaseName, tableNames, options.getForceCases()), true, result);

        enter(GenerationPhase.EMITTING_TABLES);
        for (String tableName : tableNames) {
            EmittedUnit unit = tableEmitter.emit(fetcher, databaseName, tableName, options.getForceCases());
            write(unit, options.isForceOverwrite(), result);
        }

        return result.build();
    }

    private void write(EmittedUnit unit, boolean force, GenerationResult.GenerationResultBuilder result)
            throws IOException {
        Path path = options.getOutputDir().resolve(unit.getFileName());
        if (sink.write(path, unit.toBytes(), force)) {
            result.writtenFile(path);
        } else {
            result.skippedFile(path);
        }
    }

    private void enter(GenerationPhase next) {
        log.debug("{} -> {}", phase, next);
        phase = next;
    }

    private void close(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection: {}", e.getMessage());
        }
    }
}
