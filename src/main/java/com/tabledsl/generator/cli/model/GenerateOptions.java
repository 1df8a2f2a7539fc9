package com.tabledsl.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the generator. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--output-dir", "-o" }, description = "Directory the generated sources are written to")
	private Path outputDir;

	@Option(names = { "--dbc", "-d" }, description = "JDBC URL of the database, e.g. jdbc:mysql://localhost:3306/shop")
	private String dataSourceName;

	@Option(names = { "--driver" }, description = "Database driver: mysql, sqlite3 or postgres (default: taken from the JDBC URL)")
	private String driverName;

	@Option(names = { "--user", "-u" }, description = "Database user")
	private String user;

	@Option(names = { "--password", "-p" }, description = "Database password", interactive = true, arity = "0..1")
	private String password;

	@Option(names = { "--tables", "-t" }, description = "Comma-separated tables to generate (default: all tables)")
	private String tables;

	@Option(names = { "--forcecases" }, description = "Comma-separated exact spellings for identifier words, e.g. ID,IDs,HTML")
	private String forceCases;

	@Option(names = { "--confirm-overwrite" }, description = "Ask before replacing an existing table file")
	private boolean confirmOverwrite;
}
