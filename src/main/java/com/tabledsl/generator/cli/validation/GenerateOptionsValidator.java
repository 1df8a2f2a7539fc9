package com.tabledsl.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.tabledsl.generator.cli.exception.OptionsValidationException;
import com.tabledsl.generator.cli.model.GenerateOptions;
import com.tabledsl.generator.codegen.GenerationOptions;
import com.tabledsl.generator.codegen.exception.UnsupportedDriverException;
import com.tabledsl.generator.codegen.util.NamingUtil;
import com.tabledsl.generator.schema.SchemaFetcherFactory;

public class GenerateOptionsValidator {

	/**
	 * Checks the raw options and builds the immutable run configuration.
	 *
	 * @throws OptionsValidationException listing every problem found
	 * @throws UnsupportedDriverException if no driver is given and none can be read from the URL
	 */
	public GenerationOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getOutputDir() == null) {
			errors.add("Output directory is required (--output-dir / -o).");
		} else if (Files.exists(o.getOutputDir()) && !Files.isDirectory(o.getOutputDir())) {
			errors.add("Output path exists and is not a directory: " + o.getOutputDir());
		}

		if (isBlank(o.getDataSourceName())) {
			errors.add("Database connection is required (--dbc / -d).");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		String driverName = isBlank(o.getDriverName())
				? SchemaFetcherFactory.inferDriverName(o.getDataSourceName())
				: o.getDriverName().trim();

		Path normalizedOutputDir = o.getOutputDir().toAbsolutePath().normalize();

		return GenerationOptions.builder()
				.driverName(driverName)
				.dataSourceName(o.getDataSourceName().trim())
				.user(o.getUser())
				.password(o.getPassword())
				.tableNames(NamingUtil.splitList(o.getTables()))
				.forceCases(NamingUtil.splitList(o.getForceCases()))
				.outputDir(normalizedOutputDir)
				.forceOverwrite(!o.isConfirmOverwrite())
				.build();
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
