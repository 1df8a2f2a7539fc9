package com.tabledsl.generator.codegen.emit;

import com.tabledsl.generator.codegen.util.NamingUtil;

/**
 * Naming and layout conventions shared by every generated unit.
 */
public final class GeneratedSources {

    /**
     * Must equal {@code TableDsl.RUNTIME_VERSION} of the runtime the generated code is compiled against.
     */
    public static final int GENERATOR_VERSION = 2;

    public static final String RUNTIME_PACKAGE = "com.tabledsl";

    /**
     * Runtime entry point holding {@code RUNTIME_VERSION} and the table and field factories.
     */
    public static final String RUNTIME_FACADE = "TableDsl";

    public static final String BASE_CLASS_NAME = "Tables";

    public static final String PACKAGE_SUFFIX = "_dsl";

    public static final String HEADER = """
            // This file is generated by tabledsl-generator.
            // DO NOT EDIT.
            """;

    private GeneratedSources() {
        // Utility class
    }

    /**
     * Package of the generated code: the sanitized database name plus {@value #PACKAGE_SUFFIX}.
     */
    public static String packageName(String databaseName) {
        return NamingUtil.ensureIdentifier(databaseName) + PACKAGE_SUFFIX;
    }

    public static String tableClassName(String tableIdentifier) {
        return tableIdentifier + "Table";
    }

    public static String modelClassName(String tableIdentifier) {
        return tableIdentifier + "Model";
    }

    public static String javaFileName(String className) {
        return className + ".java";
    }

    public static String runtimeType(String simpleName) {
        return RUNTIME_PACKAGE + "." + simpleName;
    }
}
