package com.tabledsl.generator.codegen.util;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Import block of one generated unit.
 * <p>
 * A simple name can be imported once only: generated units refer to runtime and JDK
 * types by simple name, so a second type with the same simple name is a generator bug.
 */
public class ImportManager {

    private final String unitPackage;
    private final Map<String, String> bySimpleName = new HashMap<>();

    public ImportManager(String unitPackage) {
        this.unitPackage = unitPackage;
    }

    /**
     * Records {@code qualifiedName}. Nulls, unqualified names, {@code java.lang} and the
     * unit's own package need no import and are ignored.
     *
     * @return true if the import is new
     * @throws IllegalStateException if another type with the same simple name was added
     */
    public boolean addImport(String qualifiedName) {
        if (qualifiedName == null) {
            return false;
        }
        int lastDot = qualifiedName.lastIndexOf('.');
        if (lastDot < 0) {
            return false;
        }
        String packageName = qualifiedName.substring(0, lastDot);
        if (packageName.equals("java.lang") || packageName.equals(unitPackage)) {
            return false;
        }
        String simpleName = qualifiedName.substring(lastDot + 1);
        String existing = bySimpleName.putIfAbsent(simpleName, qualifiedName);
        if (existing != null && !existing.equals(qualifiedName)) {
            throw new IllegalStateException(
                    "Import " + qualifiedName + " clashes with " + existing + " in package " + unitPackage);
        }
        return existing == null;
    }

    /**
     * Sorted import lines followed by a blank line; empty when nothing was added.
     */
    public String generateImports() {
        if (bySimpleName.isEmpty()) {
            return "";
        }
        return bySimpleName.values().stream()
                .sorted()
                .map(name -> "import " + name + ";\n")
                .collect(Collectors.joining("", "", "\n"));
    }
}
