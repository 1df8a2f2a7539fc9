package com.tabledsl.generator.codegen.model;

/**
 * Semantic grouping of a column. Each category has its own runtime field interface,
 * runtime factory method and base-unit marker class.
 */
public enum FieldCategory {
    NUMBER("NumberField"),
    STRING("StringField"),
    BOOLEAN("BooleanField"),
    WELL_KNOWN_BINARY("WellKnownBinaryField");

    private final String runtimeType;

    FieldCategory(String runtimeType) {
        this.runtimeType = runtimeType;
    }

    /**
     * Simple name of the runtime interface, e.g. {@code NumberField}.
     */
    public String getRuntimeType() {
        return runtimeType;
    }

    /**
     * Name of the runtime factory that creates a field of this category.
     */
    public String getFactoryMethod() {
        return "new" + runtimeType;
    }

    /**
     * Name of the marker class declared in the base unit.
     */
    public String getMarkerClass() {
        return runtimeType + "Base";
    }
}
