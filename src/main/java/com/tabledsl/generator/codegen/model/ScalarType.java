package com.tabledsl.generator.codegen.model;

/**
 * Value type of a column in generated models.
 *
 * Java has no unsigned integers, so each unsigned width is carried by the next wider
 * signed type, the same representation JDBC drivers use for unsigned columns.
 */
public enum ScalarType {
    INT8("byte", "Byte", true),
    INT16("short", "Short", true),
    INT32("int", "Integer", true),
    INT64("long", "Long", true),
    UINT8("short", "Short", true),
    UINT16("int", "Integer", true),
    UINT32("long", "Long", true),
    UINT64("BigInteger", "BigInteger", true),
    FLOAT64("double", "Double", false),
    STRING("String", "String", false),
    BOOLEAN("boolean", "Boolean", false),
    WELL_KNOWN_BINARY("WellKnownBinary", "WellKnownBinary", false);

    private final String javaType;
    private final String boxedType;
    private final boolean integer;

    ScalarType(String javaType, String boxedType, boolean integer) {
        this.javaType = javaType;
        this.boxedType = boxedType;
        this.integer = integer;
    }

    public String getJavaType() {
        return javaType;
    }

    public String getBoxedType() {
        return boxedType;
    }

    public boolean isInteger() {
        return integer;
    }

    /**
     * Unsigned variant of the same width; non-integer and already unsigned types are returned as is.
     */
    public ScalarType toUnsigned() {
        return switch (this) {
            case INT8 -> UINT8;
            case INT16 -> UINT16;
            case INT32 -> UINT32;
            case INT64 -> UINT64;
            default -> this;
        };
    }

    /**
     * Type declared by the generated code's runtime library rather than the JDK.
     */
    public boolean isRuntimeType() {
        return this == WELL_KNOWN_BINARY;
    }

    /**
     * Fully qualified JDK type to import, or null when none is needed.
     */
    public String getRequiredImport() {
        return this == UINT64 ? "java.math.BigInteger" : null;
    }
}
