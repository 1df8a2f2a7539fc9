package com.tabledsl.generator.codegen.exception;

/**
 * Raised when a column's raw type belongs to none of the recognized type families.
 */
public class UnknownTypeException extends GenerationException {

    private static final long serialVersionUID = 1L;

    private final String rawType;

    public UnknownTypeException(String rawType) {
        super("unknown field type " + rawType);
        this.rawType = rawType;
    }

    public String getRawType() {
        return rawType;
    }
}
