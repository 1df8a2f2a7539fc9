package com.tabledsl.generator.codegen.exception;

/**
 * No schema fetcher exists for the requested driver. This is a configuration error,
 * so it is unchecked and ends the process.
 */
public class UnsupportedDriverException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String driverName;

    public UnsupportedDriverException(String driverName) {
        super("unsupported driver " + driverName);
        this.driverName = driverName;
    }

    public String getDriverName() {
        return driverName;
    }
}
