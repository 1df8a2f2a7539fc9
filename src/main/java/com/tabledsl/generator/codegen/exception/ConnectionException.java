package com.tabledsl.generator.codegen.exception;

import java.sql.SQLException;

/**
 * Driver open or catalog query failure. The driver's {@link SQLException} is kept as the cause.
 */
public class ConnectionException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public ConnectionException(String message, SQLException cause) {
        super(message + ": " + cause.getMessage(), cause);
    }

    @Override
    public synchronized SQLException getCause() {
        return (SQLException) super.getCause();
    }
}
