package com.tabledsl.generator.schema;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens the single connection a generation run works with.
 */
@FunctionalInterface
public interface DriverConnector {

    Connection open(String driverName, String dataSourceName) throws SQLException;
}
