package com.tabledsl.generator.schema;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens connections through {@link DriverManager}; drivers register themselves from the classpath.
 */
public class JdbcDriverConnector implements DriverConnector {
    private static final Logger log = LoggerFactory.getLogger(JdbcDriverConnector.class);

    private final String user;
    private final String password;

    public JdbcDriverConnector(String user, String password) {
        this.user = user;
        this.password = password;
    }

    @Override
    public Connection open(String driverName, String dataSourceName) throws SQLException {
        log.debug("Opening {} connection", driverName);
        if (user == null) {
            return DriverManager.getConnection(dataSourceName);
        }
        return DriverManager.getConnection(dataSourceName, user, password);
    }
}
