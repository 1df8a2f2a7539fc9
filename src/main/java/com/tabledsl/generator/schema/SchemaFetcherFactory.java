package com.tabledsl.generator.schema;

import java.sql.Connection;
import java.util.Locale;
import java.util.function.Function;

import com.tabledsl.generator.codegen.exception.UnsupportedDriverException;

/**
 * Chooses the schema fetcher for a driver name.
 */
public final class SchemaFetcherFactory {

    private SchemaFetcherFactory() {
        // Utility class
    }

    /**
     * @throws UnsupportedDriverException if no fetcher exists for {@code driverName}
     */
    public static Function<Connection, SchemaFetcher> forDriver(String driverName) {
        return switch (driverName) {
            case "mysql", "mariadb" -> MySqlSchemaFetcher::new;
            case "sqlite3", "sqlite" -> SqliteSchemaFetcher::new;
            case "postgres", "postgresql" -> PostgresSchemaFetcher::new;
            default -> throw new UnsupportedDriverException(driverName);
        };
    }

    /**
     * Driver name implied by a JDBC URL, e.g. {@code jdbc:postgresql://host/db -> postgresql}.
     *
     * @throws UnsupportedDriverException if the URL is not a JDBC URL
     */
    public static String inferDriverName(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:")) {
            throw new UnsupportedDriverException(String.valueOf(jdbcUrl));
        }
        int end = jdbcUrl.indexOf(':', "jdbc:".length());
        if (end < 0) {
            throw new UnsupportedDriverException(jdbcUrl);
        }
        return jdbcUrl.substring("jdbc:".length(), end).toLowerCase(Locale.ROOT);
    }
}
