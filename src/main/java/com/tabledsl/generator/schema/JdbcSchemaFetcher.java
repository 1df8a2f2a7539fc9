package com.tabledsl.generator.schema;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import com.tabledsl.generator.codegen.exception.ConnectionException;
import com.tabledsl.generator.codegen.exception.NoDatabaseSelectedException;

/**
 * Shared JDBC plumbing for the engine-specific fetchers.
 */
abstract class JdbcSchemaFetcher implements SchemaFetcher {

    protected final Connection connection;

    protected JdbcSchemaFetcher(Connection connection) {
        this.connection = connection;
    }

    @FunctionalInterface
    protected interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    protected <T> List<T> query(String sql, RowMapper<T> mapper, String... params) throws ConnectionException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            List<T> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new ConnectionException("Catalog query failed [" + sql.strip() + "]", e);
        }
    }

    /**
     * Runs a query expected to return a single string; null or blank means no database is selected.
     */
    protected String queryDatabaseName(String sql) throws ConnectionException, NoDatabaseSelectedException {
        List<String> names = query(sql, rs -> rs.getString(1));
        String name = names.isEmpty() ? null : names.get(0);
        if (name == null || name.isEmpty()) {
            throw new NoDatabaseSelectedException();
        }
        return name;
    }

    /**
     * Wraps {@code identifier} in {@code quote}, doubling any quote character inside it.
     */
    protected static String quote(String identifier, char quote) {
        String q = String.valueOf(quote);
        return q + identifier.replace(q, q + q) + q;
    }
}
