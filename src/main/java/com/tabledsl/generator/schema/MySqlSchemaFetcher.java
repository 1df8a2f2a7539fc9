package com.tabledsl.generator.schema;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import com.tabledsl.generator.codegen.exception.ConnectionException;
import com.tabledsl.generator.codegen.exception.NoDatabaseSelectedException;
import com.tabledsl.generator.codegen.model.ColumnDescriptor;

/**
 * MySQL and MariaDB, read through {@code information_schema}.
 */
public class MySqlSchemaFetcher extends JdbcSchemaFetcher {

    static final String COLUMNS_SQL = """
            SELECT COLUMN_NAME,
                   DATA_TYPE,
                   IFNULL(CHARACTER_MAXIMUM_LENGTH, IFNULL(NUMERIC_PRECISION, 0)),
                   COLUMN_TYPE LIKE '%unsigned%',
                   IS_NULLABLE = 'YES',
                   COLUMN_COMMENT
            FROM information_schema.COLUMNS
            WHERE TABLE_SCHEMA = DATABASE() AND TABLE_NAME = ?
            ORDER BY ORDINAL_POSITION
            """;

    public MySqlSchemaFetcher(Connection connection) {
        super(connection);
    }

    @Override
    public String getDatabaseName() throws ConnectionException, NoDatabaseSelectedException {
        return queryDatabaseName("SELECT DATABASE()");
    }

    @Override
    public List<String> getTableNames() throws ConnectionException {
        return query("SHOW TABLES", rs -> rs.getString(1));
    }

    @Override
    public List<ColumnDescriptor> getFieldDescriptors(String tableName) throws ConnectionException {
        return query(COLUMNS_SQL, MySqlSchemaFetcher::toColumn, tableName);
    }

    static ColumnDescriptor toColumn(ResultSet rs) throws SQLException {
        String comment = rs.getString(6);
        return ColumnDescriptor.builder()
                .name(rs.getString(1))
                .rawType(rs.getString(2))
                .size((int) Math.min(rs.getLong(3), Integer.MAX_VALUE))
                .unsigned(rs.getBoolean(4))
                .nullable(rs.getBoolean(5))
                .comment(comment == null ? "" : comment)
                .build();
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return quote(identifier, '`');
    }
}
