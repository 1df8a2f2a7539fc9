package com.tabledsl.generator.schema;

import java.sql.Connection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.tabledsl.generator.codegen.exception.ConnectionException;
import com.tabledsl.generator.codegen.exception.NoDatabaseSelectedException;
import com.tabledsl.generator.codegen.model.ColumnDescriptor;

/**
 * SQLite. Column types are the declared types of the {@code CREATE TABLE} statement,
 * so size and {@code UNSIGNED} are parsed out of them.
 */
public class SqliteSchemaFetcher extends JdbcSchemaFetcher {

    private static final Pattern DECLARED_TYPE = Pattern.compile(
            "^([a-z][a-z ]*?)\\s*(?:\\(\\s*(\\d+)\\s*(?:,\\s*\\d+\\s*)?\\))?\\s*(unsigned)?$");

    public SqliteSchemaFetcher(Connection connection) {
        super(connection);
    }

    @Override
    public String getDatabaseName() throws ConnectionException, NoDatabaseSelectedException {
        return queryDatabaseName("SELECT name FROM pragma_database_list WHERE seq = 0");
    }

    @Override
    public List<String> getTableNames() throws ConnectionException {
        return query("SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite\\_%' ESCAPE '\\'",
                rs -> rs.getString(1));
    }

    @Override
    public List<ColumnDescriptor> getFieldDescriptors(String tableName) throws ConnectionException {
        return query("SELECT name, type, \"notnull\" FROM pragma_table_info(?) ORDER BY cid",
                rs -> parseDeclaredType(rs.getString(2))
                        .name(rs.getString(1))
                        .nullable(rs.getInt(3) == 0)
                        .build(),
                tableName);
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return quote(identifier, '"');
    }

    /**
     * Splits a declared type such as {@code VARCHAR(255)} or {@code INT UNSIGNED} into
     * family, size and signedness. Types that do not parse are passed through lower-cased.
     */
    static ColumnDescriptor.ColumnDescriptorBuilder parseDeclaredType(String declaredType) {
        String normalized = declaredType == null ? "" : declaredType.trim().toLowerCase(Locale.ROOT);
        Matcher m = DECLARED_TYPE.matcher(normalized);
        if (!m.matches()) {
            return ColumnDescriptor.builder().rawType(normalized);
        }
        return ColumnDescriptor.builder()
                .rawType(m.group(1))
                .size(m.group(2) == null ? 0 : Integer.parseInt(m.group(2)))
                .unsigned(m.group(3) != null);
    }
}
