package com.tabledsl.generator.schema;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.tabledsl.generator.codegen.exception.ConnectionException;
import com.tabledsl.generator.codegen.exception.NoDatabaseSelectedException;
import com.tabledsl.generator.codegen.model.ColumnDescriptor;

/**
 * PostgreSQL, limited to the base tables of the connection's current schema.
 */
public class PostgresSchemaFetcher extends JdbcSchemaFetcher {

    static final String TABLES_SQL = """
            SELECT table_name
            FROM information_schema.tables
            WHERE table_schema = current_schema()
              AND table_type = 'BASE TABLE'
            ORDER BY table_name
            """;

    static final String COLUMNS_SQL = """
            SELECT c.column_name,
                   c.data_type,
                   c.udt_name,
                   COALESCE(c.character_maximum_length, c.numeric_precision, 0),
                   c.is_nullable = 'YES',
                   COALESCE(col_description(format('%I.%I', c.table_schema, c.table_name)::regclass::oid,
                                            c.ordinal_position), ''),
                   EXISTS (SELECT 1 FROM pg_catalog.pg_type t WHERE t.typname = c.udt_name AND t.typtype = 'e')
            FROM information_schema.columns c
            WHERE c.table_schema = current_schema()
              AND c.table_name = ?
            ORDER BY c.ordinal_position
            """;

    private static final String USER_DEFINED = "user-defined";

    private static final Map<String, String> TYPE_ALIASES = Map.ofEntries(
            Map.entry("character", "char"),
            Map.entry("double precision", "double"),
            Map.entry("timestamp without time zone", "timestamp"),
            Map.entry("timestamp with time zone", "timestamp"),
            Map.entry("time without time zone", "time"),
            Map.entry("time with time zone", "time"),
            Map.entry("bytea", "blob"),
            Map.entry("jsonb", "json"),
            Map.entry("uuid", "char"));

    public PostgresSchemaFetcher(Connection connection) {
        super(connection);
    }

    @Override
    public String getDatabaseName() throws ConnectionException, NoDatabaseSelectedException {
        return queryDatabaseName("SELECT current_database()");
    }

    @Override
    public List<String> getTableNames() throws ConnectionException {
        return query(TABLES_SQL, rs -> rs.getString(1));
    }

    @Override
    public List<ColumnDescriptor> getFieldDescriptors(String tableName) throws ConnectionException {
        return query(COLUMNS_SQL, PostgresSchemaFetcher::toColumn, tableName);
    }

    static ColumnDescriptor toColumn(ResultSet rs) throws SQLException {
        return translateType(rs.getString(2), rs.getString(3), rs.getBoolean(7), rs.getInt(4))
                .name(rs.getString(1))
                .nullable(rs.getBoolean(5))
                .comment(rs.getString(6))
                .build();
    }

    /**
     * Maps a PostgreSQL type onto the generic type families. User-defined types are
     * reported by their own name, and as {@code enum} only when they are enum types;
     * anything unrecognized passes through unchanged.
     */
    static ColumnDescriptor.ColumnDescriptorBuilder translateType(String dataType, String udtName,
                                                                  boolean enumType, int size) {
        String type = dataType.toLowerCase(Locale.ROOT);
        ColumnDescriptor.ColumnDescriptorBuilder builder = ColumnDescriptor.builder().size(size);
        if (type.equals("boolean")) {
            return builder.rawType("bit").size(1);
        }
        if (type.equals(USER_DEFINED)) {
            return builder.rawType(enumType ? "enum" : udtName.toLowerCase(Locale.ROOT));
        }
        return builder.rawType(TYPE_ALIASES.getOrDefault(type, type));
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return quote(identifier, '"');
    }
}
