package com.tabledsl.generator.schema;

import com.tabledsl.generator.codegen.exception.UnsupportedDriverException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class SchemaFetcherFactoryTest {

    @ParameterizedTest
    @CsvSource({
        "mysql, MySqlSchemaFetcher",
        "mariadb, MySqlSchemaFetcher",
        "sqlite3, SqliteSchemaFetcher",
        "sqlite, SqliteSchemaFetcher",
        "postgres, PostgresSchemaFetcher",
        "postgresql, PostgresSchemaFetcher"
    })
    void testDriverSelectsFetcher(String driverName, String fetcherClass) {
        SchemaFetcher fetcher = SchemaFetcherFactory.forDriver(driverName).apply(null);

        assertThat(fetcher.getClass().getSimpleName()).isEqualTo(fetcherClass);
    }

    @Test
    void testUnknownDriverIsFatal() {
        assertThatThrownBy(() -> SchemaFetcherFactory.forDriver("oracle"))
                .isInstanceOf(UnsupportedDriverException.class)
                .hasMessage("unsupported driver oracle");
    }

    @ParameterizedTest
    @CsvSource({
        "jdbc:mysql://localhost:3306/shop, mysql",
        "jdbc:sqlite:/tmp/test.db, sqlite",
        "jdbc:postgresql://db:5432/shop, postgresql",
        "jdbc:MariaDB://db/shop, mariadb"
    })
    void testInferDriverName(String url, String driverName) {
        assertThat(SchemaFetcherFactory.inferDriverName(url)).isEqualTo(driverName);
    }

    @Test
    void testInferDriverNameRejectsNonJdbcUrl() {
        assertThatThrownBy(() -> SchemaFetcherFactory.inferDriverName("user:pass@tcp(localhost)/shop"))
                .isInstanceOf(UnsupportedDriverException.class);
        assertThatThrownBy(() -> SchemaFetcherFactory.inferDriverName("jdbc:nothing"))
                .isInstanceOf(UnsupportedDriverException.class);
    }

    @Test
    void testEngineQuoting() {
        assertThat(new MySqlSchemaFetcher(null).quoteIdentifier("order")).isEqualTo("`order`");
        assertThat(new MySqlSchemaFetcher(null).quoteIdentifier("we`ird")).isEqualTo("`we``ird`");
        assertThat(new PostgresSchemaFetcher(null).quoteIdentifier("user")).isEqualTo("\"user\"");
        assertThat(new PostgresSchemaFetcher(null).quoteIdentifier("My \"Table\"")).isEqualTo("\"My \"\"Table\"\"\"");
    }
}
