package com.tabledsl.generator.schema;

import com.tabledsl.generator.codegen.exception.UnknownTypeException;
import com.tabledsl.generator.codegen.mapper.ColumnTypeMapper;
import com.tabledsl.generator.codegen.model.ColumnDescriptor;
import com.tabledsl.generator.codegen.model.FieldCategory;
import com.tabledsl.generator.codegen.model.ScalarType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.tabledsl.generator.schema.StubResultSet.row;
import static org.assertj.core.api.Assertions.*;

class PostgresSchemaFetcherTest {

    @ParameterizedTest
    @CsvSource({
        "character varying, varchar, false, 64, character varying, 64",
        "character, bpchar, false, 3, char, 3",
        "boolean, bool, false, 0, bit, 1",
        "double precision, float8, false, 53, double, 53",
        "timestamp with time zone, timestamptz, false, 0, timestamp, 0",
        "time without time zone, time, false, 0, time, 0",
        "bytea, bytea, false, 0, blob, 0",
        "jsonb, jsonb, false, 0, json, 0",
        "uuid, uuid, false, 0, char, 0",
        "integer, int4, false, 32, integer, 32",
        "USER-DEFINED, geometry, false, 0, geometry, 0",
        "USER-DEFINED, mood, true, 0, enum, 0",
        "USER-DEFINED, hstore, false, 0, hstore, 0"
    })
    void testTranslateType(String dataType, String udtName, boolean enumType, int size,
                           String rawType, int expectedSize) {
        ColumnDescriptor column = PostgresSchemaFetcher.translateType(dataType, udtName, enumType, size)
                .name("c").build();

        assertThat(column.getRawType()).isEqualTo(rawType);
        assertThat(column.getSize()).isEqualTo(expectedSize);
    }

    @Test
    void testRowToColumn() throws Exception {
        ColumnDescriptor column = PostgresSchemaFetcher.toColumn(
                row("active", "boolean", "bool", 0, true, "soft delete flag", false));

        assertThat(column.getName()).isEqualTo("active");
        assertThat(column.getRawType()).isEqualTo("bit");
        assertThat(column.getSize()).isEqualTo(1);
        assertThat(column.isNullable()).isTrue();
        assertThat(column.getComment()).isEqualTo("soft delete flag");
    }

    @Test
    void testSpatialUserDefinedTypeIsBinary() throws Exception {
        ColumnDescriptor column = PostgresSchemaFetcher.toColumn(
                row("location", "USER-DEFINED", "geometry", 0, true, "", false));

        assertThat(ColumnTypeMapper.map(column).getCategory()).isEqualTo(FieldCategory.WELL_KNOWN_BINARY);
        assertThat(ColumnTypeMapper.map(column).getScalarType()).isEqualTo(ScalarType.WELL_KNOWN_BINARY);
    }

    @Test
    void testEnumTypeIsString() throws Exception {
        ColumnDescriptor column = PostgresSchemaFetcher.toColumn(
                row("mood", "USER-DEFINED", "mood", 0, false, "", true));

        assertThat(ColumnTypeMapper.map(column).getCategory()).isEqualTo(FieldCategory.STRING);
    }

    @Test
    void testOtherUserDefinedTypeIsUnknown() throws Exception {
        ColumnDescriptor column = PostgresSchemaFetcher.toColumn(
                row("attrs", "USER-DEFINED", "hstore", 0, true, "", false));

        assertThatThrownBy(() -> ColumnTypeMapper.map(column))
                .isInstanceOf(UnknownTypeException.class)
                .hasMessage("unknown field type hstore");
    }
}
