package com.tabledsl.generator.codegen.mapper;

import com.tabledsl.generator.codegen.exception.UnknownTypeException;
import com.tabledsl.generator.codegen.model.ColumnDescriptor;
import com.tabledsl.generator.codegen.model.FieldCategory;
import com.tabledsl.generator.codegen.model.MappedType;
import com.tabledsl.generator.codegen.model.ScalarType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the column type policy.
 */
class ColumnTypeMapperTest {

    @ParameterizedTest
    @CsvSource({
        "tinyint, INT8, NUMBER",
        "smallint, INT16, NUMBER",
        "int, INT32, NUMBER",
        "mediumint, INT32, NUMBER",
        "bigint, INT64, NUMBER",
        "integer, INT64, NUMBER",
        "float, FLOAT64, NUMBER",
        "double, FLOAT64, NUMBER",
        "decimal, FLOAT64, NUMBER",
        "real, FLOAT64, NUMBER",
        "varchar, STRING, STRING",
        "character varying, STRING, STRING",
        "longtext, STRING, STRING",
        "enum, STRING, STRING",
        "datetime, STRING, STRING",
        "timestamp, STRING, STRING",
        "json, STRING, STRING",
        "numeric, STRING, STRING",
        "varbinary, STRING, STRING",
        "mediumblob, STRING, STRING",
        "geometry, WELL_KNOWN_BINARY, WELL_KNOWN_BINARY",
        "multipolygon, WELL_KNOWN_BINARY, WELL_KNOWN_BINARY",
        "geometrycollection, WELL_KNOWN_BINARY, WELL_KNOWN_BINARY"
    })
    void testRecognizedFamilies(String rawType, ScalarType scalarType, FieldCategory category) throws Exception {
        MappedType mapped = ColumnTypeMapper.map(column(rawType, 0, false, false));

        assertThat(mapped.getScalarType()).isEqualTo(scalarType);
        assertThat(mapped.getCategory()).isEqualTo(category);
        assertThat(mapped.isNullable()).isFalse();
    }

    @Test
    void testRawTypeIsMatchedCaseInsensitively() throws Exception {
        assertThat(ColumnTypeMapper.map(column("BIGINT", 0, false, false)).getScalarType())
                .isEqualTo(ScalarType.INT64);
        assertThat(ColumnTypeMapper.map(column("VarChar", 0, false, false)).getCategory())
                .isEqualTo(FieldCategory.STRING);
    }

    @Test
    void testBitDependsOnSize() throws Exception {
        MappedType flag = ColumnTypeMapper.map(column("bit", 1, false, false));
        MappedType mask = ColumnTypeMapper.map(column("bit", 8, false, false));

        assertThat(flag.getScalarType()).isEqualTo(ScalarType.BOOLEAN);
        assertThat(flag.getCategory()).isEqualTo(FieldCategory.BOOLEAN);
        assertThat(mask.getScalarType()).isEqualTo(ScalarType.STRING);
        assertThat(mask.getCategory()).isEqualTo(FieldCategory.STRING);
    }

    @ParameterizedTest
    @ValueSource(strings = {"uuid", "boolean", "varchar2", "", "int[]"})
    void testUnknownTypesFail(String rawType) {
        assertThatThrownBy(() -> ColumnTypeMapper.map(column(rawType, 0, false, false)))
                .isInstanceOf(UnknownTypeException.class)
                .hasMessageContaining("unknown field type");
    }

    @ParameterizedTest
    @CsvSource({
        "tinyint, UINT8, short",
        "smallint, UINT16, int",
        "int, UINT32, long",
        "bigint, UINT64, BigInteger"
    })
    void testUnsignedIntegersUseUnsignedVariant(String rawType, ScalarType expected, String javaType) throws Exception {
        MappedType mapped = ColumnTypeMapper.map(column(rawType, 0, true, false));

        assertThat(mapped.getScalarType()).isEqualTo(expected);
        assertThat(mapped.getJavaType()).isEqualTo(javaType);
    }

    @ParameterizedTest
    @ValueSource(strings = {"double", "decimal", "varchar", "geometry"})
    void testUnsignedDoesNotAffectNonIntegers(String rawType) throws Exception {
        MappedType signed = ColumnTypeMapper.map(column(rawType, 0, false, false));
        MappedType unsigned = ColumnTypeMapper.map(column(rawType, 0, true, false));

        assertThat(unsigned.getScalarType()).isEqualTo(signed.getScalarType());
    }

    @ParameterizedTest
    @CsvSource({
        "bigint, Long",
        "double, Double",
        "varchar, String",
        "geometry, WellKnownBinary"
    })
    void testNullableAlwaysWraps(String rawType, String javaType) throws Exception {
        MappedType mapped = ColumnTypeMapper.map(column(rawType, 0, false, true));

        assertThat(mapped.isNullable()).isTrue();
        assertThat(mapped.getJavaType()).isEqualTo(javaType);
    }

    @Test
    void testUnsignedAndNullableCombine() throws Exception {
        MappedType mapped = ColumnTypeMapper.map(column("int", 0, true, true));

        assertThat(mapped.getScalarType()).isEqualTo(ScalarType.UINT32);
        assertThat(mapped.getJavaType()).isEqualTo("Long");
    }

    @Test
    void testGeometryIgnoresSignednessAndNullabilityForCategory() throws Exception {
        for (boolean unsigned : new boolean[] {false, true}) {
            for (boolean nullable : new boolean[] {false, true}) {
                MappedType mapped = ColumnTypeMapper.map(column("geometry", 0, unsigned, nullable));
                assertThat(mapped.getCategory()).isEqualTo(FieldCategory.WELL_KNOWN_BINARY);
                assertThat(mapped.getScalarType()).isEqualTo(ScalarType.WELL_KNOWN_BINARY);
            }
        }
    }

    private static ColumnDescriptor column(String rawType, int size, boolean unsigned, boolean nullable) {
        return ColumnDescriptor.builder()
                .name("c")
                .rawType(rawType)
                .size(size)
                .unsigned(unsigned)
                .nullable(nullable)
                .build();
    }
}
