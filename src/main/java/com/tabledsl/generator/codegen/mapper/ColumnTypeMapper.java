package com.tabledsl.generator.codegen.mapper;

import java.util.Locale;

import com.tabledsl.generator.codegen.exception.UnknownTypeException;
import com.tabledsl.generator.codegen.model.ColumnDescriptor;
import com.tabledsl.generator.codegen.model.FieldCategory;
import com.tabledsl.generator.codegen.model.MappedType;
import com.tabledsl.generator.codegen.model.ScalarType;

import lombok.experimental.UtilityClass;

@UtilityClass
public class ColumnTypeMapper {

    /**
     * Maps a column to its scalar type and field category.
     *
     * The unsigned and nullable transforms are applied after the family lookup.
     * Unsigned only affects integer types; nullable applies to every category.
     *
     * @throws UnknownTypeException if the raw type is not part of any known family
     */
    public MappedType map(ColumnDescriptor column) throws UnknownTypeException {
        ScalarType scalarType;
        FieldCategory category;
        switch (column.getRawType().toLowerCase(Locale.ROOT)) {
            case "tinyint" -> {
                scalarType = ScalarType.INT8;
                category = FieldCategory.NUMBER;
            }
            case "smallint" -> {
                scalarType = ScalarType.INT16;
                category = FieldCategory.NUMBER;
            }
            case "int", "mediumint" -> {
                scalarType = ScalarType.INT32;
                category = FieldCategory.NUMBER;
            }
            case "bigint", "integer" -> {
                scalarType = ScalarType.INT64;
                category = FieldCategory.NUMBER;
            }
            case "float", "double", "decimal", "real" -> {
                scalarType = ScalarType.FLOAT64;
                category = FieldCategory.NUMBER;
            }
            case "char", "varchar", "text", "tinytext", "mediumtext", "longtext", "enum",
                    "datetime", "date", "time", "timestamp", "json", "numeric", "character varying" -> {
                scalarType = ScalarType.STRING;
                category = FieldCategory.STRING;
            }
            // raw bytes travel as strings
            case "binary", "varbinary", "blob", "tinyblob", "mediumblob", "longblob" -> {
                scalarType = ScalarType.STRING;
                category = FieldCategory.STRING;
            }
            case "geometry", "point", "linestring", "polygon", "multipoint", "multilinestring",
                    "multipolygon", "geometrycollection" -> {
                scalarType = ScalarType.WELL_KNOWN_BINARY;
                category = FieldCategory.WELL_KNOWN_BINARY;
            }
            case "bit" -> {
                if (column.getSize() == 1) {
                    scalarType = ScalarType.BOOLEAN;
                    category = FieldCategory.BOOLEAN;
                } else {
                    scalarType = ScalarType.STRING;
                    category = FieldCategory.STRING;
                }
            }
            default -> throw new UnknownTypeException(column.getRawType());
        }

        if (column.isUnsigned() && scalarType.isInteger()) {
            scalarType = scalarType.toUnsigned();
        }
        return new MappedType(scalarType, category, column.isNullable());
    }
}
