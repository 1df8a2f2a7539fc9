package com.tabledsl.generator.codegen.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Result of mapping a column descriptor: scalar type, category and nullability.
 */
@Value
public class MappedType {

    @NonNull
    ScalarType scalarType;

    @NonNull
    FieldCategory category;

    boolean nullable;

    /**
     * Type used for the column in a generated model. Nullable primitives are boxed.
     */
    public String getJavaType() {
        return nullable ? scalarType.getBoxedType() : scalarType.getJavaType();
    }
}
