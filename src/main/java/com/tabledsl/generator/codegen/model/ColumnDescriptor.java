package com.tabledsl.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Engine-independent description of one physical column, as read from the catalog.
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class ColumnDescriptor {

    /**
     * Column name exactly as the database reports it.
     */
    @NonNull
    String name;

    /**
     * Type family name without size or modifiers, e.g. "varchar", "bigint".
     */
    @NonNull
    String rawType;

    /**
     * Character length, numeric precision or bit width; 0 when unknown.
     */
    int size;

    boolean unsigned;

    boolean nullable;

    @NonNull
    @Builder.Default
    String comment = "";
}
