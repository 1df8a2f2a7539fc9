package com.tabledsl.generator.codegen.model;

import java.nio.charset.StandardCharsets;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One generated source file, held in memory until it is handed to the output sink.
 */
@Value
@Builder(toBuilder = true)
public class EmittedUnit {

    /**
     * File name relative to the output directory, e.g. {@code OrdersTable.java}.
     */
    @NonNull
    String fileName;

    @NonNull
    String contents;

    @NonNull
    UnitKind kind;

    /**
     * Table the unit was generated for; null for the base unit.
     */
    String tableName;

    public byte[] toBytes() {
        return contents.getBytes(StandardCharsets.UTF_8);
    }

    public enum UnitKind {
        BASE,
        TABLE
    }
}
