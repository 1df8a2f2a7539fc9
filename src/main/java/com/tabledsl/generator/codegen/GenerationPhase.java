package com.tabledsl.generator.codegen;

/**
 * Steps of a generation run, in order. A run either reaches {@link #DONE} or stops in {@link #FAILED}.
 */
public enum GenerationPhase {
    CONFIGURING,
    CONNECTING,
    DISCOVERING_DATABASE,
    DISCOVERING_TABLES,
    EMITTING_BASE,
    EMITTING_TABLES,
    DONE,
    FAILED
}
