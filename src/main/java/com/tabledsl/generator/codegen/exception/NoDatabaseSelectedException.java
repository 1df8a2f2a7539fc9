package com.tabledsl.generator.codegen.exception;

public class NoDatabaseSelectedException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public NoDatabaseSelectedException() {
        super("no database selected");
    }
}
