package com.tabledsl.generator.codegen.output;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Destination for generated units.
 */
public interface OutputSink {

    /**
     * Writes {@code content} to {@code path}, replacing an existing file.
     *
     * @param forceOverwrite replace an existing file without asking
     * @return false if the file existed and overwriting was declined
     * @throws IOException if the file or its parent directories cannot be written
     */
    boolean write(Path path, byte[] content, boolean forceOverwrite) throws IOException;
}
