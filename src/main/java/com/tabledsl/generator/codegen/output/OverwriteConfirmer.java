package com.tabledsl.generator.codegen.output;

import java.nio.file.Path;

@FunctionalInterface
public interface OverwriteConfirmer {

    boolean confirmOverwrite(Path existingFile);
}
