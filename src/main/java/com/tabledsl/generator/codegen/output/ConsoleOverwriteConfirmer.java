package com.tabledsl.generator.codegen.output;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Asks on the terminal before an existing file is replaced. Only "Y" or "y" confirms.
 */
public class ConsoleOverwriteConfirmer implements OverwriteConfirmer {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleOverwriteConfirmer() {
        this(System.in, System.out);
    }

    public ConsoleOverwriteConfirmer(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public boolean confirmOverwrite(Path existingFile) {
        out.printf("file(%s) already exists, overwrite (Y/N)? ", existingFile);
        out.flush();
        try {
            String answer = in.readLine();
            return answer != null && answer.trim().equalsIgnoreCase("y");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read overwrite confirmation", e);
        }
    }
}
