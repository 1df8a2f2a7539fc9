package com.tabledsl.generator.codegen.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes units to the file system, creating parent directories as needed.
 */
public class FileOutputSink implements OutputSink {
    private static final Logger log = LoggerFactory.getLogger(FileOutputSink.class);

    private final OverwriteConfirmer confirmer;

    public FileOutputSink(OverwriteConfirmer confirmer) {
        this.confirmer = confirmer;
    }

    @Override
    public boolean write(Path path, byte[] content, boolean forceOverwrite) throws IOException {
        if (Files.exists(path) && !forceOverwrite && !confirmer.confirmOverwrite(path)) {
            log.info("skip {}", path);
            return false;
        }

        Path parentDir = path.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.write(path, content,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        log.debug("Wrote {} ({} bytes)", path, content.length);
        return true;
    }
}
