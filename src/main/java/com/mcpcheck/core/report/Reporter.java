package com.mcpcheck.core.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link Report} to one interchange format. Implementations keep outcomes
 * in execution order and write the summary counts unchanged.
 */
public interface Reporter {

    ReportFormat format();

    void write(Report report, Writer out) throws IOException;

    default void write(Report report, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(report, out);
        }
    }
}
