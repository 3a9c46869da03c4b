package dev.py2flow.export;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes one text file of a bundle. The parent directory already exists.
 */
@FunctionalInterface
public interface BundleFileWriter {

    BundleFileWriter FILES = (file, content) -> Files.writeString(file, content, StandardCharsets.UTF_8);

    void write(Path file, String content) throws IOException;
}
