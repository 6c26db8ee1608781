package com.querybuilder.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file as UTF-8, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Default output path for a schema file: {@code models.json -> models_querybuilder.go}.
     */
    public static Path defaultOutputPath(Path schemaFile) {
        String fileName = schemaFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return schemaFile.resolveSibling(base + "_querybuilder.go");
    }
}
