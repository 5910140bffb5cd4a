package com.layoutmapper.codegen.util;

import java.io.IOException;
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
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content);
    }

    /**
     * Writes content unless the file exists and {@code overwrite} is false.
     *
     * @return whether the file was written
     */
    public static boolean writeIfAllowed(Path filePath, String content, boolean overwrite) throws IOException {
        if (!overwrite && Files.exists(filePath)) {
            return false;
        }
        safeWriteString(filePath, content);
        return true;
    }
}
