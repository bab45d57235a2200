package com.example.crosswalk.service;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * An input the run cannot do without (workbook, worksheet or catalog) is absent.
 * Not recoverable locally: the whole run aborts.
 */
public class MissingInputException extends RuntimeException {

    public MissingInputException(String message) {
        super(message);
    }

    /**
     * Returns the path if it points to an existing file.
     *
     * @param path        configured path
     * @param description what the file is, for the error message
     * @throws MissingInputException if the path is blank or the file does not exist
     */
    public static Path requireFile(String path, String description) {
        if (path == null || path.isBlank()) {
            throw new MissingInputException("No path configured for the " + description);
        }
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            throw new MissingInputException("The " + description + " was not found: " + file.toAbsolutePath());
        }
        return file;
    }
}
