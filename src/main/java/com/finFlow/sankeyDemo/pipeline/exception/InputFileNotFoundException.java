package com.finFlow.sankeyDemo.pipeline.exception;

import java.nio.file.Path;

/**
 * Exception thrown when an input summary or bucket file is missing or unreadable.
 */
public class InputFileNotFoundException extends PipelineException {

    private final Path path;

    public InputFileNotFoundException(Path path) {
        super("Input file not found: " + path);
        this.path = path;
    }

    public InputFileNotFoundException(Path path, Throwable cause) {
        super("Input file could not be read: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
