package com.finFlow.sankeyDemo.pipeline.exception;

import java.nio.file.Path;

/**
 * Exception thrown when a bucket or chart file cannot be written.
 */
public class OutputWriteException extends PipelineException {

    public OutputWriteException(Path path, Throwable cause) {
        super("Failed to write output file: " + path, cause);
    }
}
