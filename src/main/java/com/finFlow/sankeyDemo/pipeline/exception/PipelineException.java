package com.finFlow.sankeyDemo.pipeline.exception;

/**
 * Base class for failures that end a pipeline run.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
