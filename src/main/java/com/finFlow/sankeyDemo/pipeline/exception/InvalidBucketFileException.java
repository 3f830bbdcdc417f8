package com.finFlow.sankeyDemo.pipeline.exception;

/**
 * Exception thrown when a bucket file is not a JSON array of bucket records.
 */
public class InvalidBucketFileException extends PipelineException {

    public InvalidBucketFileException(String message) {
        super(message);
    }

    public InvalidBucketFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
