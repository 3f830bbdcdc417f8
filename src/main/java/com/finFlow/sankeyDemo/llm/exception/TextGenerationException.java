package com.finFlow.sankeyDemo.llm.exception;

/**
 * Exception thrown when the text generation service fails or returns nothing usable.
 */
public class TextGenerationException extends RuntimeException {

    public TextGenerationException(String message) {
        super(message);
    }

    public TextGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
