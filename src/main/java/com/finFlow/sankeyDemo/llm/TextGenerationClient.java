package com.finFlow.sankeyDemo.llm;

import com.finFlow.sankeyDemo.llm.exception.TextGenerationException;

/**
 * Black-box text generation boundary: an opaque prompt goes in, an opaque response comes out.
 */
@FunctionalInterface
public interface TextGenerationClient {

    /**
     * Sends a prompt to the generation service.
     *
     * @param prompt Complete prompt text
     * @param model Model to use, or null for the configured default
     * @return Raw response text
     * @throws TextGenerationException if the service does not return a usable response
     */
    String generate(String prompt, String model);

    /**
     * Sends a prompt using the configured default model.
     */
    default String generate(String prompt) {
        return generate(prompt, null);
    }
}
