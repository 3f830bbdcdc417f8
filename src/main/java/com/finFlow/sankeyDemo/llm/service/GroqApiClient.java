package com.finFlow.sankeyDemo.llm.service;

import com.finFlow.sankeyDemo.llm.TextGenerationClient;
import com.finFlow.sankeyDemo.llm.dto.GroqApiRequest;
import com.finFlow.sankeyDemo.llm.dto.GroqApiResponse;
import com.finFlow.sankeyDemo.llm.exception.TextGenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Client for interacting with Groq API.
 * Handles HTTP communication with Groq's OpenAI-compatible chat completions endpoint.
 */
@Slf4j
@Service
public class GroqApiClient implements TextGenerationClient {

    private static final String DEFAULT_API_URL = "https://api.groq.com/openai/v1/chat/completions";
    private static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";

    private final RestClient restClient;

    @Value("${groq.api.key:}")
    private String apiKey;

    @Value("${groq.api.model:" + DEFAULT_MODEL + "}")
    private String defaultModel;

    @Value("${groq.api.temperature:0.0}")
    private Double temperature;

    @Value("${groq.api.max-completion-tokens:1024}")
    private Integer maxCompletionTokens;

    public GroqApiClient(RestClient.Builder restClientBuilder,
                         @Value("${groq.api.url:" + DEFAULT_API_URL + "}") String apiUrl) {
        this.restClient = restClientBuilder
                .baseUrl(apiUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Sends the prompt as a single user message and returns the first choice's content.
     *
     * @param prompt Complete prompt text
     * @param model Model to use, or null for the configured default
     * @return Raw response content
     * @throws TextGenerationException if the key is missing, the call fails, or the response is empty
     */
    @Override
    public String generate(String prompt, String model) {
        GroqApiResponse response = callGroqApi(prompt, model);

        String content = response.getContent();
        if (content == null || content.isBlank()) {
            throw new TextGenerationException("Groq API returned an empty completion");
        }
        return content;
    }

    /**
     * Calls Groq API with a single user message.
     *
     * @param userMessage User message to process
     * @param model Model to use for the API call, or null for the default
     * @return GroqApiResponse with the result
     * @throws TextGenerationException if API call fails
     */
    public GroqApiResponse callGroqApi(String userMessage, String model) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new TextGenerationException("Groq API key is not configured. Set groq.api.key in application.yaml");
        }

        if (model == null || model.isBlank()) {
            model = defaultModel;
        }

        List<GroqApiRequest.Message> messages = List.of(GroqApiRequest.Message.builder()
                .role("user")
                .content(userMessage)
                .build());

        GroqApiRequest request = GroqApiRequest.builder()
                .messages(messages)
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxCompletionTokens)
                .topP(1.0)
                .stream(false)
                .build();

        GroqApiResponse response;
        try {
            log.debug("Calling Groq API - model: {}, message length: {}", model, userMessage.length());

            response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(GroqApiResponse.class);

        } catch (RestClientException e) {
            log.error("Error calling Groq API - model: {}", model, e);
            throw new TextGenerationException("Failed to call Groq API: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new TextGenerationException("Groq API returned null response");
        }

        log.debug("Groq API response received - model: {}, tokens used: {}",
                response.getModel(),
                response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");

        return response;
    }
}
