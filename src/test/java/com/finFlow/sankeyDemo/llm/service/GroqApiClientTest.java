package com.finFlow.sankeyDemo.llm.service;

import com.finFlow.sankeyDemo.llm.exception.TextGenerationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Unit tests for the Groq chat-completions client against a mocked endpoint.
 */
class GroqApiClientTest {

    private static final String API_URL = "https://groq.test/openai/v1/chat/completions";

    private static final String COMPLETION = """
            {
              "id": "chatcmpl-1",
              "model": "llama-3.3-70b-versatile",
              "choices": [
                {"index": 0, "message": {"role": "assistant", "content": "[{\\"bucket\\": \\"Revenue\\", \\"value\\": 10}]"}, "finish_reason": "stop"}
              ],
              "usage": {"prompt_tokens": 12, "completion_tokens": 8, "total_tokens": 20}
            }
            """;

    private MockRestServiceServer server;
    private GroqApiClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GroqApiClient(builder, API_URL);
        ReflectionTestUtils.setField(client, "apiKey", "test-key");
        ReflectionTestUtils.setField(client, "defaultModel", "llama-3.3-70b-versatile");
        ReflectionTestUtils.setField(client, "temperature", 0.0);
        ReflectionTestUtils.setField(client, "maxCompletionTokens", 1024);
    }

    @Test
    void returnsFirstChoiceContent() {
        server.expect(requestTo(API_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("llama-3.3-70b-versatile"))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[0].content").value("extract please"))
                .andExpect(jsonPath("$.messages[1]").doesNotExist())
                .andExpect(jsonPath("$.max_completion_tokens").value(1024))
                .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));

        String content = client.generate("extract please");

        assertThat(content).isEqualTo("[{\"bucket\": \"Revenue\", \"value\": 10}]");
        server.verify();
    }

    @Test
    void modelOverrideIsSent() {
        server.expect(requestTo(API_URL))
                .andExpect(jsonPath("$.model").value("other-model"))
                .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));

        client.generate("prompt", "other-model");

        server.verify();
    }

    @Test
    void serverErrorBecomesTextGenerationException() {
        server.expect(requestTo(API_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> client.generate("prompt"))
                .isInstanceOf(TextGenerationException.class)
                .hasMessageStartingWith("Failed to call Groq API");
    }

    @Test
    void emptyCompletionIsAFailure() {
        server.expect(requestTo(API_URL))
                .andRespond(withSuccess("{\"id\": \"chatcmpl-2\", \"choices\": []}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.generate("prompt"))
                .isInstanceOf(TextGenerationException.class)
                .hasMessageContaining("empty completion");
    }

    @Test
    void missingApiKeyFailsWithoutCallingTheService() {
        ReflectionTestUtils.setField(client, "apiKey", "");

        assertThatThrownBy(() -> client.generate("prompt"))
                .isInstanceOf(TextGenerationException.class)
                .hasMessageContaining("API key");
        server.verify();
    }
}
