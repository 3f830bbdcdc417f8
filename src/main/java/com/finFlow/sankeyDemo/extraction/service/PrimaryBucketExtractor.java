package com.finFlow.sankeyDemo.extraction.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finFlow.sankeyDemo.extraction.model.BucketSet;
import com.finFlow.sankeyDemo.extraction.model.ExtractionResult;
import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;
import com.finFlow.sankeyDemo.extraction.prompt.BucketExtractionPrompt;
import com.finFlow.sankeyDemo.extraction.prompt.RevenueBreakdownPrompt;
import com.finFlow.sankeyDemo.extraction.util.LlmResponseCleaner;
import com.finFlow.sankeyDemo.llm.TextGenerationClient;
import com.finFlow.sankeyDemo.llm.exception.TextGenerationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Service for model-based bucket extraction.
 *
 * Handles:
 * - Full taxonomy extraction from a financial summary
 * - The narrower Products / Services breakdown requested during reconciliation
 * - Decoding the model's JSON array into a bucket set, or reporting why it is unusable
 *
 * Generation failures are not handled here: they propagate as {@link TextGenerationException}
 * so the caller decides between falling back and aborting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PrimaryBucketExtractor {

    private static final Set<TaxonomyKey> BREAKDOWN_KEYS = EnumSet.of(TaxonomyKey.PRODUCTS, TaxonomyKey.SERVICES);

    private final TextGenerationClient textGenerationClient;
    private final ObjectMapper objectMapper;

    /**
     * Asks the model for every extractable taxonomy entry.
     *
     * @param summaryText Financial summary
     * @param model Model override, or null for the default
     * @return Usable bucket set, or unusable with the reason
     * @throws TextGenerationException if the generation call fails
     */
    public ExtractionResult extract(String summaryText, String model) {
        String response = textGenerationClient.generate(BucketExtractionPrompt.build(summaryText), model);
        return decode(response, EnumSet.copyOf(TaxonomyKey.extractable()));
    }

    /**
     * Asks the model for the Products / Services split only.
     *
     * @param summaryText Financial summary
     * @param model Model override, or null for the default
     * @return Bucket set holding at most Products and Services, or unusable
     * @throws TextGenerationException if the generation call fails
     */
    public ExtractionResult extractRevenueBreakdown(String summaryText, String model) {
        String response = textGenerationClient.generate(RevenueBreakdownPrompt.build(summaryText), model);
        return decode(response, BREAKDOWN_KEYS);
    }

    /**
     * Decodes a raw model response.
     *
     * Unusable when the response is empty, no array is found, the array does not parse, an element is not an object,
     * any value is not numeric, or every value is exactly zero. Labels outside {@code accepted}
     * are dropped; a repeated label keeps its first value; missing labels default to 0.0.
     *
     * @param rawResponse Raw response text
     * @param accepted Keys this request may fill
     * @return Extraction result
     */
    ExtractionResult decode(String rawResponse, Collection<TaxonomyKey> accepted) {
        if (rawResponse == null || rawResponse.isBlank()) {
            return unusable("empty response");
        }
        log.debug("Decoding model response - length: {}", rawResponse.length());

        String cleaned = LlmResponseCleaner.stripMarkdown(rawResponse);
        Optional<String> arrayText = LlmResponseCleaner.extractJsonArray(cleaned);
        if (arrayText.isEmpty()) {
            return unusable("no JSON array found in response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(arrayText.get());
        } catch (JsonProcessingException e) {
            return unusable("malformed JSON: " + e.getOriginalMessage());
        }

        if (root == null || !root.isArray()) {
            return unusable("decoded value is not an array");
        }
        if (root.isEmpty()) {
            return unusable("empty array");
        }

        Map<TaxonomyKey, Double> values = new EnumMap<>(TaxonomyKey.class);
        boolean anyNonZero = false;

        for (JsonNode element : root) {
            if (!element.isObject()) {
                return unusable("array element is not an object: " + element);
            }

            JsonNode valueNode = element.get("value");
            double value = 0.0;
            if (valueNode != null) {
                if (!valueNode.isNumber()) {
                    return unusable("non-numeric value for bucket " + element.path("bucket").asText("?"));
                }
                value = valueNode.asDouble();
            }
            if (value != 0.0) {
                anyNonZero = true;
            }

            String label = element.path("bucket").asText(null);
            Optional<TaxonomyKey> key = TaxonomyKey.fromLabel(label).filter(accepted::contains);
            if (key.isEmpty()) {
                log.debug("Dropping unknown bucket from model output: {}", label);
                continue;
            }
            if (values.putIfAbsent(key.get(), value) != null) {
                log.debug("Ignoring repeated bucket in model output: {}", label);
            }
        }

        if (!anyNonZero) {
            return unusable("every decoded value is zero");
        }

        log.debug("Decoded model output - buckets: {}", values.size());
        return ExtractionResult.usable(BucketSet.of(values));
    }

    private ExtractionResult unusable(String reason) {
        log.warn("Model output unusable: {}", reason);
        return ExtractionResult.unusable(reason);
    }
}
