package com.finFlow.sankeyDemo.extraction.service;

import com.finFlow.sankeyDemo.extraction.model.BucketSet;
import com.finFlow.sankeyDemo.extraction.model.ExtractionOutcome;
import com.finFlow.sankeyDemo.extraction.model.ExtractionPath;
import com.finFlow.sankeyDemo.extraction.model.ExtractionResult;
import com.finFlow.sankeyDemo.llm.exception.TextGenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Chooses between model extraction and the regex fallback.
 *
 * The model result is used whenever it is usable. An unusable result always falls back.
 * A failed generation call falls back only when
 * {@code sankey.extraction.fallback-on-generation-failure} is enabled; otherwise it is rethrown.
 */
@Slf4j
@Service
public class BucketExtractionService {

    private final PrimaryBucketExtractor primaryBucketExtractor;
    private final FallbackBucketExtractor fallbackBucketExtractor;
    private final boolean fallbackOnGenerationFailure;

    public BucketExtractionService(PrimaryBucketExtractor primaryBucketExtractor,
                                   FallbackBucketExtractor fallbackBucketExtractor,
                                   @Value("${sankey.extraction.fallback-on-generation-failure:true}") boolean fallbackOnGenerationFailure) {
        this.primaryBucketExtractor = primaryBucketExtractor;
        this.fallbackBucketExtractor = fallbackBucketExtractor;
        this.fallbackOnGenerationFailure = fallbackOnGenerationFailure;
    }

    /**
     * Extracts raw buckets from a financial summary.
     *
     * @param summaryText Financial summary
     * @param model Model override, or null
     * @return Buckets and the path that produced them
     * @throws TextGenerationException if generation fails and fallback on failure is disabled
     */
    public ExtractionOutcome extract(String summaryText, String model) {
        ExtractionResult result;
        try {
            result = primaryBucketExtractor.extract(summaryText, model);
        } catch (TextGenerationException e) {
            if (!fallbackOnGenerationFailure) {
                throw e;
            }
            log.error("Model extraction failed, using pattern fallback", e);
            return fallback(summaryText);
        }

        if (!result.isUsable()) {
            log.warn("Model extraction unusable ({}), using pattern fallback", result.getUnusableReason());
            return fallback(summaryText);
        }

        log.info("Extraction completed - path: {}", ExtractionPath.PRIMARY);
        return new ExtractionOutcome(result.getBuckets(), ExtractionPath.PRIMARY);
    }

    private ExtractionOutcome fallback(String summaryText) {
        BucketSet buckets = fallbackBucketExtractor.extract(summaryText);
        log.info("Extraction completed - path: {}", ExtractionPath.FALLBACK);
        return new ExtractionOutcome(buckets, ExtractionPath.FALLBACK);
    }
}
