package com.finFlow.sankeyDemo.extraction.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finFlow.sankeyDemo.extraction.model.ExtractionOutcome;
import com.finFlow.sankeyDemo.extraction.model.ExtractionPath;
import com.finFlow.sankeyDemo.extraction.model.FallbackPatternTable;
import com.finFlow.sankeyDemo.llm.TextGenerationClient;
import com.finFlow.sankeyDemo.llm.exception.TextGenerationException;
import org.junit.jupiter.api.Test;

import static com.finFlow.sankeyDemo.extraction.model.TaxonomyKey.NET_INCOME;
import static com.finFlow.sankeyDemo.extraction.model.TaxonomyKey.REVENUE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for choosing between model and pattern extraction.
 */
class BucketExtractionServiceTest {

    private static final String SUMMARY = "Total revenue was $900 million. Net income was $80 million.";

    private static final TextGenerationClient UNAVAILABLE = (prompt, model) -> {
        throw new TextGenerationException("service unavailable");
    };

    private BucketExtractionService serviceWith(TextGenerationClient client, boolean fallbackOnFailure) {
        return new BucketExtractionService(
                new PrimaryBucketExtractor(client, new ObjectMapper()),
                new FallbackBucketExtractor(FallbackPatternTable.load(FallbackPatternTable.DEFAULT_RESOURCE)),
                fallbackOnFailure);
    }

    @Test
    void usableModelOutputIsUsed() {
        BucketExtractionService service = serviceWith(
                (prompt, model) -> "[{\"bucket\": \"Revenue\", \"value\": 950}]", true);

        ExtractionOutcome outcome = service.extract(SUMMARY, null);

        assertThat(outcome.path()).isEqualTo(ExtractionPath.PRIMARY);
        assertThat(outcome.buckets().value(REVENUE)).isEqualTo(950.0);
    }

    @Test
    void unusableModelOutputFallsBackToPatterns() {
        BucketExtractionService service = serviceWith((prompt, model) -> "[]", false);

        ExtractionOutcome outcome = service.extract(SUMMARY, null);

        assertThat(outcome.path()).isEqualTo(ExtractionPath.FALLBACK);
        assertThat(outcome.buckets().value(REVENUE)).isEqualTo(900.0);
        assertThat(outcome.buckets().value(NET_INCOME)).isEqualTo(80.0);
    }

    @Test
    void generationFailureFallsBackWhenEnabled() {
        ExtractionOutcome outcome = serviceWith(UNAVAILABLE, true).extract(SUMMARY, null);

        assertThat(outcome.path()).isEqualTo(ExtractionPath.FALLBACK);
        assertThat(outcome.buckets().value(REVENUE)).isEqualTo(900.0);
    }

    @Test
    void generationFailureIsRethrownWhenFallbackDisabled() {
        BucketExtractionService service = serviceWith(UNAVAILABLE, false);

        assertThatThrownBy(() -> service.extract(SUMMARY, null))
                .isInstanceOf(TextGenerationException.class);
    }
}
