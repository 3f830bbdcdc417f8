package com.finFlow.sankeyDemo.extraction.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for loading and validating the fallback pattern table.
 */
class FallbackPatternTableTest {

    @Test
    void defaultResourceCoversEveryExtractableKey() {
        FallbackPatternTable table = FallbackPatternTable.load(FallbackPatternTable.DEFAULT_RESOURCE);

        for (TaxonomyKey key : TaxonomyKey.extractable()) {
            assertThat(table.patternsFor(key)).as(key.getLabel()).isNotEmpty();
        }
        assertThat(table.patternsFor(TaxonomyKey.PRODUCTS)).hasSize(2);
        assertThat(table.patternsFor(TaxonomyKey.NET_INCOME)).hasSize(3);
    }

    @Test
    void derivedKeysHaveNoPatterns() {
        FallbackPatternTable table = FallbackPatternTable.load(FallbackPatternTable.DEFAULT_RESOURCE);

        assertThat(table.patternsFor(TaxonomyKey.EBIT)).isEmpty();
        assertThat(table.patternsFor(TaxonomyKey.EBT)).isEmpty();
    }

    @Test
    void patternsKeepTheirDeclaredOrder() {
        FallbackPatternTable table = FallbackPatternTable.load(FallbackPatternTable.DEFAULT_RESOURCE);

        assertThat(table.patternsFor(TaxonomyKey.REVENUE).get(0).pattern()).startsWith("(?:Total\\s+)?Revenue");
        assertThat(table.patternsFor(TaxonomyKey.REVENUE).get(1).pattern()).startsWith("Net\\s+sales");
    }

    @Test
    void unknownLabelIsRejected() {
        assertThatThrownBy(() -> FallbackPatternTable.fromLabels(Map.of("Goodwill", List.of("Goodwill"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Goodwill");
    }

    @Test
    void incompleteTableIsRejected() {
        assertThatThrownBy(() -> FallbackPatternTable.fromLabels(Map.of("Products", List.of("Products"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No fallback patterns");
    }

    @Test
    void missingResourceFailsToLoad() {
        assertThatThrownBy(() -> FallbackPatternTable.load("extraction/missing.json"))
                .isInstanceOf(IllegalStateException.class);
    }
}
