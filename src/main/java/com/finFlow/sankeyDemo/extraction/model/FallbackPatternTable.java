package com.finFlow.sankeyDemo.extraction.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.finFlow.sankeyDemo.util.JsonFileLoader;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable table of ordered label-synonym patterns per extractable taxonomy key.
 * 
 * Each label pattern is completed with a shared value capture: group 1 is the numeric
 * literal, group 2 the optional unit. Matching is case-insensitive.
 */
public final class FallbackPatternTable {

    public static final String DEFAULT_RESOURCE = "extraction/fallback-patterns.json";

    static final String VALUE_CAPTURE = "[^0-9$]*\\$?([\\d,]+(?:\\.\\d+)?)(?:\\s*(billion|million|bn|mn|b|m)\\b)?";

    private final Map<TaxonomyKey, List<Pattern>> patterns;

    private FallbackPatternTable(Map<TaxonomyKey, List<Pattern>> patterns) {
        this.patterns = Collections.unmodifiableMap(patterns);
    }

    /**
     * Loads the table from a classpath JSON object mapping taxonomy labels to label patterns.
     *
     * @throws IllegalStateException if the resource is missing or does not cover the taxonomy
     */
    public static FallbackPatternTable load(String resourcePath) {
        try {
            Map<String, List<String>> byLabel = JsonFileLoader.loadAsObject(resourcePath, new TypeReference<>() {});
            return fromLabels(byLabel);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load fallback patterns from " + resourcePath, e);
        }
    }

    /**
     * Builds a table from label patterns keyed by taxonomy label.
     * Every extractable key must have at least one pattern; unknown labels are rejected.
     */
    public static FallbackPatternTable fromLabels(Map<String, List<String>> byLabel) {
        EnumMap<TaxonomyKey, List<Pattern>> compiled = new EnumMap<>(TaxonomyKey.class);
        byLabel.forEach((label, labelPatterns) -> {
            TaxonomyKey key = TaxonomyKey.fromLabel(label)
                    .orElseThrow(() -> new IllegalStateException("Unknown taxonomy label in fallback patterns: " + label));
            compiled.put(key, labelPatterns.stream()
                    .map(FallbackPatternTable::compile)
                    .toList());
        });

        for (TaxonomyKey key : TaxonomyKey.extractable()) {
            List<Pattern> keyPatterns = compiled.get(key);
            if (keyPatterns == null || keyPatterns.isEmpty()) {
                throw new IllegalStateException("No fallback patterns for taxonomy label: " + key.getLabel());
            }
        }
        return new FallbackPatternTable(compiled);
    }

    private static Pattern compile(String labelPattern) {
        return Pattern.compile(labelPattern + VALUE_CAPTURE, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Patterns for a key in priority order; empty for keys that are never extracted.
     */
    public List<Pattern> patternsFor(TaxonomyKey key) {
        return patterns.getOrDefault(key, List.of());
    }
}
