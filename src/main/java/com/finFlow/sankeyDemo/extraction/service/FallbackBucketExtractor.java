package com.finFlow.sankeyDemo.extraction.service;

import com.finFlow.sankeyDemo.extraction.model.BucketSet;
import com.finFlow.sankeyDemo.extraction.model.FallbackPatternTable;
import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;
import com.finFlow.sankeyDemo.extraction.util.ValueParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic regex extraction of the bucket taxonomy, used when model extraction is unusable.
 * 
 * For each key the patterns are tried in order against the first occurrence in the text.
 * The first pattern whose captured literal parses wins, even when it parses to 0.0.
 * A literal that does not parse moves on to the next pattern; no match at all leaves 0.0.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FallbackBucketExtractor {

    private final FallbackPatternTable patternTable;

    /**
     * Extracts every taxonomy key from the text.
     *
     * @param summaryText Source text
     * @return Fully populated bucket set
     */
    public BucketSet extract(String summaryText) {
        String text = summaryText == null ? "" : summaryText;
        Map<TaxonomyKey, Double> values = new EnumMap<>(TaxonomyKey.class);

        for (TaxonomyKey key : TaxonomyKey.extractable()) {
            OptionalDouble value = matchFirst(key, patternTable.patternsFor(key), text);
            if (value.isPresent()) {
                log.debug("Fallback match - bucket: {}, value: {} million", key.getLabel(), value.getAsDouble());
                values.put(key, value.getAsDouble());
            } else {
                values.put(key, 0.0);
            }
        }

        long found = values.values().stream().filter(v -> v != 0.0).count();
        log.info("Fallback extraction completed - non-zero buckets: {}/{}", found, values.size());
        return BucketSet.of(values);
    }

    private OptionalDouble matchFirst(TaxonomyKey key, List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                continue;
            }
            OptionalDouble parsed = ValueParser.parse(matcher.group(1), matcher.group(2));
            if (parsed.isPresent()) {
                return parsed;
            }
            log.debug("Fallback literal did not parse - bucket: {}, literal: '{}'", key.getLabel(), matcher.group(1));
        }
        return OptionalDouble.empty();
    }
}
