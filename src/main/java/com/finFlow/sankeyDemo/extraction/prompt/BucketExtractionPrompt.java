package com.finFlow.sankeyDemo.extraction.prompt;

import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt for extracting the full bucket taxonomy from a 10-K financial summary.
 * 
 * The response format lists every extractable taxonomy label, so the model's
 * output can be mapped back without fuzzy matching.
 */
public class BucketExtractionPrompt {

    private BucketExtractionPrompt() {}

    /**
     * Builds the extraction prompt for the given summary.
     *
     * @param summaryText Financial summary derived from the filing
     * @return Complete prompt text
     */
    public static String build(String summaryText) {
        return """
            # Financial Data Extraction Task
            
            You are a financial analyst specializing in SEC filings and corporate financial statements.
            Extract precise financial data from the text below, which comes from a company's
            annual report (10-K filing).
            
            ## Instructions
            1. Locate the following annual line items in the financial summary
            2. Extract the exact numerical values as they appear in the text
            3. Convert all values to millions of dollars
            4. Pay special attention to units (million vs. billion) and adjust accordingly
            5. For any value not explicitly mentioned, use 0.0
            6. If multiple years are mentioned, extract the most recent year only
            
            ## Required Financial Data Points
            %s
            
            ## Response Format
            Respond ONLY with a valid JSON array with this exact structure:
            %s
            
            ## Financial Summary Text
            %s
            
            Return ONLY the JSON array with no additional commentary or explanation.
            """.formatted(
                lineItems(TaxonomyKey.extractable()),
                responseTemplate(TaxonomyKey.extractable()),
                summaryText);
    }

    /**
     * Bullet list of the labels to extract.
     */
    static String lineItems(List<TaxonomyKey> keys) {
        return keys.stream()
                .map(key -> "- " + key.getLabel())
                .collect(Collectors.joining("\n"));
    }

    /**
     * JSON array template with one zero-valued entry per label.
     */
    static String responseTemplate(List<TaxonomyKey> keys) {
        return keys.stream()
                .map(key -> "  {\"bucket\":\"" + key.getLabel() + "\",\"value\":0.0}")
                .collect(Collectors.joining(",\n", "[\n", "\n]"));
    }
}
