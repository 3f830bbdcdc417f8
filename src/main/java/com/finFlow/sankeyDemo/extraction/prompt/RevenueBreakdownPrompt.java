package com.finFlow.sankeyDemo.extraction.prompt;

import com.finFlow.sankeyDemo.extraction.model.TaxonomyKey;

import java.util.List;

/**
 * Narrow prompt asking only for the Products / Services split of revenue.
 * 
 * Used during reconciliation when Revenue is known but a component is missing.
 */
public class RevenueBreakdownPrompt {

    private static final List<TaxonomyKey> COMPONENTS = List.of(TaxonomyKey.PRODUCTS, TaxonomyKey.SERVICES);

    private RevenueBreakdownPrompt() {}

    public static String build(String summaryText) {
        return """
            As a financial analyst, analyze this 10-K summary to determine the breakdown of
            revenue between Products and Services. If exact figures aren't provided, estimate
            based on percentages or context clues. Format your response as a JSON array with
            ONLY these two values in millions of dollars:
            %s
            
            %s
            """.formatted(BucketExtractionPrompt.responseTemplate(COMPONENTS), summaryText);
    }
}
